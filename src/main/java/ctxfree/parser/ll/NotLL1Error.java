package ctxfree.parser.ll;

import java.util.Arrays;
import java.util.Collections;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.GrammarException;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Terminal;

/**
 * Two productions compete for the same prediction table cell.
 */
public class NotLL1Error extends GrammarException {

	public final NonTerminal nonTerminal;

	public final Terminal lookahead;

	public final Production first;

	public final Production second;

	public NotLL1Error(NonTerminal nonTerminal, Terminal lookahead, Production first, Production second) {
		super(diagnostic(nonTerminal, lookahead, first, second));
		this.nonTerminal = nonTerminal;
		this.lookahead = lookahead;
		this.first = first;
		this.second = second;
	}

	static Diagnostic diagnostic(NonTerminal nonTerminal, Terminal lookahead, Production first, Production second){
		return new Diagnostic(Diagnostic.Kind.NOT_LL1,
				String.format("Not LL(1): conflict between %s and %s for %s at lookahead token %s",
						first, second, nonTerminal, lookahead),
				Collections.singletonList(nonTerminal), Collections.singletonList(lookahead),
				Arrays.asList(first, second));
	}
}
