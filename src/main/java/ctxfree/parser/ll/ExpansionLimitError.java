package ctxfree.parser.ll;

import java.util.Collections;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.NonTerminal;
import ctxfree.lexer.Token;

/**
 * The parser expanded more non terminals at one input position than allowed, the prediction table
 * probably comes from a grammar that isn't free of left recursion.
 */
public class ExpansionLimitError extends ParseError {

	public final int limit;

	public ExpansionLimitError(NonTerminal nonTerminal, Token token, int position, int limit) {
		super(token, position, new Diagnostic(Diagnostic.Kind.EXPANSION_LIMIT,
				String.format("More than %d expansions at position %d (%s) without consuming a token, last one of %s",
						limit, position, token, nonTerminal),
				Collections.singletonList(nonTerminal), Collections.emptyList(), Collections.emptyList()));
		this.limit = limit;
	}
}
