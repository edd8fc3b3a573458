package ctxfree.parser.ll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Terminal;
import ctxfree.lexer.Token;

/**
 * The prediction table has no entry for the non terminal on top of the stack and the current token.
 */
public class NoApplicableProductionError extends ParseError {

	public final NonTerminal nonTerminal;

	/**
	 * Terminals for which the table has a production of {@link #nonTerminal}
	 */
	public final ImmutableSet<Terminal> expected;

	public NoApplicableProductionError(NonTerminal nonTerminal, Token token, int position, Set<Terminal> expected) {
		super(token, position, diagnostic(nonTerminal, token, position, expected));
		this.nonTerminal = nonTerminal;
		this.expected = ImmutableSet.copyOf(expected);
	}

	private static Diagnostic diagnostic(NonTerminal nonTerminal, Token token, int position, Set<Terminal> expected){
		List<Terminal> sorted = new ArrayList<>(expected);
		Collections.sort(sorted);
		return new Diagnostic(Diagnostic.Kind.NO_APPLICABLE_PRODUCTION,
				String.format("Unexpected %s at position %d, no production of %s applies, expected one of %s",
						token, position, nonTerminal, sorted),
				Collections.singletonList(nonTerminal), sorted, Collections.emptyList());
	}
}
