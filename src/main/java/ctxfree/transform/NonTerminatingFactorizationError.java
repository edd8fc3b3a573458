package ctxfree.transform;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.GrammarException;
import ctxfree.grammar.NonTerminal;

/**
 * Left factoring didn't reach its fixed point within the bound.
 */
public class NonTerminatingFactorizationError extends GrammarException {

	public final int bound;

	public NonTerminatingFactorizationError(NonTerminal nonTerminal, int bound) {
		super(Diagnostic.about(Diagnostic.Kind.NON_TERMINATING_FACTORIZATION,
				String.format("Left factoring of %s exceeded the bound of %d", nonTerminal, bound), nonTerminal));
		this.bound = bound;
	}
}
