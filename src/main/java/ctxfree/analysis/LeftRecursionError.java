package ctxfree.analysis;

import java.util.Collections;
import java.util.Set;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.GrammarException;
import ctxfree.grammar.NonTerminal;

/**
 * Left recursion was detected and the caller chose not to eliminate it.
 */
public class LeftRecursionError extends GrammarException {

	public final Set<NonTerminal> leftRecursive;

	public LeftRecursionError(Set<NonTerminal> leftRecursive) {
		super(new Diagnostic(Diagnostic.Kind.LEFT_RECURSION,
				String.format("Grammar is left recursive in %s", leftRecursive),
				leftRecursive, Collections.emptyList(), Collections.emptyList()));
		this.leftRecursive = leftRecursive;
	}
}
