package ctxfree.grammar;

import ctxfree.CtxFreeException;

/**
 * Failure of a grammar validation, analysis or transformation step.
 */
public class GrammarException extends CtxFreeException {

	public GrammarException(Diagnostic diagnostic) {
		super(diagnostic);
	}
}
