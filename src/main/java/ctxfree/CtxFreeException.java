package ctxfree;

import ctxfree.grammar.Diagnostic;

/**
 * Base class of all failures signaled by this library. Each carries the diagnostic that describes it.
 */
public class CtxFreeException extends RuntimeException {

	public final Diagnostic diagnostic;

	public CtxFreeException(Diagnostic diagnostic) {
		super(diagnostic.message);
		this.diagnostic = diagnostic;
	}
}
