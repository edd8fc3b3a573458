package ctxfree;

import ctxfree.grammar.Diagnostic;
import ctxfree.lexer.Location;
import ctxfree.lexer.Token;

public class LocatedCtxFreeException extends CtxFreeException {

	public final Token errorToken;
	public final Location errorLocation;
	/**
	 * Index of the error token in the input token sequence
	 */
	public final int position;

	public LocatedCtxFreeException(Token errorToken, int position, Diagnostic diagnostic) {
		super(diagnostic);
		this.errorToken = errorToken;
		this.position = position;
		if (errorToken != null) {
			this.errorLocation = errorToken.location;
		} else {
			this.errorLocation = new Location(0, 0);
		}
	}
}
