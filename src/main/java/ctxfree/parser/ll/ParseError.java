package ctxfree.parser.ll;

import ctxfree.LocatedCtxFreeException;
import ctxfree.grammar.Diagnostic;
import ctxfree.lexer.Token;

/**
 * First failure of a parse, located at the token at the given (zero based) input position.
 */
public class ParseError extends LocatedCtxFreeException {

	public ParseError(Token errorToken, int position, Diagnostic diagnostic) {
		super(errorToken, position, diagnostic);
	}
}
