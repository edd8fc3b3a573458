package ctxfree.lexer;


/**
 * A simple interface for a pull lexer. After the last token it returns an end of input token
 * (see {@link Token#eof(Location)}) on every call.
 */
public interface Lexer {

	/**
	 * Get the current token (calls next() if no token has been read before).
	 */
	Token cur();

	/**
	 * Read another token and return it.
	 */
	Token next();
}
