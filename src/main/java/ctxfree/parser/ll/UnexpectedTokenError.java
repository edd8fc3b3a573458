package ctxfree.parser.ll;

import java.util.Collections;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Terminal;
import ctxfree.lexer.Token;

/**
 * The terminal on top of the stack doesn't match the current token.
 */
public class UnexpectedTokenError extends ParseError {

	public final Terminal expected;

	public UnexpectedTokenError(Terminal expected, Token actual, int position) {
		super(actual, position, new Diagnostic(Diagnostic.Kind.UNEXPECTED_TOKEN, message(expected, actual, position),
				Collections.emptyList(), Collections.singletonList(expected), Collections.emptyList()));
		this.expected = expected;
	}

	private static String message(Terminal expected, Token actual, int position){
		if (actual.isEOF()){
			return String.format("Expected %s but reached end of input at position %d", expected, position);
		}
		return String.format("Expected %s but got %s at position %d", expected, actual, position);
	}
}
