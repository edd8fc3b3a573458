package ctxfree.parser.ll;

import java.util.Collections;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Terminal;
import ctxfree.lexer.Token;

/**
 * The start non terminal has been derived completely but the input isn't exhausted.
 */
public class TrailingInputError extends ParseError {

	public TrailingInputError(Token token, int position) {
		super(token, position, new Diagnostic(Diagnostic.Kind.TRAILING_INPUT,
				String.format("Trailing input %s at position %d", token, position),
				Collections.emptyList(), Collections.singletonList(Terminal.EOF), Collections.emptyList()));
	}
}
