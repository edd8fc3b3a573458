package ctxfree.lexer;

import ctxfree.grammar.Terminal;

/**
 * A token produced by a lexer: the terminal it belongs to, the matched text and its source location.
 */
public class Token {

	/**
	 * Type of the token, {@link Terminal#EOF} for the end of input.
	 */
	public final Terminal terminal;

	/**
	 * Matched text.
	 */
	public final String value;

	public final Location location;

	public Token(Terminal terminal, String value, Location location){
		this.terminal = terminal;
		this.value = value;
		this.location = location;
	}

	public static Token eof(Location location){
		return new Token(Terminal.EOF, "", location);
	}

	public boolean isEOF(){
		return terminal.isEOF();
	}

	public boolean isTerminal(Terminal terminal){
		return this.terminal.equals(terminal);
	}

	@Override
	public String toString() {
		if (isEOF()){
			return terminal + location.toString();
		}
		return terminal + location.toString() + "(" + value + ")";
	}
}
