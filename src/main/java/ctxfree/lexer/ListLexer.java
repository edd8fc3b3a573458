package ctxfree.lexer;

import java.util.ArrayList;
import java.util.List;

import ctxfree.grammar.Terminal;

/**
 * Lexer that returns the tokens of a list.
 */
public class ListLexer implements Lexer {

	private final List<Token> tokens;

	private final Token eofToken;

	private int current = -1;

	public ListLexer(List<Token> tokens){
		this.tokens = new ArrayList<>();
		for (Token token : tokens) {
			if (token.isEOF()){
				break;
			}
			this.tokens.add(token);
		}
		this.eofToken = Token.eof(new Location(1, this.tokens.size() + 1));
	}

	/**
	 * Creates a lexer for a sequence of terminal names, the i-th token is located at column i + 1.
	 */
	public static ListLexer of(String... terminalNames){
		List<Token> tokens = new ArrayList<>();
		for (int i = 0; i < terminalNames.length; i++) {
			tokens.add(new Token(new Terminal(terminalNames[i]), terminalNames[i], new Location(1, i + 1)));
		}
		return new ListLexer(tokens);
	}

	public static ListLexer ofTerminals(List<Terminal> terminals){
		List<Token> tokens = new ArrayList<>();
		for (int i = 0; i < terminals.size(); i++) {
			tokens.add(new Token(terminals.get(i), terminals.get(i).name(), new Location(1, i + 1)));
		}
		return new ListLexer(tokens);
	}

	/**
	 * Creates a lexer that treats every character of the input as a token.
	 */
	public static ListLexer ofChars(String input){
		String[] names = new String[input.length()];
		for (int i = 0; i < names.length; i++) {
			names[i] = String.valueOf(input.charAt(i));
		}
		return of(names);
	}

	@Override
	public Token cur() {
		if (current == -1){
			return next();
		}
		return tokenAt(current);
	}

	@Override
	public Token next() {
		if (current < tokens.size()){
			current++;
		}
		return tokenAt(current);
	}

	private Token tokenAt(int index){
		return index < tokens.size() ? tokens.get(index) : eofToken;
	}
}
