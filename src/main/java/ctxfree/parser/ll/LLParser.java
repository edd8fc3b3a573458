package ctxfree.parser.ll;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

import ctxfree.Config;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.Terminal;
import ctxfree.lexer.Lexer;
import ctxfree.lexer.ListLexer;
import ctxfree.lexer.Token;

/**
 * Table driven predictive parser. Reports the first error, there is no error recovery.
 *
 * The stack starts as <pre>[EOF, start]</pre>, terminals on top are matched against the current
 * token, non terminals are replaced by the body of the production the table predicts for the
 * current token. Reaching EOF on the stack with exhausted input accepts.
 */
public class LLParser {

	private static final Logger LOG = Logger.getLogger(LLParser.class.getName());

	private final PredictionTable table;

	/**
	 * Maximum number of expansions without consuming a token
	 */
	private final int expansionLimit;

	public LLParser(PredictionTable table){
		this(table, Config.parserExpansionLimit());
	}

	public LLParser(PredictionTable table, int expansionLimit){
		this.table = table;
		this.expansionLimit = expansionLimit;
	}

	public ParseResult parse(List<Token> tokens){
		return parse(new ListLexer(tokens));
	}

	public ParseResult parse(Lexer lexer){
		List<Production> trace = new ArrayList<>();
		try {
			run(lexer, trace);
			LOG.fine(() -> String.format("Accepted input with %d derivation steps", trace.size()));
			return ParseResult.accept(trace);
		} catch (ParseError error){
			LOG.fine(() -> "Rejected input: " + error.getMessage());
			return ParseResult.reject(error, trace);
		}
	}

	private void run(Lexer lexer, List<Production> trace){
		Deque<Symbol> stack = new ArrayDeque<>();
		stack.push(Terminal.EOF);
		stack.push(table.grammar().getStart());
		Token current = lexer.cur();
		int position = 0;
		int expansions = 0;
		while (true) {
			Symbol top = stack.pop();
			switch (top.kind()) {
				case TERMINAL:
					Terminal terminal = (Terminal) top;
					if (terminal.isEOF()){
						if (current.isEOF()){
							return;
						}
						throw new TrailingInputError(current, position);
					}
					if (!current.isTerminal(terminal)){
						throw new UnexpectedTokenError(terminal, current, position);
					}
					current = lexer.next();
					position++;
					expansions = 0;
					break;
				case NON_TERMINAL:
					NonTerminal nonTerminal = (NonTerminal) top;
					Production production = table.get(nonTerminal, current.terminal);
					if (production == null){
						throw new NoApplicableProductionError(nonTerminal, current, position,
								table.expectedTerminals(nonTerminal));
					}
					if (++expansions > expansionLimit){
						throw new ExpansionLimitError(nonTerminal, current, position, expansionLimit);
					}
					trace.add(production);
					for (int i = production.right.size() - 1; i >= 0; i--){
						stack.push(production.right.get(i));
					}
					break;
				case EPSILON:
					break;
			}
		}
	}
}
