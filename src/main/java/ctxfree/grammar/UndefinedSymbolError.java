package ctxfree.grammar;

import java.util.Collections;

/**
 * A production (or the start declaration) references a symbol that the grammar does not declare.
 */
public class UndefinedSymbolError extends GrammarException {

	public final Symbol symbol;

	public UndefinedSymbolError(Symbol symbol, Production production) {
		super(new Diagnostic(Diagnostic.Kind.UNDEFINED_SYMBOL,
				production == null ? String.format("Undefined symbol %s", symbol)
						: String.format("Undefined symbol %s in production %s", symbol, production),
				symbol instanceof NonTerminal ? Collections.singletonList((NonTerminal) symbol) : Collections.emptyList(),
				symbol instanceof Terminal ? Collections.singletonList((Terminal) symbol) : Collections.emptyList(),
				production == null ? Collections.emptyList() : Collections.singletonList(production)));
		this.symbol = symbol;
	}
}
