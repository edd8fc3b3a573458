package ctxfree.parser.ll;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Terminal;

/**
 * Builds the LL(1) prediction table of a grammar: for every production <pre>A → α</pre> the
 * table gets an entry for every terminal in FIRST(α) and, if α is nullable, for every terminal in
 * FOLLOW(A).
 *
 * The grammar should be free of left recursion and left factored, the builder doesn't transform it.
 * Two productions for the same cell are never resolved silently.
 */
public class LL1TableBuilder {

	private static final Logger LOG = Logger.getLogger(LL1TableBuilder.class.getName());

	private final Grammar grammar;

	private final FirstFollowSets sets;

	public LL1TableBuilder(Grammar grammar) {
		this.grammar = grammar;
		this.sets = new FirstFollowSets(grammar);
	}

	/**
	 * @throws NotLL1Error for the first cell that would receive two productions
	 */
	public PredictionTable build(){
		Map<NonTerminal, Map<Terminal, Production>> table = new HashMap<>();
		for (Production production : grammar.getProductions()) {
			Map<Terminal, Production> row = table.computeIfAbsent(production.left, n -> new LinkedHashMap<>());
			for (Terminal lookahead : sets.predict(production)) {
				Production present = row.get(lookahead);
				if (present != null && !present.equals(production)){
					throw new NotLL1Error(production.left, lookahead, present, production);
				}
				row.put(lookahead, production);
			}
		}
		PredictionTable result = new PredictionTable(grammar, table);
		LOG.fine(() -> String.format("Built prediction table with %d entries", result.size()));
		return result;
	}

	/**
	 * All conflicts of the table, one diagnostic per pair of the first production of a cell and a
	 * later competing one.
	 */
	public List<Diagnostic> conflicts(){
		List<Diagnostic> conflicts = new ArrayList<>();
		Map<NonTerminal, Map<Terminal, Production>> table = new HashMap<>();
		for (Production production : grammar.getProductions()) {
			Map<Terminal, Production> row = table.computeIfAbsent(production.left, n -> new LinkedHashMap<>());
			for (Terminal lookahead : sets.predict(production)) {
				Production present = row.get(lookahead);
				if (present == null){
					row.put(lookahead, production);
				} else if (!present.equals(production)){
					conflicts.add(NotLL1Error.diagnostic(production.left, lookahead, present, production));
				}
			}
		}
		return conflicts;
	}

	public boolean isLL1(){
		return conflicts().isEmpty();
	}
}
