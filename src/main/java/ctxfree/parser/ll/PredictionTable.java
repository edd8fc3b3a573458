package ctxfree.parser.ll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import ctxfree.grammar.Grammar;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.Terminal;

/**
 * LL(1) prediction table: maps a non terminal and a lookahead terminal (or {@link Terminal#EOF})
 * to the single production that has to be applied.
 *
 * Created by {@link LL1TableBuilder}, immutable.
 */
public final class PredictionTable {

	private final Grammar grammar;

	private final ImmutableMap<NonTerminal, ImmutableMap<Terminal, Production>> table;

	PredictionTable(Grammar grammar, Map<NonTerminal, ? extends Map<Terminal, Production>> table){
		this.grammar = grammar;
		ImmutableMap.Builder<NonTerminal, ImmutableMap<Terminal, Production>> builder = ImmutableMap.builder();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			Map<Terminal, Production> row = table.get(nonTerminal);
			builder.put(nonTerminal, row == null ? ImmutableMap.of() : ImmutableMap.copyOf(row));
		}
		this.table = builder.build();
	}

	public Grammar grammar(){
		return grammar;
	}

	/**
	 * @return the production for the lookahead or null if there is none
	 */
	public Production get(NonTerminal nonTerminal, Terminal lookahead){
		ImmutableMap<Terminal, Production> row = table.get(nonTerminal);
		return row == null ? null : row.get(lookahead);
	}

	/**
	 * Lookahead terminals with an entry in the row of the non terminal.
	 */
	public Set<Terminal> expectedTerminals(NonTerminal nonTerminal){
		ImmutableMap<Terminal, Production> row = table.get(nonTerminal);
		return row == null ? ImmutableSet.of() : row.keySet();
	}

	public Set<NonTerminal> nonTerminals(){
		return table.keySet();
	}

	/**
	 * Number of filled cells.
	 */
	public int size(){
		int size = 0;
		for (ImmutableMap<Terminal, Production> row : table.values()) {
			size += row.size();
		}
		return size;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		List<NonTerminal> nonTerminals = new ArrayList<>(table.keySet());
		Collections.sort(nonTerminals);
		for (int i = 0; i < nonTerminals.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			Map<Terminal, Production> row = table.get(nonTerminals.get(i));
			builder.append(nonTerminals.get(i)).append(" = {");
			List<Terminal> terminals = new ArrayList<>(row.keySet());
			Collections.sort(terminals);
			for (Terminal terminal : terminals) {
				builder.append(" ").append(terminal).append(" = {");
				for (Symbol symbol : row.get(terminal).right){
					builder.append(" ").append(symbol);
				}
				builder.append(" }");
			}
			builder.append(" }");
		}
		return builder.toString();
	}
}
