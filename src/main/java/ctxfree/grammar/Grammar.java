package ctxfree.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Immutable context free grammar consisting of terminals, non terminals, a start non terminal
 * and the productions of every non terminal.
 *
 * Non terminals keep their declaration order and the alternatives of a non terminal keep their
 * insertion order, every algorithm that iterates over them is therefore deterministic.
 * Transformations never modify a grammar, they create a new one (see {@link #toBuilder()}).
 *
 * Use the {@link GrammarBuilder} to build a grammar instance conveniently.
 */
public final class Grammar implements Serializable {

	private final ImmutableSet<Terminal> terminals;

	private final ImmutableSet<NonTerminal> nonTerminals;

	private final NonTerminal start;

	private final ImmutableMap<NonTerminal, ImmutableList<Production>> productions;

	/**
	 * Create a new grammar and check its invariants.
	 *
	 * @param terminals terminals of the grammar, must not contain {@link Terminal#EOF}
	 * @param nonTerminals non terminals in declaration order
	 * @param start start non terminal, has to be declared
	 * @param productions productions of each non terminal, every non terminal needs an entry
	 *                    (an empty list marks a dead non terminal)
	 * @throws UndefinedSymbolError if a production or the start uses an undeclared symbol
	 * @throws InvalidGrammarError if any other invariant is violated
	 */
	public Grammar(Set<Terminal> terminals, Set<NonTerminal> nonTerminals, NonTerminal start,
	               Map<NonTerminal, ? extends List<Production>> productions) {
		this.terminals = ImmutableSet.copyOf(terminals);
		this.nonTerminals = ImmutableSet.copyOf(nonTerminals);
		this.start = Objects.requireNonNull(start);
		ImmutableMap.Builder<NonTerminal, ImmutableList<Production>> builder = ImmutableMap.builder();
		for (NonTerminal nonTerminal : this.nonTerminals) {
			List<Production> prods = productions.get(nonTerminal);
			if (prods == null){
				throw new InvalidGrammarError(String.format("No production entry for %s", nonTerminal), nonTerminal);
			}
			builder.put(nonTerminal, ImmutableList.copyOf(prods));
		}
		this.productions = builder.build();
		for (NonTerminal nonTerminal : productions.keySet()) {
			if (!this.nonTerminals.contains(nonTerminal)){
				throw new UndefinedSymbolError(nonTerminal, null);
			}
		}
		checkInvariants();
	}

	private void checkInvariants(){
		if (terminals.contains(Terminal.EOF)){
			throw new InvalidGrammarError("The end of input marker can't be a terminal of a grammar");
		}
		Set<String> terminalNames = new HashSet<>();
		for (Terminal terminal : terminals) {
			terminalNames.add(terminal.name());
		}
		for (NonTerminal nonTerminal : nonTerminals) {
			if (terminalNames.contains(nonTerminal.name())){
				throw new InvalidGrammarError(String.format("'%s' is the name of a terminal and therefore " +
						"can't be used as a non terminal name", nonTerminal.name()), nonTerminal);
			}
		}
		if (!nonTerminals.contains(start)){
			throw new UndefinedSymbolError(start, null);
		}
		for (Map.Entry<NonTerminal, ImmutableList<Production>> entry : productions.entrySet()) {
			Set<List<Symbol>> bodies = new HashSet<>();
			for (Production production : entry.getValue()) {
				if (!production.left.equals(entry.getKey())){
					throw new InvalidGrammarError(String.format("Production %s is listed under %s",
							production, entry.getKey()), entry.getKey());
				}
				for (Symbol symbol : production.right) {
					checkSymbol(symbol, production);
				}
				if (!bodies.add(production.right)){
					throw new InvalidGrammarError(String.format("Duplicate production %s", production), production.left);
				}
			}
		}
	}

	private void checkSymbol(Symbol symbol, Production production){
		switch (symbol.kind()) {
			case TERMINAL:
				if (((Terminal) symbol).isEOF()){
					throw new InvalidGrammarError(String.format("End of input marker used in %s", production));
				}
				if (!terminals.contains(symbol)){
					throw new UndefinedSymbolError(symbol, production);
				}
				break;
			case NON_TERMINAL:
				if (!nonTerminals.contains(symbol)){
					throw new UndefinedSymbolError(symbol, production);
				}
				break;
			case EPSILON:
				throw new InvalidGrammarError(String.format("Epsilon inside the body of %s", production));
		}
	}

	public NonTerminal getStart(){
		return start;
	}

	public ImmutableSet<Terminal> getTerminals(){
		return terminals;
	}

	public ImmutableSet<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	/**
	 * Productions of the passed non terminal, in insertion order.
	 */
	public ImmutableList<Production> getProductionsOf(NonTerminal nonTerminal){
		ImmutableList<Production> prods = productions.get(nonTerminal);
		if (prods == null){
			throw new UndefinedSymbolError(nonTerminal, null);
		}
		return prods;
	}

	/**
	 * Right hand sides of the productions of the passed non terminal.
	 */
	public List<List<Symbol>> alternatives(NonTerminal nonTerminal){
		List<List<Symbol>> ret = new ArrayList<>();
		for (Production production : getProductionsOf(nonTerminal)) {
			ret.add(production.right);
		}
		return ret;
	}

	/**
	 * All productions, grouped by non terminal in declaration order.
	 */
	public List<Production> getProductions(){
		List<Production> ret = new ArrayList<>();
		for (ImmutableList<Production> prods : productions.values()) {
			ret.addAll(prods);
		}
		return ret;
	}

	public List<Production> getEpsilonProductions(){
		List<Production> ret = new ArrayList<>();
		for (Production production : getProductions()) {
			if (production.isEpsilonProduction()){
				ret.add(production);
			}
		}
		return ret;
	}

	public boolean hasEpsilonProductions(){
		return !getEpsilonProductions().isEmpty();
	}

	/**
	 * Does the passed non terminal occur in any right hand side?
	 */
	public boolean isUsedInBody(NonTerminal nonTerminal){
		for (Production production : getProductions()) {
			if (production.nonTerminals.contains(nonTerminal)){
				return true;
			}
		}
		return false;
	}

	/**
	 * Number of productions plus the summed length of all right hand sides.
	 */
	public int size(){
		int size = 0;
		for (Production production : getProductions()) {
			size += 1 + production.rightSize();
		}
		return size;
	}

	/**
	 * Names of all terminals and non terminals
	 */
	public Set<String> symbolNames(){
		Set<String> names = new HashSet<>();
		for (Terminal terminal : terminals) {
			names.add(terminal.name());
		}
		for (NonTerminal nonTerminal : nonTerminals) {
			names.add(nonTerminal.name());
		}
		return names;
	}

	/**
	 * Builder that contains all symbols and productions of this grammar.
	 */
	public GrammarBuilder toBuilder(){
		GrammarBuilder builder = new GrammarBuilder(terminals);
		for (NonTerminal nonTerminal : nonTerminals) {
			builder.nonTerminal(nonTerminal);
			for (Production production : productions.get(nonTerminal)) {
				builder.add(nonTerminal, production.right);
			}
		}
		return builder;
	}

	/**
	 * One line per non terminal (start first), like <pre>S -> a S b | ε</pre>.
	 * Dead non terminals are printed without alternatives.
	 */
	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		appendRule(builder, start);
		for (NonTerminal nonTerminal : nonTerminals) {
			if (!nonTerminal.equals(start)){
				builder.append("\n");
				appendRule(builder, nonTerminal);
			}
		}
		return builder.toString();
	}

	private void appendRule(StringBuilder builder, NonTerminal nonTerminal){
		builder.append(nonTerminal).append(" ->");
		List<Production> prods = productions.get(nonTerminal);
		for (int i = 0; i < prods.size(); i++) {
			if (i != 0){
				builder.append(" |");
			}
			builder.append(" ").append(prods.get(i).formatRightSide());
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Grammar)){
			return false;
		}
		Grammar other = (Grammar) obj;
		return start.equals(other.start) && terminals.equals(other.terminals)
				&& nonTerminals.equals(other.nonTerminals) && productions.equals(other.productions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, terminals, nonTerminals, productions);
	}
}
