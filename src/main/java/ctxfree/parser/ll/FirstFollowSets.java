package ctxfree.parser.ll;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ctxfree.analysis.PropertyAnalyzer;
import ctxfree.grammar.Epsilon;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.Terminal;

/**
 * FIRST(1) and FOLLOW(1) sets of a grammar, computed eagerly by iterating over all productions
 * until no set changes anymore.
 */
public class FirstFollowSets {

	private final Grammar grammar;

	private final Set<NonTerminal> nullable;

	private final Map<NonTerminal, Set<Terminal>> first = new HashMap<>();

	private final Map<NonTerminal, Set<Terminal>> follow = new HashMap<>();

	public FirstFollowSets(Grammar grammar) {
		this.grammar = grammar;
		this.nullable = new PropertyAnalyzer(grammar).nullable();
		calculateFirst1Sets();
		calculateFollow1Sets();
	}

	/**
	 * FIRST(A) is the union of FIRST(α) for every production <pre>A → α</pre>.
	 */
	private void calculateFirst1Sets(){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean firstChanged;
		do {
			firstChanged = false;
			for (Production production : grammar.getProductions()) {
				if (first.get(production.left).addAll(firstTerminals(production.right))){
					firstChanged = true;
				}
			}
		} while (firstChanged);
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * First put $ (the end of input marker) in Follow(S) (S is the start symbol)
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b) except for ε is placed in FOLLOW(B).
	 * If there is a production A → aB, then everything in FOLLOW(A) is in FOLLOW(B)
	 * If there is a production A → aBb, where FIRST(b) contains ε, then everything in FOLLOW(A) is in FOLLOW(B)
	 */
	private void calculateFollow1Sets(){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		follow.get(grammar.getStart()).add(Terminal.EOF);
		boolean followChanged;
		do {
			followChanged = false;
			for (Production production : grammar.getProductions()) {
				// FOLLOW(A) and FIRST of everything right of the current position
				Set<Terminal> trailer = new LinkedHashSet<>(follow.get(production.left));
				for (int i = production.right.size() - 1; i >= 0; i--){
					Symbol symbol = production.right.get(i);
					if (symbol.isNonTerminal()){
						NonTerminal rightPart = (NonTerminal) symbol;
						if (follow.get(rightPart).addAll(trailer)){
							followChanged = true;
						}
						if (!nullable.contains(rightPart)){
							trailer.clear();
						}
						trailer.addAll(first.get(rightPart));
					} else {
						trailer.clear();
						trailer.add((Terminal) symbol);
					}
				}
			}
		} while (followChanged);
	}

	public Grammar getGrammar(){
		return grammar;
	}

	public Set<Terminal> first(NonTerminal nonTerminal){
		return Collections.unmodifiableSet(first.get(nonTerminal));
	}

	/**
	 * FIRST of a sequence of symbols, contains {@link Epsilon#INSTANCE} iff the whole sequence is nullable.
	 */
	public Set<Symbol> first(List<Symbol> sequence){
		Set<Symbol> ret = new LinkedHashSet<>(firstTerminals(sequence));
		if (isNullable(sequence)){
			ret.add(Epsilon.INSTANCE);
		}
		return ret;
	}

	/**
	 * FIRST of a sequence of symbols without epsilon.
	 */
	public Set<Terminal> firstTerminals(List<Symbol> sequence){
		Set<Terminal> ret = new LinkedHashSet<>();
		for (Symbol symbol : sequence) {
			switch (symbol.kind()) {
				case TERMINAL:
					ret.add((Terminal) symbol);
					return ret;
				case NON_TERMINAL:
					ret.addAll(first.get(symbol));
					if (!nullable.contains(symbol)){
						return ret;
					}
					break;
				case EPSILON:
					break;
			}
		}
		return ret;
	}

	public boolean isNullable(NonTerminal nonTerminal){
		return nullable.contains(nonTerminal);
	}

	public boolean isNullable(List<Symbol> sequence){
		for (Symbol symbol : sequence) {
			if (symbol.isTerminal() || (symbol.isNonTerminal() && !nullable.contains(symbol))){
				return false;
			}
		}
		return true;
	}

	/**
	 * FOLLOW(A), contains {@link Terminal#EOF} if the end of input can follow.
	 */
	public Set<Terminal> follow(NonTerminal nonTerminal){
		return Collections.unmodifiableSet(follow.get(nonTerminal));
	}

	/**
	 * Lookahead terminals for which the production should be applied: FIRST(α), plus FOLLOW(A) if
	 * α is nullable.
	 */
	public Set<Terminal> predict(Production production){
		Set<Terminal> ret = firstTerminals(production.right);
		if (isNullable(production.right)){
			ret.addAll(follow.get(production.left));
		}
		return ret;
	}
}
