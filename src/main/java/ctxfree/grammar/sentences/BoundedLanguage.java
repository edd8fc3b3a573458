package ctxfree.grammar.sentences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import ctxfree.grammar.Grammar;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.Terminal;

/**
 * All words of a grammar's language up to a maximum length.
 *
 * Every non terminal gets the set of terminal strings of length at most k that it derives, the sets
 * grow by applying all productions until none changes. The sets are finite, so this terminates for
 * every grammar, including cyclic ones and ones with epsilon productions.
 */
public class BoundedLanguage {

	private final Grammar grammar;

	private final int maxLength;

	private final Map<NonTerminal, Set<List<Terminal>>> words = new LinkedHashMap<>();

	public BoundedLanguage(Grammar grammar, int maxLength) {
		this.grammar = grammar;
		this.maxLength = maxLength;
		calculate();
	}

	/**
	 * Words of length at most {@code maxLength} that the start non terminal derives.
	 */
	public static Set<List<Terminal>> enumerate(Grammar grammar, int maxLength){
		return new BoundedLanguage(grammar, maxLength).words();
	}

	private void calculate(){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			words.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean changed;
		do {
			changed = false;
			for (Production production : grammar.getProductions()) {
				if (words.get(production.left).addAll(concatenations(production.right))){
					changed = true;
				}
			}
		} while (changed);
	}

	/**
	 * Concatenations of the currently known words of the symbols, longer ones are pruned.
	 */
	private Set<List<Terminal>> concatenations(List<Symbol> body){
		Set<List<Terminal>> partials = new LinkedHashSet<>();
		partials.add(ImmutableList.of());
		for (Symbol symbol : body) {
			Set<List<Terminal>> next = new LinkedHashSet<>();
			switch (symbol.kind()) {
				case TERMINAL:
					for (List<Terminal> partial : partials) {
						if (partial.size() < maxLength){
							next.add(append(partial, Collections.singletonList((Terminal) symbol)));
						}
					}
					break;
				case NON_TERMINAL:
					for (List<Terminal> partial : partials) {
						for (List<Terminal> suffix : words.get(symbol)) {
							if (partial.size() + suffix.size() <= maxLength){
								next.add(append(partial, suffix));
							}
						}
					}
					break;
				case EPSILON:
					next.addAll(partials);
					break;
			}
			partials = next;
			if (partials.isEmpty()){
				break;
			}
		}
		return partials;
	}

	private static List<Terminal> append(List<Terminal> first, List<Terminal> second){
		List<Terminal> ret = new ArrayList<>(first.size() + second.size());
		ret.addAll(first);
		ret.addAll(second);
		return ImmutableList.copyOf(ret);
	}

	public Set<List<Terminal>> words(){
		return wordsOf(grammar.getStart());
	}

	public Set<List<Terminal>> wordsOf(NonTerminal nonTerminal){
		return Collections.unmodifiableSet(words.get(nonTerminal));
	}

	public boolean contains(List<Terminal> word){
		return words.get(grammar.getStart()).contains(ImmutableList.copyOf(word));
	}

	/**
	 * Renders words as strings by concatenating terminal names, useful for single character terminals.
	 */
	public static Set<String> asStrings(Set<List<Terminal>> words){
		Set<String> ret = new LinkedHashSet<>();
		for (List<Terminal> word : words) {
			StringBuilder builder = new StringBuilder();
			for (Terminal terminal : word) {
				builder.append(terminal.name());
			}
			ret.add(builder.toString());
		}
		return ret;
	}
}
