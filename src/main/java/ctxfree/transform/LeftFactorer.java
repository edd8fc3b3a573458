package ctxfree.transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import ctxfree.Config;
import ctxfree.grammar.FreshNames;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Provenance;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.TransformedGrammar;

/**
 * Rewrites a grammar so that no two alternatives of a non terminal start with the same symbol.
 *
 * Alternatives <pre>A → α β1 | … | α βn</pre> that share the longest common prefix α are replaced by
 * <pre>A → α A#k</pre> with <pre>A#k → β1 | … | βn</pre> (an empty βi becomes ε), fresh non terminals
 * are factored the same way.
 */
public class LeftFactorer {

	private static final Logger LOG = Logger.getLogger(LeftFactorer.class.getName());

	private final int boundFactor;

	public LeftFactorer() {
		this(Config.factoringBoundFactor());
	}

	/**
	 * @param boundFactor the nesting depth of fresh non terminals and the number of factoring steps
	 *                    are bounded by this factor times the grammar size
	 */
	public LeftFactorer(int boundFactor) {
		this.boundFactor = boundFactor;
	}

	/**
	 * @throws NonTerminatingFactorizationError if the bound is exceeded
	 */
	public TransformedGrammar factor(Grammar grammar){
		int bound = boundFactor * grammar.size();
		GrammarBuilder builder = grammar.toBuilder();
		FreshNames names = new FreshNames(grammar);
		Provenance.Builder provenance = Provenance.builder();
		Map<NonTerminal, Integer> depths = new HashMap<>();
		Deque<NonTerminal> worklist = new ArrayDeque<>(grammar.getNonTerminals());
		int steps = 0;
		while (!worklist.isEmpty()){
			NonTerminal current = worklist.poll();
			List<List<Symbol>> group;
			while ((group = firstGroupWithCommonLeadingSymbol(builder.alternatives(current))) != null){
				int depth = depths.getOrDefault(current, 0) + 1;
				steps++;
				if (depth > bound || steps > bound){
					throw new NonTerminatingFactorizationError(current, bound);
				}
				NonTerminal fresh = names.numbered(current);
				provenance.record(fresh, current);
				depths.put(fresh, depth);
				factorGroup(builder, current, group, fresh);
				worklist.add(fresh);
			}
		}
		Grammar result = builder.toGrammar(grammar.getStart());
		int factoringSteps = steps;
		LOG.fine(() -> String.format("Left factoring introduced %d non terminals", factoringSteps));
		return new TransformedGrammar(result, provenance.build());
	}

	/**
	 * Alternatives that start with the leading symbol that is shared first (in alternative order),
	 * null if all leading symbols are distinct.
	 */
	private List<List<Symbol>> firstGroupWithCommonLeadingSymbol(List<List<Symbol>> alternatives){
		Map<Symbol, List<List<Symbol>>> groups = new LinkedHashMap<>();
		for (List<Symbol> alternative : alternatives) {
			if (!alternative.isEmpty()){
				groups.computeIfAbsent(alternative.get(0), s -> new ArrayList<>()).add(alternative);
			}
		}
		for (List<List<Symbol>> group : groups.values()) {
			if (group.size() > 1){
				return group;
			}
		}
		return null;
	}

	private void factorGroup(GrammarBuilder builder, NonTerminal current, List<List<Symbol>> group,
	                         NonTerminal fresh){
		int prefixLength = commonPrefixLength(group);
		List<Symbol> first = group.get(0);
		List<Symbol> factored = new ArrayList<>(first.subList(0, prefixLength));
		factored.add(fresh);
		List<List<Symbol>> alternatives = new ArrayList<>();
		for (List<Symbol> alternative : builder.alternatives(current)) {
			if (alternative.equals(first)){
				alternatives.add(factored);
			} else if (!group.contains(alternative)){
				alternatives.add(alternative);
			}
		}
		List<List<Symbol>> suffixes = new ArrayList<>();
		for (List<Symbol> alternative : group) {
			suffixes.add(alternative.subList(prefixLength, alternative.size()));
		}
		builder.replace(current, alternatives);
		builder.replace(fresh, suffixes);
		LOG.fine(() -> String.format("Factored %s out of %s into %s", first.subList(0, prefixLength), current, fresh));
	}

	private int commonPrefixLength(List<List<Symbol>> group){
		List<Symbol> first = group.get(0);
		int length = first.size();
		for (List<Symbol> other : group) {
			int i = 0;
			while (i < length && i < other.size() && first.get(i).equals(other.get(i))){
				i++;
			}
			length = i;
		}
		return length;
	}
}
