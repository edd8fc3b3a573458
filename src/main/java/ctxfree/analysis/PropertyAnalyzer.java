package ctxfree.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Symbol;

/**
 * Computes structural properties of a grammar: nullable, cyclic, left recursive, dead, non generating
 * and unreachable non terminals.
 *
 * All sets are computed lazily, cached and returned in the declaration order of the grammar.
 */
public class PropertyAnalyzer {

	private static final Logger LOG = Logger.getLogger(PropertyAnalyzer.class.getName());

	private final Grammar grammar;

	private Set<NonTerminal> nullable;
	private Set<NonTerminal> generating;
	private Set<NonTerminal> cyclic;
	private Set<NonTerminal> leftRecursive;

	public PropertyAnalyzer(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Calculate the non terminals that can derive epsilon.
	 *
	 * Worklist algorithm: every production counts its symbols that aren't known to be nullable yet,
	 * a production whose count drops to zero makes its head nullable. Productions containing a
	 * terminal never count down.
	 */
	public Set<NonTerminal> nullable(){
		if (nullable != null){
			return nullable;
		}
		Set<NonTerminal> epsSet = new LinkedHashSet<>();
		Deque<NonTerminal> worklist = new ArrayDeque<>();
		Map<NonTerminal, List<Production>> occurrences = new HashMap<>();
		Map<Production, Integer> remaining = new HashMap<>();
		for (Production production : grammar.getProductions()) {
			if (!production.terminals.isEmpty()){
				continue;
			}
			remaining.put(production, production.rightSize());
			for (NonTerminal nonTerminal : production.nonTerminals) {
				occurrences.computeIfAbsent(nonTerminal, n -> new ArrayList<>()).add(production);
			}
			if (production.isEpsilonProduction() && epsSet.add(production.left)){
				worklist.add(production.left);
			}
		}
		while (!worklist.isEmpty()){
			NonTerminal current = worklist.poll();
			for (Production production : occurrences.getOrDefault(current, Collections.emptyList())) {
				int left = remaining.get(production) - 1;
				remaining.put(production, left);
				if (left == 0 && epsSet.add(production.left)){
					worklist.add(production.left);
				}
			}
		}
		nullable = inDeclarationOrder(epsSet);
		return nullable;
	}

	public boolean isNullable(List<Symbol> symbols){
		Set<NonTerminal> epsSet = nullable();
		for (Symbol symbol : symbols) {
			if (!symbol.isEpsilon() && !epsSet.contains(symbol)){
				return false;
			}
		}
		return true;
	}

	/**
	 * Non terminals that derive at least one terminal string, computed like {@link #nullable()} but
	 * only counting non terminal occurrences.
	 */
	public Set<NonTerminal> generating(){
		if (generating != null){
			return generating;
		}
		Set<NonTerminal> gen = new LinkedHashSet<>();
		Deque<NonTerminal> worklist = new ArrayDeque<>();
		Map<NonTerminal, List<Production>> occurrences = new HashMap<>();
		Map<Production, Integer> remaining = new HashMap<>();
		for (Production production : grammar.getProductions()) {
			remaining.put(production, production.nonTerminals.size());
			for (NonTerminal nonTerminal : production.nonTerminals) {
				occurrences.computeIfAbsent(nonTerminal, n -> new ArrayList<>()).add(production);
			}
			if (production.nonTerminals.isEmpty() && gen.add(production.left)){
				worklist.add(production.left);
			}
		}
		while (!worklist.isEmpty()){
			NonTerminal current = worklist.poll();
			for (Production production : occurrences.getOrDefault(current, Collections.emptyList())) {
				int left = remaining.get(production) - 1;
				remaining.put(production, left);
				if (left == 0 && gen.add(production.left)){
					worklist.add(production.left);
				}
			}
		}
		generating = inDeclarationOrder(gen);
		return generating;
	}

	public Set<NonTerminal> nonGenerating(){
		Set<NonTerminal> ret = new LinkedHashSet<>(grammar.getNonTerminals());
		ret.removeAll(generating());
		return ret;
	}

	/**
	 * Non terminals reachable from the start non terminal.
	 */
	public Set<NonTerminal> reachable(){
		Set<NonTerminal> reached = new LinkedHashSet<>();
		Deque<NonTerminal> worklist = new ArrayDeque<>();
		reached.add(grammar.getStart());
		worklist.add(grammar.getStart());
		while (!worklist.isEmpty()){
			for (Production production : grammar.getProductionsOf(worklist.poll())) {
				for (NonTerminal nonTerminal : production.nonTerminals) {
					if (reached.add(nonTerminal)){
						worklist.add(nonTerminal);
					}
				}
			}
		}
		return inDeclarationOrder(reached);
	}

	public Set<NonTerminal> unreachable(){
		Set<NonTerminal> ret = new LinkedHashSet<>(grammar.getNonTerminals());
		ret.removeAll(reachable());
		return ret;
	}

	/**
	 * Non terminals without any production.
	 */
	public Set<NonTerminal> dead(){
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			if (grammar.getProductionsOf(nonTerminal).isEmpty()){
				ret.add(nonTerminal);
			}
		}
		return ret;
	}

	/**
	 * All non terminals that take part in a cycle of unit productions <pre>A ⇒+ A</pre>.
	 */
	public Set<NonTerminal> cyclic(){
		if (cyclic == null){
			cyclic = inDeclarationOrder(SymbolGraphs.verticesOnCycles(SymbolGraphs.unitGraph(grammar)));
		}
		return cyclic;
	}

	/**
	 * Non terminals with a production <pre>A → A α</pre>.
	 */
	public Set<NonTerminal> directlyLeftRecursive(){
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (Production production : grammar.getProductions()) {
			if (production.left.equals(production.leadingSymbol())){
				ret.add(production.left);
			}
		}
		return ret;
	}

	/**
	 * Non terminals on a cycle of the leftmost non terminal graph (direct and indirect left recursion).
	 *
	 * Only exact for epsilon free grammars: with epsilon productions, recursion hidden behind
	 * nullable prefixes (<pre>A → B A</pre> with nullable <pre>B</pre>) isn't found.
	 * Check {@link #isLeftRecursionDetectionExact()}.
	 */
	public Set<NonTerminal> leftRecursive(){
		if (leftRecursive == null){
			if (!isLeftRecursionDetectionExact()){
				LOG.warning(() -> "Left recursion detection on a grammar with epsilon productions "
						+ "is an under-approximation: " + grammar.getEpsilonProductions());
			}
			leftRecursive = inDeclarationOrder(SymbolGraphs.verticesOnCycles(SymbolGraphs.leftmostGraph(grammar)));
		}
		return leftRecursive;
	}

	public boolean isLeftRecursionDetectionExact(){
		return !grammar.hasEpsilonProductions();
	}

	/**
	 * Runs all analyses and bundles their results and diagnostics.
	 */
	public GrammarProperties analyze(){
		List<Diagnostic> diagnostics = new ArrayList<>();
		Set<NonTerminal> dead = dead();
		for (NonTerminal nonTerminal : dead) {
			diagnostics.add(Diagnostic.about(Diagnostic.Kind.DEAD_NON_TERMINAL,
					String.format("%s has no productions", nonTerminal), nonTerminal));
		}
		for (NonTerminal nonTerminal : nonGenerating()) {
			if (!dead.contains(nonTerminal)){
				diagnostics.add(Diagnostic.about(Diagnostic.Kind.NON_GENERATING,
						String.format("%s derives no terminal string", nonTerminal), nonTerminal));
			}
		}
		for (NonTerminal nonTerminal : unreachable()) {
			diagnostics.add(Diagnostic.about(Diagnostic.Kind.UNREACHABLE,
					String.format("%s is unreachable from %s", nonTerminal, grammar.getStart()), nonTerminal));
		}
		if (!cyclic().isEmpty()){
			diagnostics.add(CyclicProductionError.diagnostic(cyclic()));
		}
		Set<NonTerminal> direct = directlyLeftRecursive();
		for (NonTerminal nonTerminal : leftRecursive()) {
			diagnostics.add(Diagnostic.about(Diagnostic.Kind.LEFT_RECURSION,
					String.format("%s is %s left recursive", nonTerminal,
							direct.contains(nonTerminal) ? "directly" : "indirectly"), nonTerminal));
		}
		if (!isLeftRecursionDetectionExact()){
			diagnostics.add(new Diagnostic(Diagnostic.Kind.LEFT_RECURSION_APPROXIMATE,
					"Grammar has epsilon productions, left recursion behind nullable prefixes is not detected",
					Collections.emptyList(), Collections.emptyList(), grammar.getEpsilonProductions()));
		}
		return new GrammarProperties(nullable(), cyclic(), leftRecursive(), direct,
				isLeftRecursionDetectionExact(), dead, nonGenerating(), unreachable(), diagnostics);
	}

	private Set<NonTerminal> inDeclarationOrder(Set<NonTerminal> set){
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			if (set.contains(nonTerminal)){
				ret.add(nonTerminal);
			}
		}
		return Collections.unmodifiableSet(ret);
	}
}
