package ctxfree.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;

import ctxfree.analysis.PropertyAnalyzer;
import ctxfree.analysis.SymbolGraphs;
import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.FreshNames;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Provenance;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.Terminal;
import ctxfree.grammar.TransformedGrammar;

/**
 * Converts a grammar into Chomsky normal form: every production has the form <pre>A → B C</pre>
 * or <pre>A → a</pre>, the start non terminal may additionally have an epsilon production if the
 * language contains the empty word.
 *
 * The stages are available separately, {@link #convert(Grammar)} runs them in the only order that
 * produces a correct result: start decoupling, epsilon elimination, unit elimination, removal of
 * useless symbols, TERM and BIN.
 */
public class CNFConverter {

	private static final Logger LOG = Logger.getLogger(CNFConverter.class.getName());

	public TransformedGrammar convert(Grammar grammar){
		TransformedGrammar result = decoupleStart(grammar);
		result = result.andThen(eliminateEpsilons(result.grammar));
		result = result.andThen(eliminateUnitProductions(result.grammar));
		result = result.andThen(removeUselessSymbols(result.grammar));
		result = result.andThen(term(result.grammar));
		result = result.andThen(bin(result.grammar));
		Grammar converted = result.grammar;
		LOG.fine(() -> String.format("Converted grammar into CNF with %d productions", converted.getProductions().size()));
		return result;
	}

	/**
	 * Adds a new start non terminal <pre>S0 → S</pre> (assuming <pre>S</pre> is the current start
	 * non terminal), declared before all other non terminals.
	 */
	public TransformedGrammar decoupleStart(Grammar grammar){
		NonTerminal start = new FreshNames(grammar).derive(grammar.getStart().name() + "0");
		GrammarBuilder builder = new GrammarBuilder(grammar.getTerminals());
		builder.add(start, Collections.singletonList(grammar.getStart()));
		copyProductions(grammar, builder);
		return new TransformedGrammar(builder.toGrammar(start), Provenance.builder().record(start, grammar.getStart()).build());
	}

	/**
	 * Replaces every production by all variants that omit a subset of its nullable non terminals and
	 * drops all epsilon productions. The start non terminal keeps an epsilon production if it is
	 * nullable. Trivial productions <pre>A → A</pre> are dropped.
	 */
	public TransformedGrammar eliminateEpsilons(Grammar grammar){
		Set<NonTerminal> nullable = new PropertyAnalyzer(grammar).nullable();
		GrammarBuilder builder = declaringBuilder(grammar);
		for (Production production : grammar.getProductions()) {
			for (List<Symbol> variant : variantsWithoutNullables(production.right, nullable)) {
				boolean trivialUnit = variant.size() == 1 && variant.get(0).equals(production.left);
				if (!variant.isEmpty() && !trivialUnit){
					builder.add(production.left, variant);
				}
			}
		}
		if (nullable.contains(grammar.getStart())){
			builder.add(grammar.getStart(), Collections.<Symbol>emptyList());
		}
		List<Diagnostic> diagnostics = new ArrayList<>();
		List<Production> epsilonProductions = new ArrayList<>();
		for (Production production : grammar.getProductions()) {
			if (production.isEpsilonProduction() && !production.left.equals(grammar.getStart())){
				epsilonProductions.add(production);
			}
		}
		if (!epsilonProductions.isEmpty()){
			diagnostics.add(new Diagnostic(Diagnostic.Kind.EPSILON_ELIMINATED,
					String.format("Eliminated %d epsilon productions, nullable non terminals: %s",
							epsilonProductions.size(), nullable),
					nullable, Collections.emptyList(), epsilonProductions));
		}
		return new TransformedGrammar(builder.toGrammar(grammar.getStart()), Provenance.empty(), diagnostics);
	}

	private Set<List<Symbol>> variantsWithoutNullables(List<Symbol> body, Set<NonTerminal> nullable){
		List<List<Symbol>> partials = new ArrayList<>();
		partials.add(new ArrayList<>());
		for (Symbol symbol : body) {
			List<List<Symbol>> next = new ArrayList<>();
			for (List<Symbol> partial : partials) {
				List<Symbol> with = new ArrayList<>(partial);
				with.add(symbol);
				next.add(with);
				if (nullable.contains(symbol)){
					next.add(partial);
				}
			}
			partials = next;
		}
		return new LinkedHashSet<>(partials);
	}

	/**
	 * Replaces the unit productions of every non terminal <pre>A</pre> by the non unit productions of
	 * all <pre>B</pre> with <pre>A ⇒* B</pre>.
	 */
	public TransformedGrammar eliminateUnitProductions(Grammar grammar){
		Graph<NonTerminal, DefaultEdge> unitGraph = SymbolGraphs.unitGraph(grammar);
		GrammarBuilder builder = declaringBuilder(grammar);
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			for (NonTerminal reached : SymbolGraphs.reachableFrom(unitGraph, nonTerminal)) {
				for (Production production : grammar.getProductionsOf(reached)) {
					if (!production.isUnitProduction()){
						builder.add(nonTerminal, production.right);
					}
				}
			}
		}
		return TransformedGrammar.unchanged(builder.toGrammar(grammar.getStart()));
	}

	/**
	 * Removes non generating non terminals (and the productions using them), then unreachable ones.
	 * The start non terminal is always kept.
	 */
	public TransformedGrammar removeUselessSymbols(Grammar grammar){
		Set<NonTerminal> generating = new PropertyAnalyzer(grammar).generating();
		GrammarBuilder builder = new GrammarBuilder(grammar.getTerminals());
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			if (!generating.contains(nonTerminal) && !nonTerminal.equals(grammar.getStart())){
				continue;
			}
			builder.nonTerminal(nonTerminal);
			for (Production production : grammar.getProductionsOf(nonTerminal)) {
				if (generating.containsAll(production.nonTerminals)){
					builder.add(nonTerminal, production.right);
				}
			}
		}
		Grammar generatingOnly = builder.toGrammar(grammar.getStart());
		Set<NonTerminal> reachable = new PropertyAnalyzer(generatingOnly).reachable();
		GrammarBuilder reduced = new GrammarBuilder(grammar.getTerminals());
		for (NonTerminal nonTerminal : generatingOnly.getNonTerminals()) {
			if (reachable.contains(nonTerminal)){
				reduced.nonTerminal(nonTerminal);
				for (Production production : generatingOnly.getProductionsOf(nonTerminal)) {
					reduced.add(nonTerminal, production.right);
				}
			}
		}
		Grammar result = reduced.toGrammar(grammar.getStart());
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			if (result.getNonTerminals().contains(nonTerminal)){
				continue;
			}
			if (!generating.contains(nonTerminal)){
				diagnostics.add(Diagnostic.about(Diagnostic.Kind.NON_GENERATING,
						String.format("Removed %s, it derives no terminal word", nonTerminal), nonTerminal));
			} else {
				diagnostics.add(Diagnostic.about(Diagnostic.Kind.UNREACHABLE,
						String.format("Removed %s, it is not reachable from %s", nonTerminal, grammar.getStart()),
						nonTerminal));
			}
		}
		LOG.fine(() -> String.format("Removed useless non terminals, %d → %d", grammar.getNonTerminals().size(),
				result.getNonTerminals().size()));
		return new TransformedGrammar(result, Provenance.empty(), diagnostics);
	}

	/**
	 * Replaces every terminal <pre>a</pre> in a right hand side longer than one by a new non terminal
	 * <pre>T_a → a</pre>.
	 */
	public TransformedGrammar term(Grammar grammar){
		FreshNames names = new FreshNames(grammar);
		Provenance.Builder provenance = Provenance.builder();
		Map<Terminal, NonTerminal> wrappers = new LinkedHashMap<>();
		GrammarBuilder builder = declaringBuilder(grammar);
		for (Production production : grammar.getProductions()) {
			if (production.rightSize() < 2){
				builder.add(production.left, production.right);
				continue;
			}
			List<Symbol> body = new ArrayList<>();
			for (Symbol symbol : production.right) {
				if (symbol.isTerminal()){
					Terminal terminal = (Terminal) symbol;
					NonTerminal wrapper = wrappers.get(terminal);
					if (wrapper == null){
						wrapper = names.derive("T_" + terminal.name());
						wrappers.put(terminal, wrapper);
						provenance.record(wrapper, terminal);
					}
					body.add(wrapper);
				} else {
					body.add(symbol);
				}
			}
			builder.add(production.left, body);
		}
		for (Map.Entry<Terminal, NonTerminal> entry : wrappers.entrySet()) {
			builder.add(entry.getValue(), Collections.singletonList(entry.getKey()));
		}
		return new TransformedGrammar(builder.toGrammar(grammar.getStart()), provenance.build());
	}

	/**
	 * Splits every right hand side <pre>X1 … Xn</pre> with <pre>n &gt; 2</pre> into a chain
	 * <pre>A → X1 A#1, A#1 → X2 A#2, …, A#(n-2) → X(n-1) Xn</pre>.
	 */
	public TransformedGrammar bin(Grammar grammar){
		FreshNames names = new FreshNames(grammar);
		Provenance.Builder provenance = Provenance.builder();
		GrammarBuilder builder = declaringBuilder(grammar);
		for (Production production : grammar.getProductions()) {
			List<Symbol> body = production.right;
			NonTerminal head = production.left;
			for (int i = 0; i < body.size() - 2; i++) {
				NonTerminal fresh = names.numbered(production.left);
				provenance.record(fresh, production.left);
				List<Symbol> pair = new ArrayList<>();
				pair.add(body.get(i));
				pair.add(fresh);
				builder.add(head, pair);
				head = fresh;
			}
			builder.add(head, body.subList(Math.max(0, body.size() - 2), body.size()));
		}
		return new TransformedGrammar(builder.toGrammar(grammar.getStart()), provenance.build());
	}

	/**
	 * Is every production of the form <pre>A → B C</pre> or <pre>A → a</pre>, or <pre>S → ε</pre> for
	 * a start non terminal <pre>S</pre> that isn't used in any right hand side?
	 */
	public static boolean isInChomskyNormalForm(Grammar grammar){
		boolean startUsed = grammar.isUsedInBody(grammar.getStart());
		for (Production production : grammar.getProductions()) {
			switch (production.rightSize()) {
				case 0:
					if (startUsed || !production.left.equals(grammar.getStart())){
						return false;
					}
					break;
				case 1:
					if (!production.right.get(0).isTerminal()){
						return false;
					}
					break;
				case 2:
					if (!production.terminals.isEmpty()){
						return false;
					}
					break;
				default:
					return false;
			}
		}
		return true;
	}

	/**
	 * Builder with the terminals and all non terminals of the grammar, but without productions.
	 */
	private GrammarBuilder declaringBuilder(Grammar grammar){
		GrammarBuilder builder = new GrammarBuilder(grammar.getTerminals());
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			builder.nonTerminal(nonTerminal);
		}
		return builder;
	}

	private void copyProductions(Grammar grammar, GrammarBuilder builder){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			builder.nonTerminal(nonTerminal);
			for (Production production : grammar.getProductionsOf(nonTerminal)) {
				builder.add(nonTerminal, production.right);
			}
		}
	}
}
