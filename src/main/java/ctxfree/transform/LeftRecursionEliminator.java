package ctxfree.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import ctxfree.analysis.CyclicProductionError;
import ctxfree.analysis.PropertyAnalyzer;
import ctxfree.grammar.EpsilonProductionError;
import ctxfree.grammar.FreshNames;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Provenance;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.TransformedGrammar;

/**
 * Removes direct and indirect left recursion without changing the generated language.
 *
 * Uses Paull's algorithm: the non terminals are ordered by declaration <pre>A1 … An</pre>, productions
 * <pre>Ai → Aj γ</pre> with <pre>j &lt; i</pre> are expanded by substituting every alternative of
 * <pre>Aj</pre>, afterwards the direct left recursion of <pre>Ai</pre> is removed by introducing
 * <pre>Ai'</pre>:
 * <pre>
 *   Ai  → α1 | … | αp | α1 Ai' | … | αp Ai'
 *   Ai' → β1 | … | βm | β1 Ai' | … | βm Ai'
 * </pre>
 * for <pre>Ai → Ai β1 | … | Ai βm | α1 | … | αp</pre>. The result stays epsilon free.
 *
 * The grammar has to be epsilon free (only the start non terminal may have an epsilon production and
 * only if it isn't used in any right hand side) and free of unit production cycles.
 */
public class LeftRecursionEliminator {

	private static final Logger LOG = Logger.getLogger(LeftRecursionEliminator.class.getName());

	/**
	 * @throws EpsilonProductionError if the grammar has non start epsilon productions
	 * @throws CyclicProductionError if the grammar has unit production cycles
	 */
	public TransformedGrammar eliminate(Grammar grammar){
		checkPreconditions(grammar);
		List<NonTerminal> order = new ArrayList<>(grammar.getNonTerminals());
		GrammarBuilder builder = grammar.toBuilder();
		FreshNames names = new FreshNames(grammar);
		Provenance.Builder provenance = Provenance.builder();
		for (int i = 0; i < order.size(); i++) {
			NonTerminal ai = order.get(i);
			for (int j = 0; j < i; j++) {
				substituteLeading(builder, ai, order.get(j));
			}
			eliminateDirect(builder, ai, names, provenance);
		}
		Grammar result = builder.toGrammar(grammar.getStart());
		LOG.fine(() -> String.format("Removed left recursion, %d → %d productions", grammar.getProductions().size(),
				result.getProductions().size()));
		return new TransformedGrammar(result, provenance.build());
	}

	private void checkPreconditions(Grammar grammar){
		List<Production> forbidden = new ArrayList<>();
		boolean startUsed = grammar.isUsedInBody(grammar.getStart());
		for (Production production : grammar.getEpsilonProductions()) {
			if (startUsed || !production.left.equals(grammar.getStart())){
				forbidden.add(production);
			}
		}
		if (!forbidden.isEmpty()){
			throw new EpsilonProductionError(forbidden);
		}
		Set<NonTerminal> cyclic = new PropertyAnalyzer(grammar).cyclic();
		if (!cyclic.isEmpty()){
			throw new CyclicProductionError(cyclic);
		}
	}

	/**
	 * Replaces every <pre>ai → aj γ</pre> by <pre>ai → δ γ</pre> for each alternative δ of aj.
	 */
	private void substituteLeading(GrammarBuilder builder, NonTerminal ai, NonTerminal aj){
		List<List<Symbol>> substituted = new ArrayList<>();
		boolean changed = false;
		for (List<Symbol> alternative : builder.alternatives(ai)) {
			if (!alternative.isEmpty() && alternative.get(0).equals(aj)){
				List<Symbol> gamma = alternative.subList(1, alternative.size());
				for (List<Symbol> delta : builder.alternatives(aj)) {
					substituted.add(concat(delta, gamma));
				}
				changed = true;
			} else {
				substituted.add(alternative);
			}
		}
		if (changed){
			builder.replace(ai, substituted);
		}
	}

	private void eliminateDirect(GrammarBuilder builder, NonTerminal ai, FreshNames names,
	                             Provenance.Builder provenance){
		List<List<Symbol>> betas = new ArrayList<>();
		List<List<Symbol>> alphas = new ArrayList<>();
		for (List<Symbol> alternative : builder.alternatives(ai)) {
			if (!alternative.isEmpty() && alternative.get(0).equals(ai)){
				// ai → ai adds nothing to the language
				if (alternative.size() > 1){
					betas.add(alternative.subList(1, alternative.size()));
				}
			} else {
				alphas.add(alternative);
			}
		}
		if (betas.isEmpty()){
			return;
		}
		NonTerminal fresh = names.prime(ai);
		provenance.record(fresh, ai);
		List<List<Symbol>> aiAlternatives = new ArrayList<>();
		for (List<Symbol> alpha : alphas) {
			aiAlternatives.add(alpha);
			aiAlternatives.add(concat(alpha, singleton(fresh)));
		}
		List<List<Symbol>> freshAlternatives = new ArrayList<>();
		for (List<Symbol> beta : betas) {
			freshAlternatives.add(beta);
			freshAlternatives.add(concat(beta, singleton(fresh)));
		}
		builder.replace(ai, aiAlternatives);
		builder.replace(fresh, freshAlternatives);
		LOG.fine(() -> String.format("Removed direct left recursion of %s via %s", ai, fresh));
	}

	static List<Symbol> concat(List<Symbol> first, List<Symbol> second){
		List<Symbol> ret = new ArrayList<>(first.size() + second.size());
		ret.addAll(first);
		ret.addAll(second);
		return ret;
	}

	static List<Symbol> singleton(Symbol symbol){
		List<Symbol> ret = new ArrayList<>();
		ret.add(symbol);
		return ret;
	}
}
