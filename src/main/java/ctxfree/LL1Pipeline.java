package ctxfree;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import ctxfree.analysis.GrammarProperties;
import ctxfree.analysis.LeftRecursionError;
import ctxfree.analysis.PropertyAnalyzer;
import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.TransformedGrammar;
import ctxfree.parser.ll.LL1TableBuilder;
import ctxfree.parser.ll.PredictionTable;
import ctxfree.transform.CNFConverter;
import ctxfree.transform.LeftFactorer;
import ctxfree.transform.LeftRecursionEliminator;

/**
 * Prepares a grammar for LL(1) parsing: analysis, removal of left recursion (if requested), left
 * factoring and construction of the prediction table.
 *
 * Fail fast: the first failing stage ends the run, its diagnostic is the failure of the result.
 */
public class LL1Pipeline {

	private static final Logger LOG = Logger.getLogger(LL1Pipeline.class.getName());

	/**
	 * What to do with a grammar that is detected to be left recursive
	 */
	public enum LeftRecursionPolicy {
		ELIMINATE,
		/** fail with a {@link LeftRecursionError} */
		REJECT
	}

	private final LeftRecursionPolicy policy;

	private final LeftFactorer factorer;

	public LL1Pipeline() {
		this(LeftRecursionPolicy.ELIMINATE);
	}

	public LL1Pipeline(LeftRecursionPolicy policy) {
		this(policy, new LeftFactorer());
	}

	public LL1Pipeline(LeftRecursionPolicy policy, LeftFactorer factorer) {
		this.policy = policy;
		this.factorer = factorer;
	}

	public PipelineResult run(Grammar grammar){
		List<Diagnostic> diagnostics = new ArrayList<>();
		TransformedGrammar current = TransformedGrammar.unchanged(grammar);
		try {
			LOG.fine("Analyzing grammar");
			GrammarProperties properties = new PropertyAnalyzer(grammar).analyze();
			diagnostics.addAll(properties.diagnostics);
			if (properties.isLeftRecursive()){
				if (policy == LeftRecursionPolicy.REJECT){
					throw new LeftRecursionError(properties.leftRecursive);
				}
				current = eliminateLeftRecursion(current);
			}
			LOG.fine("Left factoring");
			current = current.andThen(factorer.factor(current.grammar));
			LOG.fine("Building the prediction table");
			PredictionTable table = new LL1TableBuilder(current.grammar).build();
			diagnostics.addAll(current.diagnostics);
			return PipelineResult.success(current, table, diagnostics);
		} catch (CtxFreeException ex){
			LOG.warning(() -> "LL(1) preparation failed: " + ex.diagnostic);
			diagnostics.addAll(current.diagnostics);
			diagnostics.add(ex.diagnostic);
			return PipelineResult.failure(current, diagnostics, ex.diagnostic);
		}
	}

	/**
	 * The eliminator needs an epsilon free grammar, epsilons are eliminated first if necessary.
	 */
	private TransformedGrammar eliminateLeftRecursion(TransformedGrammar current){
		if (current.grammar.hasEpsilonProductions()){
			LOG.fine("Eliminating epsilon productions before removing left recursion");
			CNFConverter converter = new CNFConverter();
			current = current.andThen(converter.decoupleStart(current.grammar));
			current = current.andThen(converter.eliminateEpsilons(current.grammar));
		}
		LOG.fine("Removing left recursion");
		return current.andThen(new LeftRecursionEliminator().eliminate(current.grammar));
	}
}
