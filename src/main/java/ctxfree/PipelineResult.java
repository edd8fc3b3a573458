package ctxfree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.Provenance;
import ctxfree.grammar.TransformedGrammar;
import ctxfree.parser.ll.LLParser;
import ctxfree.parser.ll.PredictionTable;

/**
 * Outcome of {@link LL1Pipeline#run(Grammar)}.
 */
public final class PipelineResult {

	/**
	 * Grammar after the last successful stage
	 */
	public final Grammar grammar;

	public final Provenance provenance;

	/**
	 * null if the run failed
	 */
	public final PredictionTable table;

	/**
	 * Everything reported during the run, including the failure
	 */
	public final ImmutableList<Diagnostic> diagnostics;

	/**
	 * null if the run succeeded
	 */
	public final Diagnostic failure;

	private PipelineResult(TransformedGrammar transformed, PredictionTable table, List<Diagnostic> diagnostics,
	                       Diagnostic failure){
		this.grammar = transformed.grammar;
		this.provenance = transformed.provenance;
		this.table = table;
		this.diagnostics = ImmutableList.copyOf(diagnostics);
		this.failure = failure;
	}

	static PipelineResult success(TransformedGrammar transformed, PredictionTable table, List<Diagnostic> diagnostics){
		return new PipelineResult(transformed, table, diagnostics, null);
	}

	static PipelineResult failure(TransformedGrammar transformed, List<Diagnostic> diagnostics, Diagnostic failure){
		return new PipelineResult(transformed, null, diagnostics, failure);
	}

	public boolean isSuccess(){
		return failure == null;
	}

	/**
	 * @throws CtxFreeException with the failure diagnostic if the run failed
	 */
	public LLParser parser(){
		if (!isSuccess()){
			throw new CtxFreeException(failure);
		}
		return new LLParser(table);
	}

	@Override
	public String toString() {
		if (isSuccess()){
			return grammar + "\n" + table;
		}
		return "Failed: " + failure;
	}
}
