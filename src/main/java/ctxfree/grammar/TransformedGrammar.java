package ctxfree.grammar;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Result of a grammar transformation: the new grammar, the origins of the non terminals it introduced
 * and the diagnostics of the symbols and productions it dropped.
 */
public final class TransformedGrammar {

	public final Grammar grammar;

	public final Provenance provenance;

	public final ImmutableList<Diagnostic> diagnostics;

	public TransformedGrammar(Grammar grammar, Provenance provenance) {
		this(grammar, provenance, Collections.emptyList());
	}

	public TransformedGrammar(Grammar grammar, Provenance provenance, List<Diagnostic> diagnostics) {
		this.grammar = grammar;
		this.provenance = provenance;
		this.diagnostics = ImmutableList.copyOf(diagnostics);
	}

	public static TransformedGrammar unchanged(Grammar grammar){
		return new TransformedGrammar(grammar, Provenance.empty());
	}

	/**
	 * Combines this result with the result of a transformation that was applied to {@link #grammar}.
	 */
	public TransformedGrammar andThen(TransformedGrammar next){
		return new TransformedGrammar(next.grammar, provenance.andThen(next.provenance),
				ImmutableList.<Diagnostic>builder().addAll(diagnostics).addAll(next.diagnostics).build());
	}

	@Override
	public String toString() {
		return grammar + "\nProvenance: " + provenance;
	}
}
