package ctxfree.analysis;

import java.util.Collections;
import java.util.Set;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.GrammarException;
import ctxfree.grammar.NonTerminal;

/**
 * Unit productions form a cycle <pre>A ⇒+ A</pre> where a step forbids it.
 */
public class CyclicProductionError extends GrammarException {

	public CyclicProductionError(Set<NonTerminal> cyclic) {
		super(diagnostic(cyclic));
	}

	static Diagnostic diagnostic(Set<NonTerminal> cyclic){
		return new Diagnostic(Diagnostic.Kind.CYCLIC_PRODUCTION,
				String.format("Unit productions form cycles through %s", cyclic),
				cyclic, Collections.emptyList(), Collections.emptyList());
	}
}
