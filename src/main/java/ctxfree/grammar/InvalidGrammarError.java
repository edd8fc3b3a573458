package ctxfree.grammar;

/**
 * A grammar model violates one of the structural invariants (start declared, disjoint symbol sets,
 * epsilon only as a whole body, no duplicate bodies).
 */
public class InvalidGrammarError extends GrammarException {

	public InvalidGrammarError(String message) {
		super(new Diagnostic(Diagnostic.Kind.INVALID_GRAMMAR, message));
	}

	public InvalidGrammarError(String message, NonTerminal nonTerminal) {
		super(Diagnostic.about(Diagnostic.Kind.INVALID_GRAMMAR, message, nonTerminal));
	}
}
