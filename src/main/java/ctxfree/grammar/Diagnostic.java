package ctxfree.grammar;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A report produced by analysis, normalization or parsing.
 *
 * Carries the offending non terminals, terminals and productions so that a presentation layer
 * can format it without parsing the message.
 */
public final class Diagnostic implements Serializable {

	public enum Severity {
		ERROR, WARNING, INFO
	}

	public enum Kind {
		UNDEFINED_SYMBOL(Severity.ERROR),
		INVALID_GRAMMAR(Severity.ERROR),
		EPSILON_PRODUCTION(Severity.ERROR),
		CYCLIC_PRODUCTION(Severity.ERROR),
		LEFT_RECURSION(Severity.INFO),
		/** left recursion detection ran on a grammar with epsilon productions */
		LEFT_RECURSION_APPROXIMATE(Severity.WARNING),
		/** epsilon productions were replaced by their nullable free variants */
		EPSILON_ELIMINATED(Severity.INFO),
		DEAD_NON_TERMINAL(Severity.WARNING),
		NON_GENERATING(Severity.WARNING),
		UNREACHABLE(Severity.WARNING),
		NOT_LL1(Severity.ERROR),
		NON_TERMINATING_FACTORIZATION(Severity.ERROR),
		UNEXPECTED_TOKEN(Severity.ERROR),
		TRAILING_INPUT(Severity.ERROR),
		NO_APPLICABLE_PRODUCTION(Severity.ERROR),
		EXPANSION_LIMIT(Severity.ERROR);

		public final Severity severity;

		Kind(Severity severity) {
			this.severity = severity;
		}
	}

	public final Kind kind;

	public final String message;

	public final ImmutableList<NonTerminal> nonTerminals;

	public final ImmutableList<Terminal> terminals;

	public final ImmutableList<Production> productions;

	public Diagnostic(Kind kind, String message, Collection<NonTerminal> nonTerminals,
	                  Collection<Terminal> terminals, Collection<Production> productions) {
		this.kind = Objects.requireNonNull(kind);
		this.message = Objects.requireNonNull(message);
		this.nonTerminals = ImmutableList.copyOf(nonTerminals);
		this.terminals = ImmutableList.copyOf(terminals);
		this.productions = ImmutableList.copyOf(productions);
	}

	public Diagnostic(Kind kind, String message) {
		this(kind, message, Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
	}

	public static Diagnostic about(Kind kind, String message, NonTerminal... nonTerminals){
		return new Diagnostic(kind, message, ImmutableList.copyOf(nonTerminals), Collections.emptyList(),
				Collections.emptyList());
	}

	public Severity severity(){
		return kind.severity;
	}

	public boolean isError(){
		return kind.severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		return String.format("[%s %s] %s", severity(), kind, message);
	}
}
