package ctxfree.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols, non terminal symbols and epsilon.
 *
 * The set of subclasses is closed: {@link Terminal}, {@link NonTerminal} and {@link Epsilon}
 * are the only ones, consumers switch on {@link #kind()}.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	public enum Kind {
		TERMINAL, NON_TERMINAL, EPSILON
	}

	Symbol() {
	}

	public abstract Kind kind();

	/**
	 * Identifier of the symbol, opaque for everything but printing and ordering.
	 */
	public abstract String name();

	public boolean isTerminal(){
		return kind() == Kind.TERMINAL;
	}

	public boolean isNonTerminal(){
		return kind() == Kind.NON_TERMINAL;
	}

	public boolean isEpsilon(){
		return kind() == Kind.EPSILON;
	}

	@Override
	public int compareTo(Symbol o) {
		int cmp = kind().compareTo(o.kind());
		if (cmp != 0){
			return cmp;
		}
		return name().compareTo(o.name());
	}

	@Override
	public String toString() {
		return name();
	}
}
