package ctxfree.grammar;

import java.util.Objects;

/**
 * A non terminal symbol. Productions are held by the {@link Grammar}, not by the symbol.
 */
public final class NonTerminal extends Symbol {

	/**
	 * Name of the non terminal, typically uppercase
	 */
	private final String name;

	public NonTerminal(String name) {
		this.name = Objects.requireNonNull(name);
	}

	@Override
	public Kind kind() {
		return Kind.NON_TERMINAL;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof NonTerminal && ((NonTerminal) obj).name.equals(name);
	}

	@Override
	public int hashCode() {
		return 31 * name.hashCode() + 1;
	}
}
