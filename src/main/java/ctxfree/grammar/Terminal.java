package ctxfree.grammar;

import java.util.Objects;

/**
 * A terminal symbol
 */
public final class Terminal extends Symbol {

	/**
	 * End of input marker, used in follow sets and prediction tables. Never part of a grammar.
	 */
	public static final Terminal EOF = new Terminal("$", true);

	private final String name;

	private final boolean eof;

	public Terminal(String name) {
		this(name, false);
	}

	private Terminal(String name, boolean eof) {
		this.name = Objects.requireNonNull(name);
		this.eof = eof;
	}

	@Override
	public Kind kind() {
		return Kind.TERMINAL;
	}

	@Override
	public String name() {
		return name;
	}

	public boolean isEOF(){
		return eof;
	}

	@Override
	public int compareTo(Symbol o) {
		if (o instanceof Terminal && eof != ((Terminal) o).eof){
			return eof ? 1 : -1;
		}
		return super.compareTo(o);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Terminal)){
			return false;
		}
		Terminal other = (Terminal) obj;
		return eof == other.eof && name.equals(other.name);
	}

	@Override
	public int hashCode() {
		return eof ? -1 : name.hashCode();
	}

	@Override
	public String toString() {
		return eof ? "<EOF>" : name;
	}
}
