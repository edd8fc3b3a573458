package ctxfree.grammar;

/**
 * The empty word. Only valid as the sole element of a production body.
 */
public final class Epsilon extends Symbol {

	public static final Epsilon INSTANCE = new Epsilon();

	private Epsilon() {
	}

	@Override
	public Kind kind() {
		return Kind.EPSILON;
	}

	@Override
	public String name() {
		return "ε";
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Epsilon;
	}

	@Override
	public int hashCode() {
		return 0;
	}

	private Object readResolve() {
		return INSTANCE;
	}
}
