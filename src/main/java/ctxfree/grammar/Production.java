package ctxfree.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A grammar production with a left and a right hand side.
 *
 * Productions are values: two productions are equal if they have the same head and the same body.
 */
public final class Production implements Serializable {

	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, never contains epsilon. An epsilon production has an
	 * empty right hand side.
	 */
	public final ImmutableList<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final ImmutableList<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final ImmutableList<Terminal> terminals;

	/**
	 * @throws InvalidGrammarError if epsilon is mixed with other symbols
	 */
	public Production(NonTerminal left, List<? extends Symbol> right) {
		this.left = Objects.requireNonNull(left);
		this.right = normalizeBody(left, right);
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : this.right) {
			switch (symbol.kind()) {
				case NON_TERMINAL:
					nonTerminals.add((NonTerminal) symbol);
					break;
				case TERMINAL:
					terminals.add((Terminal) symbol);
					break;
				case EPSILON:
					throw new AssertionError("epsilon survived normalization");
			}
		}
		this.nonTerminals = ImmutableList.copyOf(nonTerminals);
		this.terminals = ImmutableList.copyOf(terminals);
	}

	/**
	 * Turns <pre>[ε]</pre> into the empty body and rejects bodies that mix ε with other symbols.
	 */
	static ImmutableList<Symbol> normalizeBody(NonTerminal left, List<? extends Symbol> right){
		if (right.size() == 1 && right.get(0).isEpsilon()){
			return ImmutableList.of();
		}
		for (Symbol symbol : right) {
			Objects.requireNonNull(symbol);
			if (symbol.isEpsilon()){
				throw new InvalidGrammarError(String.format("Epsilon mixed with other symbols in the body of %s: %s",
						left, right));
			}
		}
		return ImmutableList.copyOf(right);
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return Epsilon.INSTANCE.toString();
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left + " → " + formatRightSide();
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Is this a production of the form <pre>A → B</pre>?
	 */
	public boolean isUnitProduction(){
		return right.size() == 1 && right.get(0).isNonTerminal();
	}

	/**
	 * First symbol of the right hand side or null for epsilon productions.
	 */
	public Symbol leadingSymbol(){
		return right.isEmpty() ? null : right.get(0);
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production) obj;
		return left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right);
	}
}
