package ctxfree.grammar;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Maps non terminals introduced by transformations to the symbol they were created for.
 *
 * The origin is a non terminal for most transformations and a terminal for the non terminals that
 * CNF conversion introduces to wrap terminals.
 */
public final class Provenance implements Serializable {

	private static final Provenance EMPTY = new Provenance(ImmutableMap.of());

	private final ImmutableMap<NonTerminal, Symbol> origins;

	private Provenance(Map<NonTerminal, Symbol> origins) {
		this.origins = ImmutableMap.copyOf(origins);
	}

	public static Provenance empty(){
		return EMPTY;
	}

	public boolean isFresh(NonTerminal nonTerminal){
		return origins.containsKey(nonTerminal);
	}

	/**
	 * Direct origin of a fresh non terminal, the non terminal itself if it isn't fresh.
	 */
	public Symbol directOriginOf(NonTerminal nonTerminal){
		return origins.getOrDefault(nonTerminal, nonTerminal);
	}

	/**
	 * Follows the origin chain back to a symbol that wasn't introduced by a transformation.
	 */
	public Symbol originOf(NonTerminal nonTerminal){
		Symbol current = nonTerminal;
		while (current instanceof NonTerminal && origins.containsKey(current)){
			current = origins.get(current);
		}
		return current;
	}

	public ImmutableMap<NonTerminal, Symbol> asMap(){
		return origins;
	}

	/**
	 * Provenance of applying the transformation of this provenance and then the one of the passed.
	 */
	public Provenance andThen(Provenance later){
		if (later.origins.isEmpty()){
			return this;
		}
		Map<NonTerminal, Symbol> merged = new LinkedHashMap<>(origins);
		merged.putAll(later.origins);
		return new Provenance(merged);
	}

	public static Builder builder(){
		return new Builder();
	}

	@Override
	public String toString() {
		return origins.toString();
	}

	public static class Builder {

		private final Map<NonTerminal, Symbol> origins = new LinkedHashMap<>();

		public Builder record(NonTerminal fresh, Symbol origin){
			origins.put(fresh, origin);
			return this;
		}

		public Provenance build(){
			return origins.isEmpty() ? EMPTY : new Provenance(origins);
		}
	}
}
