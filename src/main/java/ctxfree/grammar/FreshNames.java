package ctxfree.grammar;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Creates non terminals with names that are not used in a grammar yet.
 *
 * Names are derived from the origin name, the same sequence of requests on the same grammar always
 * yields the same names.
 */
public class FreshNames {

	private static final String additionalNumSeparator = "#";

	private final Set<String> usedNames;

	/**
	 * For each non terminal A the last number of the additional non terminal A#NUMBER.
	 */
	private final Map<String, Integer> currentNumForNonTerminal = new HashMap<>();

	public FreshNames(Grammar grammar) {
		this.usedNames = new HashSet<>(grammar.symbolNames());
	}

	/**
	 * Returns <pre>A'</pre> for <pre>A</pre>, adds primes till the name is unused.
	 */
	public NonTerminal prime(NonTerminal origin){
		return derive(origin.name() + "'");
	}

	/**
	 * Returns the passed name if unused, otherwise appends primes.
	 */
	public NonTerminal derive(String name){
		String candidate = name;
		while (usedNames.contains(candidate)){
			candidate += "'";
		}
		usedNames.add(candidate);
		return new NonTerminal(candidate);
	}

	/**
	 * Creates a new non terminal <pre>A#n</pre>. It's name starts with the passed non terminals name
	 * (without a previous number suffix).
	 */
	public NonTerminal numbered(NonTerminal origin){
		String base = origin.name();
		int sep = base.indexOf(additionalNumSeparator);
		if (sep > 0){
			base = base.substring(0, sep);
		}
		String candidate;
		do {
			int newNumber = currentNumForNonTerminal.getOrDefault(base, -1) + 1;
			currentNumForNonTerminal.put(base, newNumber);
			candidate = base + additionalNumSeparator + newNumber;
		} while (usedNames.contains(candidate));
		usedNames.add(candidate);
		return new NonTerminal(candidate);
	}
}
