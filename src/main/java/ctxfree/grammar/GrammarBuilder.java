package ctxfree.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Allows the simple creation of grammars.
 *
 * The terminal alphabet is fixed on construction. In {@link #add(String, Object...)} strings that name
 * a terminal are treated as terminals, every other non empty string is treated as a non terminal and
 * the empty string is ε. Duplicate productions are collapsed.
 *
 * The transformations use the symbol based methods ({@link #add(NonTerminal, List)},
 * {@link #replace(NonTerminal, Collection)}) on a builder obtained via {@link Grammar#toBuilder()}.
 */
public class GrammarBuilder {

	private static final Logger LOG = Logger.getLogger(GrammarBuilder.class.getName());

	private final Map<String, Terminal> alphabet = new LinkedHashMap<>();

	private final Map<NonTerminal, LinkedHashSet<ImmutableList<Symbol>>> rules = new LinkedHashMap<>();

	public GrammarBuilder(String... terminals) {
		for (String terminal : terminals) {
			alphabet.put(terminal, new Terminal(terminal));
		}
	}

	public GrammarBuilder(Collection<Terminal> terminals) {
		for (Terminal terminal : terminals) {
			alphabet.put(terminal.name(), terminal);
		}
	}

	/**
	 * Declares non terminals, this allows non terminals without any production.
	 */
	public GrammarBuilder nonTerminal(String... names){
		for (String name : names) {
			nonTerminal(toNonTerminal(name));
		}
		return this;
	}

	public GrammarBuilder nonTerminal(NonTerminal nonTerminal){
		if (alphabet.containsKey(nonTerminal.name())){
			throw new InvalidGrammarError(String.format("Ambiguity while building the grammar: '%s' is the name of a " +
					"terminal and therefore can't be used as a non terminal name", nonTerminal.name()));
		}
		rules.computeIfAbsent(nonTerminal, n -> new LinkedHashSet<>());
		return this;
	}

	/**
	 * Adds a new production (and the used non terminals).
	 *
	 * The entries of the right hand side are
	 *  - strings: names of terminals or non terminals
	 *  - "": equivalent to ε
	 *  - symbols
	 *  - arrays of the above, they are flattened
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production, empty for an epsilon production
	 */
	public GrammarBuilder add(String left, Object... right){
		NonTerminal head = toNonTerminal(left);
		List<Symbol> body = new ArrayList<>();
		for (Object obj : flatten(right)) {
			body.add(toSymbol(obj));
		}
		return add(head, body);
	}

	public GrammarBuilder add(NonTerminal left, List<? extends Symbol> right){
		nonTerminal(left);
		ImmutableList<Symbol> body = Production.normalizeBody(left, right);
		if (!rules.get(left).add(body)){
			LOG.fine(() -> String.format("Dropped duplicate production %s", new Production(left, body)));
		}
		return this;
	}

	/**
	 * Replaces all productions of the passed non terminal.
	 */
	public GrammarBuilder replace(NonTerminal left, Collection<? extends List<? extends Symbol>> bodies){
		nonTerminal(left);
		rules.get(left).clear();
		for (List<? extends Symbol> body : bodies) {
			add(left, body);
		}
		return this;
	}

	public List<List<Symbol>> alternatives(NonTerminal nonTerminal){
		LinkedHashSet<ImmutableList<Symbol>> bodies = rules.get(nonTerminal);
		if (bodies == null){
			throw new UndefinedSymbolError(nonTerminal, null);
		}
		return new ArrayList<>(bodies);
	}

	public Set<NonTerminal> nonTerminals(){
		return new LinkedHashSet<>(rules.keySet());
	}

	public Grammar toGrammar(String start){
		return toGrammar(toNonTerminal(start));
	}

	/**
	 * @throws UndefinedSymbolError if a used symbol is neither declared nor has productions
	 */
	public Grammar toGrammar(NonTerminal start){
		Map<NonTerminal, List<Production>> productions = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, LinkedHashSet<ImmutableList<Symbol>>> entry : rules.entrySet()) {
			List<Production> prods = new ArrayList<>();
			for (ImmutableList<Symbol> body : entry.getValue()) {
				prods.add(new Production(entry.getKey(), body));
			}
			productions.put(entry.getKey(), prods);
		}
		return new Grammar(new LinkedHashSet<>(alphabet.values()), rules.keySet(), start, productions);
	}

	private NonTerminal toNonTerminal(String name){
		if (name.isEmpty()){
			throw new InvalidGrammarError("Empty non terminal name");
		}
		return new NonTerminal(name);
	}

	private Symbol toSymbol(Object obj){
		if (obj instanceof Symbol){
			return (Symbol) obj;
		}
		if (obj instanceof String){
			String str = (String) obj;
			if (str.isEmpty()){
				return Epsilon.INSTANCE;
			}
			if (alphabet.containsKey(str)){
				return alphabet.get(str);
			}
			return new NonTerminal(str);
		}
		if (obj instanceof Character){
			return toSymbol(obj.toString());
		}
		throw new IllegalArgumentException("Right part of production object list has unsupported type " + obj);
	}

	private List<Object> flatten(Object[] arr){
		List<Object> ret = new ArrayList<>();
		for (Object sub : arr){
			if (sub instanceof Object[]){
				ret.addAll(flatten((Object[]) sub));
			} else {
				ret.add(sub);
			}
		}
		return ret;
	}

	@Override
	public String toString() {
		return rules.toString() + " over " + Arrays.toString(alphabet.keySet().toArray());
	}
}
