package ctxfree.grammar.sentences;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import ctxfree.grammar.Grammar;
import ctxfree.grammar.InvalidGrammarError;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.Terminal;

/**
 * A generator of random sentences that are valid for a given grammar.
 *
 * Productions are chosen uniformly among those that can derive a terminal string. Beyond the
 * depth bound the production with the shortest derivation is chosen, so generation always ends.
 */
public class SentenceGenerator {

	private static final int INFINITE = Integer.MAX_VALUE;

	private final Grammar grammar;
	private final Random rand;
	private final int depthBound;

	/**
	 * Minimal number of derivation steps for every non terminal, {@link #INFINITE} if it derives
	 * no terminal string.
	 */
	private final Map<NonTerminal, Integer> derivationCosts = new HashMap<>();
	private final Map<NonTerminal, Production> cheapestProductions = new HashMap<>();

	public SentenceGenerator(Grammar grammar, long seed, int depthBound) {
		this.grammar = grammar;
		this.rand = new Random(seed);
		this.depthBound = depthBound;
		calculateDerivationCosts();
	}

	public SentenceGenerator(Grammar grammar, long seed) {
		this(grammar, seed, 10);
	}

	private void calculateDerivationCosts(){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			derivationCosts.put(nonTerminal, INFINITE);
		}
		boolean changed;
		do {
			changed = false;
			for (Production production : grammar.getProductions()) {
				int cost = cost(production);
				if (cost < derivationCosts.get(production.left)){
					derivationCosts.put(production.left, cost);
					cheapestProductions.put(production.left, production);
					changed = true;
				}
			}
		} while (changed);
	}

	/**
	 * Saturates at {@code INFINITE - 1}, so large finite costs stay finite.
	 */
	private int cost(Production production){
		long cost = 1;
		for (NonTerminal nonTerminal : production.nonTerminals) {
			int childCost = derivationCosts.get(nonTerminal);
			if (childCost == INFINITE){
				return INFINITE;
			}
			cost = Math.min(cost + childCost, INFINITE - 1);
		}
		return (int) cost;
	}

	/**
	 * @throws InvalidGrammarError if the start non terminal derives no terminal string
	 */
	public List<Terminal> generateRandomSentence(){
		if (derivationCosts.get(grammar.getStart()) == INFINITE){
			throw new InvalidGrammarError("Start non terminal derives no terminal string", grammar.getStart());
		}
		List<Terminal> sentence = new ArrayList<>();
		generateRandomSentence(grammar.getStart(), 0, sentence);
		return sentence;
	}

	public List<List<Terminal>> generateRandomSentences(int count){
		List<List<Terminal>> sentences = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			sentences.add(generateRandomSentence());
		}
		return sentences;
	}

	private void generateRandomSentence(NonTerminal nonTerminal, int depth, List<Terminal> sentence){
		Production production = depth >= depthBound ? cheapestProductions.get(nonTerminal) : randomProduction(nonTerminal);
		for (Symbol symbol : production.right) {
			if (symbol.isNonTerminal()) {
				generateRandomSentence((NonTerminal) symbol, depth + 1, sentence);
			} else if (symbol.isTerminal()) {
				sentence.add((Terminal) symbol);
			}
		}
	}

	private Production randomProduction(NonTerminal nonTerminal){
		List<Production> usable = new ArrayList<>();
		for (Production production : grammar.getProductionsOf(nonTerminal)) {
			if (cost(production) != INFINITE){
				usable.add(production);
			}
		}
		return usable.get(rand.nextInt(usable.size()));
	}
}
