package ctxfree;

import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;

/**
 * Grammars shared by the tests
 */
public class SampleGrammars {

	/**
	 * S → a S b | ε
	 */
	public static Grammar anbn(){
		return new GrammarBuilder("a", "b")
				.add("S", "a", "S", "b")
				.add("S", "")
				.toGrammar("S");
	}

	/**
	 * S → S a | a
	 */
	public static Grammar leftRecursive(){
		return new GrammarBuilder("a")
				.add("S", "S", "a")
				.add("S", "a")
				.toGrammar("S");
	}

	/**
	 * S → a S | ε
	 */
	public static Grammar rightRecursive(){
		return new GrammarBuilder("a")
				.add("S", "a", "S")
				.add("S", "")
				.toGrammar("S");
	}

	/**
	 * S → A a | b, A → S c | d
	 */
	public static Grammar indirectlyLeftRecursive(){
		return new GrammarBuilder("a", "b", "c", "d")
				.add("S", "A", "a")
				.add("S", "b")
				.add("A", "S", "c")
				.add("A", "d")
				.toGrammar("S");
	}

	/**
	 * The classic arithmetic expression grammar with left recursive operators
	 */
	public static Grammar expressions(){
		return new GrammarBuilder("+", "*", "(", ")", "i")
				.add("E", "E", "+", "T")
				.add("E", "T")
				.add("T", "T", "*", "F")
				.add("T", "F")
				.add("F", "(", "E", ")")
				.add("F", "i")
				.toGrammar("E");
	}

	/**
	 * A → a B | a C, B → b, C → c
	 */
	public static Grammar commonPrefix(){
		return new GrammarBuilder("a", "b", "c")
				.add("A", "a", "B")
				.add("A", "a", "C")
				.add("B", "b")
				.add("C", "c")
				.toGrammar("A");
	}

	/**
	 * S → A | a, A → S | b
	 */
	public static Grammar cyclic(){
		return new GrammarBuilder("a", "b")
				.add("S", "A")
				.add("S", "a")
				.add("A", "S")
				.add("A", "b")
				.toGrammar("S");
	}

	/**
	 * Balanced parentheses with epsilon and unit productions: S → A S | ε, A → B, B → ( S )
	 */
	public static Grammar parentheses(){
		return new GrammarBuilder("(", ")")
				.add("S", "A", "S")
				.add("S", "")
				.add("A", "B")
				.add("B", "(", "S", ")")
				.toGrammar("S");
	}

	/**
	 * Expressions without left recursion: E → T E', E' → + T E' | ε, T → F T', T' → * F T' | ε, F → ( E ) | i
	 */
	public static Grammar ll1Expressions(){
		return new GrammarBuilder("+", "*", "(", ")", "i")
				.add("E", "T", "E'")
				.add("E'", "+", "T", "E'")
				.add("E'", "")
				.add("T", "F", "T'")
				.add("T'", "*", "F", "T'")
				.add("T'", "")
				.add("F", "(", "E", ")")
				.add("F", "i")
				.toGrammar("E");
	}
}
