package ctxfree.grammar.sentences;

import java.util.Arrays;
import java.util.HashSet;

import org.junit.jupiter.api.Test;

import ctxfree.SampleGrammars;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class BoundedLanguageTest {

	@Test
	public void testAnbn(){
		assertEquals(new HashSet<>(Arrays.asList("", "ab", "aabb")),
				BoundedLanguage.asStrings(BoundedLanguage.enumerate(SampleGrammars.anbn(), 5)));
	}

	@Test
	public void testCyclicGrammarTerminates(){
		assertEquals(new HashSet<>(Arrays.asList("a", "b")),
				BoundedLanguage.asStrings(BoundedLanguage.enumerate(SampleGrammars.cyclic(), 3)));
	}

	@Test
	public void testEmptyLanguage(){
		Grammar grammar = new GrammarBuilder("a").add("S", "S", "a").toGrammar("S");
		assertTrue(BoundedLanguage.enumerate(grammar, 4).isEmpty());
	}

	@Test
	public void testParentheses(){
		BoundedLanguage language = new BoundedLanguage(SampleGrammars.parentheses(), 4);
		assertEquals(new HashSet<>(Arrays.asList("", "()", "()()", "(())")), BoundedLanguage.asStrings(language.words()));
		assertEquals(new HashSet<>(Arrays.asList("()", "(())")),
				BoundedLanguage.asStrings(language.wordsOf(new NonTerminal("B"))));
		Terminal open = new Terminal("(");
		Terminal close = new Terminal(")");
		assertTrue(language.contains(Arrays.asList(open, close, open, close)));
		assertFalse(language.contains(Arrays.asList(close, open)));
	}
}
