package ctxfree.grammar.sentences;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import ctxfree.SampleGrammars;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;
import ctxfree.grammar.InvalidGrammarError;
import ctxfree.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class SentenceGeneratorTest {

	@ParameterizedTest
	@ValueSource(longs = {0, 7, 123})
	public void testSentencesBelongToTheLanguage(long seed){
		Grammar grammar = SampleGrammars.anbn();
		for (List<Terminal> sentence : new SentenceGenerator(grammar, seed, 4).generateRandomSentences(30)) {
			assertTrue(sentence.size() <= 10, sentence::toString);
			assertTrue(new BoundedLanguage(grammar, 10).contains(sentence), sentence::toString);
		}
	}

	@Test
	public void testSameSeedSameSentences(){
		Grammar grammar = SampleGrammars.expressions();
		assertEquals(new SentenceGenerator(grammar, 5).generateRandomSentences(10),
				new SentenceGenerator(grammar, 5).generateRandomSentences(10));
	}

	@Test
	public void testLargeDerivationCostsDoNotOverflow(){
		// A1 needs 2^30 - 1 steps, X → A1 A1 A1 exceeds the int range
		GrammarBuilder builder = new GrammarBuilder("a", "c")
				.add("S", "X")
				.add("X", "A1", "A1", "A1")
				.add("X", "c", "c", "c", "c")
				.add("A30", "a");
		for (int i = 1; i < 30; i++) {
			builder.add("A" + i, "A" + (i + 1), "A" + (i + 1));
		}
		Grammar grammar = builder.toGrammar("S");
		List<Terminal> sentence = new SentenceGenerator(grammar, 0, 0).generateRandomSentence();
		assertEquals(4, sentence.size());
		assertTrue(sentence.stream().allMatch(t -> t.equals(new Terminal("c"))));
	}

	@Test
	public void testNonGeneratingProductionsAreAvoided(){
		Grammar grammar = new GrammarBuilder("a")
				.add("S", "a")
				.add("S", "B")
				.add("B", "B", "a")
				.toGrammar("S");
		for (List<Terminal> sentence : new SentenceGenerator(grammar, 1).generateRandomSentences(10)) {
			assertEquals(1, sentence.size());
		}
	}

	@Test
	public void testEmptyLanguage(){
		Grammar grammar = new GrammarBuilder("a").add("S", "S", "a").toGrammar("S");
		assertThrows(InvalidGrammarError.class, () -> new SentenceGenerator(grammar, 1).generateRandomSentence());
	}
}
