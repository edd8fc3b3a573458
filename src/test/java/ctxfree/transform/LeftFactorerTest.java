package ctxfree.transform;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ctxfree.SampleGrammars;
import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.TransformedGrammar;
import ctxfree.grammar.sentences.BoundedLanguage;

import static org.junit.jupiter.api.Assertions.*;

public class LeftFactorerTest {

	private final LeftFactorer factorer = new LeftFactorer(2);

	private static void assertNoCommonLeadingSymbols(Grammar grammar){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			Set<Symbol> leading = new HashSet<>();
			for (List<Symbol> alternative : grammar.alternatives(nonTerminal)) {
				if (!alternative.isEmpty()){
					assertTrue(leading.add(alternative.get(0)),
							() -> "Shared leading symbol " + alternative.get(0) + " in\n" + grammar);
				}
			}
		}
	}

	private TransformedGrammar assertFactored(Grammar grammar, int maxLength){
		TransformedGrammar result = factorer.factor(grammar);
		assertNoCommonLeadingSymbols(result.grammar);
		assertEquals(BoundedLanguage.enumerate(grammar, maxLength), BoundedLanguage.enumerate(result.grammar, maxLength));
		return result;
	}

	@Test
	public void testCommonPrefix(){
		TransformedGrammar result = assertFactored(SampleGrammars.commonPrefix(), 4);
		NonTerminal fresh = new NonTerminal("A#0");
		assertEquals("A -> a A#0", result.grammar.toString().split("\n")[0]);
		assertEquals(2, result.grammar.getProductionsOf(fresh).size());
		assertEquals(new NonTerminal("A"), result.provenance.originOf(fresh));
	}

	@Test
	public void testNestedPrefixes(){
		Grammar grammar = new GrammarBuilder("a", "b", "c", "d", "e")
				.add("S", "a", "b", "c")
				.add("S", "a", "b", "d")
				.add("S", "a", "e")
				.toGrammar("S");
		TransformedGrammar result = assertFactored(grammar, 4);
		assertEquals(2, result.provenance.asMap().size());
		assertEquals(new NonTerminal("S"), result.provenance.originOf(new NonTerminal("S#1")));
	}

	@Test
	public void testEmptySuffixBecomesEpsilon(){
		Grammar grammar = new GrammarBuilder("a", "b").add("S", "a").add("S", "a", "b").toGrammar("S");
		TransformedGrammar result = assertFactored(grammar, 3);
		assertTrue(result.grammar.getProductionsOf(new NonTerminal("S#0")).get(0).isEpsilonProduction());
	}

	@Test
	public void testGrammarWithoutCommonPrefixesIsKept(){
		Grammar grammar = SampleGrammars.anbn();
		TransformedGrammar result = factorer.factor(grammar);
		assertEquals(grammar, result.grammar);
		assertTrue(result.provenance.asMap().isEmpty());
	}

	@Test
	public void testBoundIsEnforced(){
		NonTerminatingFactorizationError error = assertThrows(NonTerminatingFactorizationError.class,
				() -> new LeftFactorer(0).factor(SampleGrammars.commonPrefix()));
		assertEquals(0, error.bound);
		assertEquals(Diagnostic.Kind.NON_TERMINATING_FACTORIZATION, error.diagnostic.kind);
	}
}
