package ctxfree;

import org.junit.jupiter.api.Test;

import ctxfree.analysis.PropertyAnalyzer;
import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Terminal;
import ctxfree.grammar.sentences.BoundedLanguage;
import ctxfree.lexer.ListLexer;
import ctxfree.parser.ll.LLParser;
import ctxfree.parser.ll.UnexpectedTokenError;

import static org.junit.jupiter.api.Assertions.*;

public class LL1PipelineTest {

	private final LL1Pipeline pipeline = new LL1Pipeline();

	@Test
	public void testAnbn(){
		PipelineResult result = pipeline.run(SampleGrammars.anbn());
		assertTrue(result.isSuccess());
		assertNull(result.failure);
		assertEquals(SampleGrammars.anbn(), result.grammar);
		assertTrue(result.diagnostics.stream().anyMatch(d -> d.kind == Diagnostic.Kind.LEFT_RECURSION_APPROXIMATE));
		LLParser parser = result.parser();
		assertTrue(parser.parse(ListLexer.ofChars("aabb")).isAccepted());
		assertTrue(parser.parse(ListLexer.ofChars("")).isAccepted());
		UnexpectedTokenError error = assertInstanceOf(UnexpectedTokenError.class,
				parser.parse(ListLexer.ofChars("aab")).error);
		assertEquals(3, error.position);
	}

	@Test
	public void testLeftRecursiveExpressions(){
		Grammar grammar = SampleGrammars.expressions();
		PipelineResult result = pipeline.run(grammar);
		assertTrue(result.isSuccess(), result::toString);
		assertEquals(BoundedLanguage.enumerate(grammar, 5), BoundedLanguage.enumerate(result.grammar, 5));
		assertEquals(new NonTerminal("E"), result.provenance.originOf(new NonTerminal("E'")));
		LLParser parser = result.parser();
		assertTrue(parser.parse(ListLexer.ofChars("i+i*(i+i)")).isAccepted());
		assertFalse(parser.parse(ListLexer.ofChars("i+")).isAccepted());
	}

	@Test
	public void testLeftRecursionWithEpsilon(){
		Grammar grammar = new GrammarBuilder("a").add("S", "S", "a").add("S", "").toGrammar("S");
		PipelineResult result = pipeline.run(grammar);
		assertTrue(result.isSuccess(), result::toString);
		assertEquals(BoundedLanguage.enumerate(grammar, 5), BoundedLanguage.enumerate(result.grammar, 5));
		for (String input : new String[]{"", "a", "aaaa"}) {
			assertTrue(result.parser().parse(ListLexer.ofChars(input)).isAccepted(), input);
		}
		assertTrue(result.table.get(result.grammar.getStart(), Terminal.EOF).isEpsilonProduction());
		assertTrue(result.diagnostics.stream().anyMatch(d -> d.kind == Diagnostic.Kind.EPSILON_ELIMINATED
				&& d.nonTerminals.contains(new NonTerminal("S"))));
	}

	@Test
	public void testIndirectLeftRecursionIsRemovedButNotLL1(){
		// S → A a | b with A → b c … still needs two tokens of lookahead
		PipelineResult result = pipeline.run(SampleGrammars.indirectlyLeftRecursive());
		assertFalse(result.isSuccess());
		assertEquals(Diagnostic.Kind.NOT_LL1, result.failure.kind);
		assertTrue(new PropertyAnalyzer(result.grammar).leftRecursive().isEmpty());
		assertTrue(result.provenance.isFresh(new NonTerminal("A'")));
	}

	@Test
	public void testRejectPolicy(){
		PipelineResult result = new LL1Pipeline(LL1Pipeline.LeftRecursionPolicy.REJECT).run(SampleGrammars.leftRecursive());
		assertFalse(result.isSuccess());
		assertEquals(Diagnostic.Kind.LEFT_RECURSION, result.failure.kind);
		assertNull(result.table);
		assertEquals(SampleGrammars.leftRecursive(), result.grammar);
		assertThrows(CtxFreeException.class, result::parser);
	}

	@Test
	public void testCommonPrefixIsFactored(){
		PipelineResult result = pipeline.run(SampleGrammars.commonPrefix());
		assertTrue(result.isSuccess());
		assertTrue(result.provenance.isFresh(new NonTerminal("A#0")));
		assertTrue(result.parser().parse(ListLexer.ofChars("ac")).isAccepted());
	}

	@Test
	public void testCyclicGrammarFails(){
		PipelineResult result = pipeline.run(SampleGrammars.cyclic());
		assertFalse(result.isSuccess());
		assertEquals(Diagnostic.Kind.CYCLIC_PRODUCTION, result.failure.kind);
		assertEquals(result.failure, result.diagnostics.get(result.diagnostics.size() - 1));
	}

	@Test
	public void testAmbiguousGrammarIsNotLL1(){
		Grammar grammar = new GrammarBuilder("a")
				.add("S", "A")
				.add("S", "B")
				.add("A", "a")
				.add("B", "a")
				.toGrammar("S");
		PipelineResult result = pipeline.run(grammar);
		assertEquals(Diagnostic.Kind.NOT_LL1, result.failure.kind);
	}
}
