package ctxfree.analysis;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ctxfree.SampleGrammars;
import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.Grammar;
import ctxfree.grammar.GrammarBuilder;
import ctxfree.grammar.NonTerminal;

import static org.junit.jupiter.api.Assertions.*;

public class PropertyAnalyzerTest {

	private static Set<NonTerminal> nts(String... names){
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (String name : names) {
			ret.add(new NonTerminal(name));
		}
		return ret;
	}

	@Test
	public void testDirectLeftRecursion(){
		GrammarProperties properties = new PropertyAnalyzer(SampleGrammars.leftRecursive()).analyze();
		assertEquals(nts("S"), properties.leftRecursive);
		assertEquals(nts("S"), properties.directlyLeftRecursive);
		assertTrue(properties.leftRecursionExact);
		assertTrue(properties.hasDiagnostic(Diagnostic.Kind.LEFT_RECURSION));
		assertFalse(properties.hasDiagnostic(Diagnostic.Kind.LEFT_RECURSION_APPROXIMATE));
	}

	@Test
	public void testRightRecursionIsNoLeftRecursion(){
		GrammarProperties properties = new PropertyAnalyzer(SampleGrammars.rightRecursive()).analyze();
		assertFalse(properties.isLeftRecursive());
		assertFalse(properties.hasDiagnostic(Diagnostic.Kind.LEFT_RECURSION));
		assertFalse(properties.leftRecursionExact);
		assertTrue(properties.hasDiagnostic(Diagnostic.Kind.LEFT_RECURSION_APPROXIMATE));
	}

	@Test
	public void testIndirectLeftRecursion(){
		PropertyAnalyzer analyzer = new PropertyAnalyzer(SampleGrammars.indirectlyLeftRecursive());
		assertEquals(nts("S", "A"), analyzer.leftRecursive());
		assertTrue(analyzer.directlyLeftRecursive().isEmpty());
	}

	@Test
	public void testLeftRecursionBehindNullablePrefixIsOnlyFlagged(){
		Grammar grammar = new GrammarBuilder("a", "b")
				.add("S", "B", "S", "a")
				.add("S", "b")
				.add("B", "")
				.toGrammar("S");
		GrammarProperties properties = new PropertyAnalyzer(grammar).analyze();
		assertFalse(properties.isLeftRecursive());
		assertFalse(properties.leftRecursionExact);
		Diagnostic approximate = properties.diagnostics.stream()
				.filter(d -> d.kind == Diagnostic.Kind.LEFT_RECURSION_APPROXIMATE).findFirst().get();
		assertEquals(Diagnostic.Severity.WARNING, approximate.severity());
		assertEquals(1, approximate.productions.size());
	}

	@Test
	public void testNullable(){
		assertEquals(nts("S"), new PropertyAnalyzer(SampleGrammars.parentheses()).nullable());
		Grammar grammar = new GrammarBuilder("a")
				.add("S", "A", "B")
				.add("A", "")
				.add("B", "A", "A")
				.add("C", "A", "a")
				.toGrammar("S");
		PropertyAnalyzer analyzer = new PropertyAnalyzer(grammar);
		assertEquals(nts("S", "A", "B"), analyzer.nullable());
		assertTrue(analyzer.isNullable(Arrays.asList(new NonTerminal("A"), new NonTerminal("B"))));
		assertTrue(analyzer.isNullable(Collections.emptyList()));
		assertFalse(analyzer.isNullable(Collections.singletonList(new NonTerminal("C"))));
	}

	@Test
	public void testCyclic(){
		assertEquals(nts("S", "A"), new PropertyAnalyzer(SampleGrammars.cyclic()).cyclic());
		assertTrue(new PropertyAnalyzer(SampleGrammars.expressions()).cyclic().isEmpty());
		GrammarProperties properties = new PropertyAnalyzer(SampleGrammars.cyclic()).analyze();
		assertTrue(properties.isCyclic());
		assertTrue(properties.hasDiagnostic(Diagnostic.Kind.CYCLIC_PRODUCTION));
	}

	@Test
	public void testUselessNonTerminals(){
		Grammar grammar = new GrammarBuilder("a", "c")
				.add("S", "a")
				.add("S", "B")
				.add("S", "E")
				.add("B", "C")
				.add("C", "C", "c")
				.add("D", "a")
				.nonTerminal("E")
				.toGrammar("S");
		GrammarProperties properties = new PropertyAnalyzer(grammar).analyze();
		assertEquals(nts("E"), properties.dead);
		assertEquals(nts("B", "C", "E"), properties.nonGenerating);
		assertEquals(nts("D"), properties.unreachable);
		assertEquals(nts("C"), properties.leftRecursive);
		long nonGeneratingReports = properties.diagnostics.stream()
				.filter(d -> d.kind == Diagnostic.Kind.NON_GENERATING).count();
		assertEquals(2, nonGeneratingReports);
		assertTrue(properties.hasDiagnostic(Diagnostic.Kind.DEAD_NON_TERMINAL));
		assertTrue(properties.hasDiagnostic(Diagnostic.Kind.UNREACHABLE));
	}

	@Test
	public void testCleanGrammarHasNoWarnings(){
		GrammarProperties properties = new PropertyAnalyzer(SampleGrammars.commonPrefix()).analyze();
		assertTrue(properties.diagnostics.isEmpty());
	}
}
