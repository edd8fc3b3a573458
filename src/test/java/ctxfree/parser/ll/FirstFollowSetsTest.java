package ctxfree.parser.ll;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ctxfree.SampleGrammars;
import ctxfree.grammar.Epsilon;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Symbol;
import ctxfree.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class FirstFollowSetsTest {

	private final FirstFollowSets sets = new FirstFollowSets(SampleGrammars.ll1Expressions());

	private static Set<Symbol> symbols(Symbol... symbols){
		return new HashSet<>(Arrays.asList(symbols));
	}

	private static Set<Terminal> terminals(String... names){
		Set<Terminal> ret = new HashSet<>();
		for (String name : names) {
			ret.add(name.equals("$") ? Terminal.EOF : new Terminal(name));
		}
		return ret;
	}

	private static NonTerminal nt(String name){
		return new NonTerminal(name);
	}

	@Test
	public void testFirst(){
		assertEquals(terminals("(", "i"), sets.first(nt("E")));
		assertEquals(terminals("(", "i"), sets.first(nt("F")));
		assertEquals(terminals("+"), sets.first(nt("E'")));
		assertEquals(terminals("*"), sets.first(nt("T'")));
	}

	@Test
	public void testFirstOfSequence(){
		assertEquals(symbols(new Terminal("+"), new Terminal("*"), Epsilon.INSTANCE),
				sets.first(Arrays.asList(nt("T'"), nt("E'"))));
		assertEquals(symbols(new Terminal("*"), new Terminal(")")),
				sets.first(Arrays.asList(nt("T'"), new Terminal(")"), nt("E'"))));
		assertEquals(symbols(Epsilon.INSTANCE), sets.first(Collections.emptyList()));
	}

	@Test
	public void testFollow(){
		assertEquals(terminals("$", ")"), sets.follow(nt("E")));
		assertEquals(terminals("$", ")"), sets.follow(nt("E'")));
		assertEquals(terminals("+", "$", ")"), sets.follow(nt("T")));
		assertEquals(terminals("+", "$", ")"), sets.follow(nt("T'")));
		assertEquals(terminals("*", "+", "$", ")"), sets.follow(nt("F")));
	}

	@Test
	public void testFollowOfStartContainsEndOfInput(){
		FirstFollowSets anbn = new FirstFollowSets(SampleGrammars.anbn());
		assertEquals(terminals("$", "b"), anbn.follow(nt("S")));
		assertTrue(anbn.isNullable(nt("S")));
	}

	@Test
	public void testPredict(){
		FirstFollowSets anbn = new FirstFollowSets(SampleGrammars.anbn());
		assertEquals(terminals("a"), anbn.predict(anbn.getGrammar().getProductions().get(0)));
		assertEquals(terminals("b", "$"), anbn.predict(anbn.getGrammar().getProductions().get(1)));
	}
}
