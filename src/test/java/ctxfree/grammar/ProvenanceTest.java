package ctxfree.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProvenanceTest {

	private static final NonTerminal A = new NonTerminal("A");
	private static final NonTerminal A1 = new NonTerminal("A'");
	private static final NonTerminal A2 = new NonTerminal("A'#0");

	@Test
	public void testOriginFollowsChains(){
		Provenance first = Provenance.builder().record(A1, A).build();
		Provenance second = Provenance.builder().record(A2, A1).build();
		Provenance combined = first.andThen(second);
		assertEquals(A1, combined.directOriginOf(A2));
		assertEquals(A, combined.originOf(A2));
		assertTrue(combined.isFresh(A2));
		assertFalse(combined.isFresh(A));
		assertEquals(A, combined.originOf(A));
	}

	@Test
	public void testTerminalOrigin(){
		Terminal a = new Terminal("a");
		NonTerminal wrapper = new NonTerminal("T_a");
		assertEquals(a, Provenance.builder().record(wrapper, a).build().originOf(wrapper));
	}

	@Test
	public void testEmpty(){
		assertTrue(Provenance.empty().asMap().isEmpty());
		assertSame(Provenance.empty(), Provenance.builder().build());
	}
}
