package ctxfree;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@AfterEach
	public void clearProperties(){
		System.clearProperty("ctxfree.parserExpansionLimit");
		System.clearProperty("ctxfree.factoringBoundFactor");
	}

	@Test
	public void testDefaults(){
		assertEquals(2, Config.factoringBoundFactor());
		assertEquals(10000, Config.parserExpansionLimit());
	}

	@Test
	public void testSystemPropertyOverrides(){
		System.setProperty("ctxfree.parserExpansionLimit", "5");
		assertEquals(5, Config.parserExpansionLimit());
	}

	@Test
	public void testInvalidValueFallsBackToDefault(){
		System.setProperty("ctxfree.factoringBoundFactor", "many");
		assertEquals(2, Config.factoringBoundFactor());
	}
}
