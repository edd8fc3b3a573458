package ctxfree.analysis;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import ctxfree.grammar.Diagnostic;
import ctxfree.grammar.NonTerminal;

/**
 * Result of {@link PropertyAnalyzer#analyze()}.
 */
public final class GrammarProperties {

	public final ImmutableSet<NonTerminal> nullable;

	public final ImmutableSet<NonTerminal> cyclic;

	public final ImmutableSet<NonTerminal> leftRecursive;

	public final ImmutableSet<NonTerminal> directlyLeftRecursive;

	/**
	 * False if the grammar has epsilon productions, {@link #leftRecursive} might miss non terminals then.
	 */
	public final boolean leftRecursionExact;

	public final ImmutableSet<NonTerminal> dead;

	public final ImmutableSet<NonTerminal> nonGenerating;

	public final ImmutableSet<NonTerminal> unreachable;

	public final ImmutableList<Diagnostic> diagnostics;

	GrammarProperties(Set<NonTerminal> nullable, Set<NonTerminal> cyclic, Set<NonTerminal> leftRecursive,
	                  Set<NonTerminal> directlyLeftRecursive, boolean leftRecursionExact, Set<NonTerminal> dead,
	                  Set<NonTerminal> nonGenerating, Set<NonTerminal> unreachable, List<Diagnostic> diagnostics) {
		this.nullable = ImmutableSet.copyOf(nullable);
		this.cyclic = ImmutableSet.copyOf(cyclic);
		this.leftRecursive = ImmutableSet.copyOf(leftRecursive);
		this.directlyLeftRecursive = ImmutableSet.copyOf(directlyLeftRecursive);
		this.leftRecursionExact = leftRecursionExact;
		this.dead = ImmutableSet.copyOf(dead);
		this.nonGenerating = ImmutableSet.copyOf(nonGenerating);
		this.unreachable = ImmutableSet.copyOf(unreachable);
		this.diagnostics = ImmutableList.copyOf(diagnostics);
	}

	public boolean isLeftRecursive(){
		return !leftRecursive.isEmpty();
	}

	public boolean isCyclic(){
		return !cyclic.isEmpty();
	}

	public boolean hasDiagnostic(Diagnostic.Kind kind){
		for (Diagnostic diagnostic : diagnostics) {
			if (diagnostic.kind == kind){
				return true;
			}
		}
		return false;
	}
}
