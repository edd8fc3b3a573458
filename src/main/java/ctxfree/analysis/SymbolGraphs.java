package ctxfree.analysis;

import java.util.LinkedHashSet;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.DepthFirstIterator;

import ctxfree.grammar.Grammar;
import ctxfree.grammar.NonTerminal;
import ctxfree.grammar.Production;
import ctxfree.grammar.Symbol;

/**
 * Graphs over the non terminals of a grammar.
 */
public final class SymbolGraphs {

	private SymbolGraphs() {
	}

	/**
	 * Graph with an edge <pre>A → B</pre> for every unit production <pre>A → B</pre>.
	 */
	public static Graph<NonTerminal, DefaultEdge> unitGraph(Grammar grammar){
		Graph<NonTerminal, DefaultEdge> graph = vertices(grammar);
		for (Production production : grammar.getProductions()) {
			if (production.isUnitProduction()){
				graph.addEdge(production.left, (NonTerminal) production.right.get(0));
			}
		}
		return graph;
	}

	/**
	 * Graph with an edge <pre>A → B</pre> for every production <pre>A → B γ</pre>, regardless of γ.
	 */
	public static Graph<NonTerminal, DefaultEdge> leftmostGraph(Grammar grammar){
		Graph<NonTerminal, DefaultEdge> graph = vertices(grammar);
		for (Production production : grammar.getProductions()) {
			Symbol leading = production.leadingSymbol();
			if (leading != null && leading.isNonTerminal()){
				graph.addEdge(production.left, (NonTerminal) leading);
			}
		}
		return graph;
	}

	private static Graph<NonTerminal, DefaultEdge> vertices(Grammar grammar){
		Graph<NonTerminal, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (NonTerminal nonTerminal : grammar.getNonTerminals()) {
			graph.addVertex(nonTerminal);
		}
		return graph;
	}

	/**
	 * Vertices that reach themselves via one or more edges: members of strongly connected components
	 * with more than one vertex and vertices with a self loop.
	 */
	public static Set<NonTerminal> verticesOnCycles(Graph<NonTerminal, DefaultEdge> graph){
		Set<NonTerminal> onCycle = new LinkedHashSet<>();
		for (Set<NonTerminal> component : new KosarajuStrongConnectivityInspector<>(graph).stronglyConnectedSets()) {
			if (component.size() > 1){
				onCycle.addAll(component);
			} else {
				NonTerminal single = component.iterator().next();
				if (graph.containsEdge(single, single)){
					onCycle.add(single);
				}
			}
		}
		return onCycle;
	}

	/**
	 * Vertices reachable from the passed one via zero or more edges (includes the vertex itself).
	 */
	public static Set<NonTerminal> reachableFrom(Graph<NonTerminal, DefaultEdge> graph, NonTerminal start){
		Set<NonTerminal> reached = new LinkedHashSet<>();
		DepthFirstIterator<NonTerminal, DefaultEdge> iterator = new DepthFirstIterator<>(graph, start);
		while (iterator.hasNext()){
			reached.add(iterator.next());
		}
		return reached;
	}
}
