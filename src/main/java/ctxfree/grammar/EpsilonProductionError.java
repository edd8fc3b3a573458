package ctxfree.grammar;

import java.util.Collections;
import java.util.List;

/**
 * A step that requires an epsilon free grammar got epsilon productions.
 */
public class EpsilonProductionError extends GrammarException {

	public EpsilonProductionError(List<Production> productions) {
		super(new Diagnostic(Diagnostic.Kind.EPSILON_PRODUCTION,
				String.format("Grammar has to be epsilon free, but has %s", productions),
				Collections.emptyList(), Collections.emptyList(), productions));
	}
}
