package ctxfree.parser.ll;

import java.util.List;

import com.google.common.collect.ImmutableList;

import ctxfree.grammar.Production;

/**
 * Verdict of {@link LLParser}: accepted with the leftmost derivation, or the first parse error
 * together with the productions applied until then.
 */
public final class ParseResult {

	public final boolean accepted;

	/**
	 * Applied productions in order
	 */
	public final ImmutableList<Production> trace;

	/**
	 * null if accepted
	 */
	public final ParseError error;

	private ParseResult(boolean accepted, List<Production> trace, ParseError error){
		this.accepted = accepted;
		this.trace = ImmutableList.copyOf(trace);
		this.error = error;
	}

	static ParseResult accept(List<Production> trace){
		return new ParseResult(true, trace, null);
	}

	static ParseResult reject(ParseError error, List<Production> trace){
		return new ParseResult(false, trace, error);
	}

	public boolean isAccepted(){
		return accepted;
	}

	/**
	 * @return the derivation
	 * @throws ParseError if the input was rejected
	 */
	public List<Production> orElseThrow(){
		if (!accepted){
			throw error;
		}
		return trace;
	}

	@Override
	public String toString() {
		return accepted ? "Accepted " + trace : "Rejected: " + error.getMessage();
	}
}
