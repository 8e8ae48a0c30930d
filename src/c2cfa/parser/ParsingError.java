package c2cfa.parser;

import c2cfa.util.SourceLocation;

/**
 * Raised when C source text does not fit the supported grammar.
 */
@SuppressWarnings("serial")
public class ParsingError extends Exception {

	private final SourceLocation location;
	private final String reason;

	public ParsingError(SourceLocation location, String reason) {
		super(reason + " " + location.prettyString());
		this.location = location;
		this.reason = reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getReason() {
		return reason;
	}

}
