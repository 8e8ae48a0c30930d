package c2cfa.lexer;

import c2cfa.util.SourceLocatable;
import c2cfa.util.SourceLocation;

import java.util.Objects;

public class CToken extends SourceLocatable {

	private final String value;
	private final CTokenType type;
	private final SourceLocation location;

	public CToken(String value, CTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public CTokenType getType() {
		return type;
	}

	/**
	 * @return whether this is the given keyword or punctuator
	 */
	public boolean is(String text) {
		return (type == CTokenType.KEYWORD || type == CTokenType.PUNCTUATOR) && value.equals(text);
	}

	@Override
	public String toString() {
		return "CToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, location);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		CToken other = (CToken) obj;
		return type == other.type && Objects.equals(value, other.value) && Objects.equals(location, other.location);
	}

}
