package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

/**
 * The type specifier words of a declaration, e.g. <code>[unsigned, long, int]</code>.
 */
public class CIdentifierType extends CNode {

	private final List<String> names;

	public CIdentifierType(SourceLocation location, List<String> names) {
		super(location);
		this.names = names;
	}

	public List<String> getNames() {
		return names;
	}

	public String joinedName() {
		return String.join("_", names);
	}

}
