package c2cfa.model.c;

import c2cfa.util.SourceLocatable;
import c2cfa.util.SourceLocation;

/**
 * Base of the C syntax tree. Node kinds are grouped into closed families
 * (expressions, statements, declarators, external declarations), each with its
 * own visitor, so a traversal has to say what it does with every kind.
 */
public abstract class CNode extends SourceLocatable {

	private final SourceLocation location;

	public CNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

}
