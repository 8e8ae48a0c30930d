package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CTypeDeclarator extends CDeclarator {

	private final String name;
	private final CIdentifierType type;

	public CTypeDeclarator(SourceLocation location, String name, CIdentifierType type) {
		super(location);
		this.name = name;
		this.type = type;
	}

	/**
	 * @return the declared name, or null for abstract declarators such as those in casts or prototypes
	 */
	public String getName() {
		return name;
	}

	public CIdentifierType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(CDeclaratorVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
