package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CDeclaration extends CNode {

	private final CDeclarator declarator;
	private final CExpression init;

	public CDeclaration(SourceLocation location, CDeclarator declarator, CExpression init) {
		super(location);
		this.declarator = declarator;
		this.init = init;
	}

	public CDeclarator getDeclarator() {
		return declarator;
	}

	/**
	 * @return the initializer, or null if there is none
	 */
	public CExpression getInit() {
		return init;
	}

}
