package c2cfa.trans.passes.cfa;

import c2cfa.model.c.CExpression;

/**
 * What a declarator declares: a name (null for abstract declarators), its
 * normalised type and, for arrays, the dimension expression if one was given.
 */
public class DeclaredEntity {

	private final String name;
	private final String type;
	private final CExpression dimension;

	public DeclaredEntity(String name, String type, CExpression dimension) {
		this.name = name;
		this.type = type;
		this.dimension = dimension;
	}

	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	public CExpression getDimension() {
		return dimension;
	}

}
