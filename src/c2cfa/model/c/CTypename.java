package c2cfa.model.c;

import c2cfa.util.SourceLocation;

/**
 * A type used as an operand, as in casts and <code>sizeof(int)</code>.
 */
public class CTypename extends CExpression {

	private final CDeclarator declarator;

	public CTypename(SourceLocation location, CDeclarator declarator) {
		super(location);
		this.declarator = declarator;
	}

	public CDeclarator getDeclarator() {
		return declarator;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
