package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CArrayDeclarator extends CDeclarator {

	private final CDeclarator inner;
	private final CExpression dimension;

	public CArrayDeclarator(SourceLocation location, CDeclarator inner, CExpression dimension) {
		super(location);
		this.inner = inner;
		this.dimension = dimension;
	}

	public CDeclarator getInner() {
		return inner;
	}

	/**
	 * @return the dimension expression, or null for <code>a[]</code>
	 */
	public CExpression getDimension() {
		return dimension;
	}

	@Override
	public <T, E extends Throwable> T accept(CDeclaratorVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
