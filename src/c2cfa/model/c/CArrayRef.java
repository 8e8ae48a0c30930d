package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CArrayRef extends CExpression {

	private final CExpression base;
	private final CExpression subscript;

	public CArrayRef(SourceLocation location, CExpression base, CExpression subscript) {
		super(location);
		this.base = base;
		this.subscript = subscript;
	}

	public CExpression getBase() {
		return base;
	}

	public CExpression getSubscript() {
		return subscript;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
