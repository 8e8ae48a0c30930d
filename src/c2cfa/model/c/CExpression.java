package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public abstract class CExpression extends CNode {

	public CExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E;

}
