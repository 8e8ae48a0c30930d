package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CExpressionStatement extends CStatement {

	private final CExpression expression;

	public CExpressionStatement(SourceLocation location, CExpression expression) {
		super(location);
		this.expression = expression;
	}

	public CExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
