package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CCast extends CExpression {

	private final CTypename type;
	private final CExpression expression;

	public CCast(SourceLocation location, CTypename type, CExpression expression) {
		super(location);
		this.type = type;
		this.expression = expression;
	}

	public CTypename getType() {
		return type;
	}

	public CExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
