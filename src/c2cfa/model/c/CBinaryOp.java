package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CBinaryOp extends CExpression {

	private final String operator;
	private final CExpression lhs;
	private final CExpression rhs;

	public CBinaryOp(SourceLocation location, String operator, CExpression lhs, CExpression rhs) {
		super(location);
		this.operator = operator;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public String getOperator() {
		return operator;
	}

	public CExpression getLHS() {
		return lhs;
	}

	public CExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
