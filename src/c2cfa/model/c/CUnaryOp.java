package c2cfa.model.c;

import c2cfa.util.SourceLocation;

/**
 * Prefix operators use their C spelling; postfix increment and decrement are
 * spelled <code>p++</code> and <code>p--</code>.
 */
public class CUnaryOp extends CExpression {

	public static final String POST_INCREMENT = "p++";
	public static final String POST_DECREMENT = "p--";

	private final String operator;
	private final CExpression operand;

	public CUnaryOp(SourceLocation location, String operator, CExpression operand) {
		super(location);
		this.operator = operator;
		this.operand = operand;
	}

	public String getOperator() {
		return operator;
	}

	public CExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
