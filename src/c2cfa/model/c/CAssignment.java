package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CAssignment extends CExpression {

	private final String operator;
	private final CExpression lvalue;
	private final CExpression rvalue;

	public CAssignment(SourceLocation location, String operator, CExpression lvalue, CExpression rvalue) {
		super(location);
		this.operator = operator;
		this.lvalue = lvalue;
		this.rvalue = rvalue;
	}

	/**
	 * @return <code>=</code> or a compound form such as <code>+=</code>
	 */
	public String getOperator() {
		return operator;
	}

	public CExpression getLvalue() {
		return lvalue;
	}

	public CExpression getRvalue() {
		return rvalue;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
