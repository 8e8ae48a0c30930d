package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CTernaryOp extends CExpression {

	private final CExpression condition;
	private final CExpression yes;
	private final CExpression no;

	public CTernaryOp(SourceLocation location, CExpression condition, CExpression yes, CExpression no) {
		super(location);
		this.condition = condition;
		this.yes = yes;
		this.no = no;
	}

	public CExpression getCondition() {
		return condition;
	}

	public CExpression getYes() {
		return yes;
	}

	public CExpression getNo() {
		return no;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
