package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CIf extends CStatement {

	private final CExpression condition;
	private final CStatement yes;
	private final CStatement no;

	public CIf(SourceLocation location, CExpression condition, CStatement yes, CStatement no) {
		super(location);
		this.condition = condition;
		this.yes = yes;
		this.no = no;
	}

	public CExpression getCondition() {
		return condition;
	}

	public CStatement getYes() {
		return yes;
	}

	/**
	 * @return the else branch, or null
	 */
	public CStatement getNo() {
		return no;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
