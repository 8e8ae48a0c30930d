package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CSwitch extends CStatement {

	private final CExpression condition;
	private final CStatement body;

	public CSwitch(SourceLocation location, CExpression condition, CStatement body) {
		super(location);
		this.condition = condition;
		this.body = body;
	}

	public CExpression getCondition() {
		return condition;
	}

	public CStatement getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
