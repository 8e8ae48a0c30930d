package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CReturn extends CStatement {

	private final CExpression expression;

	public CReturn(SourceLocation location, CExpression expression) {
		super(location);
		this.expression = expression;
	}

	/**
	 * @return the returned value, or null for a bare <code>return;</code>
	 */
	public CExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
