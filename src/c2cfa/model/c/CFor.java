package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CFor extends CStatement {

	private final CStatement init;
	private final CExpression condition;
	private final CExpression next;
	private final CStatement body;

	public CFor(SourceLocation location, CStatement init, CExpression condition, CExpression next, CStatement body) {
		super(location);
		this.init = init;
		this.condition = condition;
		this.next = next;
		this.body = body;
	}

	/**
	 * @return a declaration or expression statement, or null
	 */
	public CStatement getInit() {
		return init;
	}

	/**
	 * @return the loop condition, or null for <code>for(;;)</code>
	 */
	public CExpression getCondition() {
		return condition;
	}

	/**
	 * @return the update clause, or null
	 */
	public CExpression getNext() {
		return next;
	}

	public CStatement getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
