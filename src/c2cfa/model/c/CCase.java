package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

/**
 * A <code>case</code> label together with the statements that follow it up to
 * the next label of the same switch.
 */
public class CCase extends CStatement {

	private final CExpression expression;
	private final List<CStatement> statements;

	public CCase(SourceLocation location, CExpression expression, List<CStatement> statements) {
		super(location);
		this.expression = expression;
		this.statements = statements;
	}

	public CExpression getExpression() {
		return expression;
	}

	public List<CStatement> getStatements() {
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
