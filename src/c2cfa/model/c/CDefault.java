package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

public class CDefault extends CStatement {

	private final List<CStatement> statements;

	public CDefault(SourceLocation location, List<CStatement> statements) {
		super(location);
		this.statements = statements;
	}

	public List<CStatement> getStatements() {
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
