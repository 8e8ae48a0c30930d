package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CLabel extends CStatement {

	private final String name;
	private final CStatement statement;

	public CLabel(SourceLocation location, String name, CStatement statement) {
		super(location);
		this.name = name;
		this.statement = statement;
	}

	public String getName() {
		return name;
	}

	public CStatement getStatement() {
		return statement;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
