package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CEmptyStatement extends CStatement {

	public CEmptyStatement(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
