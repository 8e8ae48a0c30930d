package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public abstract class CStatement extends CNode {

	public CStatement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E;

}
