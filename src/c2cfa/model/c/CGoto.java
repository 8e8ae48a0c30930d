package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CGoto extends CStatement {

	private final String target;

	public CGoto(SourceLocation location, String target) {
		super(location);
		this.target = target;
	}

	public String getTarget() {
		return target;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
