package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

public class CCompound extends CStatement {

	private final List<CStatement> items;

	public CCompound(SourceLocation location, List<CStatement> items) {
		super(location);
		this.items = items;
	}

	public List<CStatement> getItems() {
		return items;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
