package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CIdentifier extends CExpression {

	private final String name;

	public CIdentifier(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
