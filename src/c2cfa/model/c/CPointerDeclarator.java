package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CPointerDeclarator extends CDeclarator {

	private final CDeclarator inner;

	public CPointerDeclarator(SourceLocation location, CDeclarator inner) {
		super(location);
		this.inner = inner;
	}

	public CDeclarator getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(CDeclaratorVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
