package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public abstract class CExternalDeclaration extends CNode {

	public CExternalDeclaration(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CExternalDeclarationVisitor<T, E> v) throws E;

}
