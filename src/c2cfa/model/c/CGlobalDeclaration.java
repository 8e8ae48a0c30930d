package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

/**
 * A file-scope declaration list: global variables and function prototypes.
 */
public class CGlobalDeclaration extends CExternalDeclaration {

	private final List<CDeclaration> declarations;

	public CGlobalDeclaration(SourceLocation location, List<CDeclaration> declarations) {
		super(location);
		this.declarations = declarations;
	}

	public List<CDeclaration> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(CExternalDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
