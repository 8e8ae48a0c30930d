package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

public class CDeclarationStatement extends CStatement {

	private final List<CDeclaration> declarations;

	public CDeclarationStatement(SourceLocation location, List<CDeclaration> declarations) {
		super(location);
		this.declarations = declarations;
	}

	public List<CDeclaration> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
