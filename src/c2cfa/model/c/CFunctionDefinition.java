package c2cfa.model.c;

import c2cfa.util.SourceLocation;

public class CFunctionDefinition extends CExternalDeclaration {

	private final CDeclaration declaration;
	private final CCompound body;

	public CFunctionDefinition(SourceLocation location, CDeclaration declaration, CCompound body) {
		super(location);
		this.declaration = declaration;
		this.body = body;
	}

	public CDeclaration getDeclaration() {
		return declaration;
	}

	public CCompound getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CExternalDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
