package c2cfa.model.c;

public abstract class CExternalDeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(CFunctionDefinition functionDefinition) throws E;
	public abstract T visit(CGlobalDeclaration globalDeclaration) throws E;
}
