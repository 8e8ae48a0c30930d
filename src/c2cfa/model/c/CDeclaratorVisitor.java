package c2cfa.model.c;

public abstract class CDeclaratorVisitor<T, E extends Throwable> {
	public abstract T visit(CTypeDeclarator typeDeclarator) throws E;
	public abstract T visit(CArrayDeclarator arrayDeclarator) throws E;
	public abstract T visit(CPointerDeclarator pointerDeclarator) throws E;
	public abstract T visit(CFunctionDeclarator functionDeclarator) throws E;
}
