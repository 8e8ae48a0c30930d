package c2cfa.model.c;

public abstract class CExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(CIdentifier identifier) throws E;
	public abstract T visit(CConstant constant) throws E;
	public abstract T visit(CBinaryOp binaryOp) throws E;
	public abstract T visit(CUnaryOp unaryOp) throws E;
	public abstract T visit(CAssignment assignment) throws E;
	public abstract T visit(CArrayRef arrayRef) throws E;
	public abstract T visit(CCast cast) throws E;
	public abstract T visit(CTernaryOp ternaryOp) throws E;
	public abstract T visit(CFunctionCall functionCall) throws E;
	public abstract T visit(CCommaExpression commaExpression) throws E;
	public abstract T visit(CInitList initList) throws E;
	public abstract T visit(CTypename typename) throws E;
}
