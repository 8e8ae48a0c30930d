package c2cfa.model.c;

public abstract class CStatementVisitor<T, E extends Throwable> {
	public abstract T visit(CCompound compound) throws E;
	public abstract T visit(CExpressionStatement expressionStatement) throws E;
	public abstract T visit(CDeclarationStatement declarationStatement) throws E;
	public abstract T visit(CIf cIf) throws E;
	public abstract T visit(CWhile cWhile) throws E;
	public abstract T visit(CDoWhile doWhile) throws E;
	public abstract T visit(CFor cFor) throws E;
	public abstract T visit(CSwitch cSwitch) throws E;
	public abstract T visit(CCase cCase) throws E;
	public abstract T visit(CDefault cDefault) throws E;
	public abstract T visit(CBreak cBreak) throws E;
	public abstract T visit(CContinue cContinue) throws E;
	public abstract T visit(CReturn cReturn) throws E;
	public abstract T visit(CLabel label) throws E;
	public abstract T visit(CGoto cGoto) throws E;
	public abstract T visit(CEmptyStatement emptyStatement) throws E;
}
