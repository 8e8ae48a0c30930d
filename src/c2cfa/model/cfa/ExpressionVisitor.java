package c2cfa.model.cfa;

public abstract class ExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(Variable variable) throws E;
	public abstract T visit(Constant constant) throws E;
	public abstract T visit(Operation operation) throws E;
}
