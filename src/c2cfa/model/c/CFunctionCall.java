package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

public class CFunctionCall extends CExpression {

	private final CExpression function;
	private final List<CExpression> arguments;

	public CFunctionCall(SourceLocation location, CExpression function, List<CExpression> arguments) {
		super(location);
		this.function = function;
		this.arguments = arguments;
	}

	public CExpression getFunction() {
		return function;
	}

	public List<CExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
