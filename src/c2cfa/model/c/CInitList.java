package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

public class CInitList extends CExpression {

	private final List<CExpression> expressions;

	public CInitList(SourceLocation location, List<CExpression> expressions) {
		super(location);
		this.expressions = expressions;
	}

	public List<CExpression> getExpressions() {
		return expressions;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
