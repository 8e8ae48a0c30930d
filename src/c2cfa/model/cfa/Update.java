package c2cfa.model.cfa;

import java.util.Objects;

public class Update {

	private final String variable;
	private final Expression expression;

	public Update(String variable, Expression expression) {
		this.variable = variable;
		this.expression = expression;
	}

	public String getVariable() {
		return variable;
	}

	public Expression getExpression() {
		return expression;
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Update other = (Update) obj;
		return Objects.equals(variable, other.variable) && Objects.equals(expression, other.expression);
	}

	@Override
	public String toString() {
		return variable + " := " + expression;
	}

}
