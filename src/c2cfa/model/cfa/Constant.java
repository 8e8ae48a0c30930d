package c2cfa.model.cfa;

import java.util.Objects;

public class Constant extends Expression {

	/** a value the model does not constrain */
	public static final String TOP = "top";
	/** stands in for a format string that could not be determined */
	public static final String UNKNOWN_FORMAT = "?";

	private final String value;

	public Constant(String value, int line) {
		super(line);
		this.value = value;
	}

	public Constant(String value) {
		this(value, -1);
	}

	public static Constant top(int line) {
		return new Constant(TOP, line);
	}

	public String getValue() {
		return value;
	}

	public boolean isStringLiteral() {
		return value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"");
	}

	@Override
	public Constant copy() {
		return new Constant(value, getLine());
	}

	@Override
	public <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(Constant.class, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Constant other = (Constant) obj;
		return Objects.equals(value, other.value);
	}

}
