package c2cfa.model.cfa;

import java.util.Objects;

public class Variable extends Expression {

	/** the input stream consumed by <code>scanf</code> */
	public static final String IN = "$in";
	/** the output stream appended to by <code>printf</code> */
	public static final String OUT = "$out";
	/** the value returned by the enclosing function */
	public static final String RET = "$ret";
	/** target of calls whose value is unused */
	public static final String DISCARD = "_";

	private final String name;

	public Variable(String name, int line) {
		super(line);
		this.name = name;
	}

	public Variable(String name) {
		this(name, -1);
	}

	public String getName() {
		return name;
	}

	public boolean isPseudoVariable() {
		return IN.equals(name) || OUT.equals(name) || RET.equals(name);
	}

	@Override
	public Variable copy() {
		return new Variable(name, getLine());
	}

	@Override
	public <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(Variable.class, name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Variable other = (Variable) obj;
		return Objects.equals(name, other.name);
	}

}
