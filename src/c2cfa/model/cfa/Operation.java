package c2cfa.model.cfa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An operator applied to an ordered list of arguments. Besides the C operators
 * (spelled as in C) the model knows the tags below, plus the names of the
 * supported math library functions.
 */
public class Operation extends Expression {

	public static final String INDEX = "[]";
	public static final String ITE = "ite";
	public static final String CAST = "cast";
	public static final String ARRAY_CREATE = "ArrayCreate";
	public static final String ARRAY_INIT = "ArrayInit";
	public static final String ARRAY_ASSIGN = "ArrayAssign";
	public static final String FUNC_CALL = "FuncCall";
	public static final String STR_APPEND = "StrAppend";
	public static final String STR_FORMAT = "StrFormat";
	public static final String LIST_HEAD = "ListHead";
	public static final String LIST_TAIL = "ListTail";

	private final String name;
	private final List<Expression> args;

	public Operation(String name, List<Expression> args, int line) {
		super(line);
		this.name = name;
		this.args = Collections.unmodifiableList(new ArrayList<>(args));
	}

	public Operation(String name, int line, Expression... args) {
		this(name, Arrays.asList(args), line);
	}

	public String getName() {
		return name;
	}

	public List<Expression> getArgs() {
		return args;
	}

	public Expression getArg(int i) {
		return args.get(i);
	}

	@Override
	public Operation copy() {
		List<Expression> copied = new ArrayList<>();
		for (Expression arg : args) {
			copied.add(arg.copy());
		}
		return new Operation(name, copied, getLine());
	}

	@Override
	public <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(Operation.class, name, args);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Operation other = (Operation) obj;
		return Objects.equals(name, other.name) && Objects.equals(args, other.args);
	}

}
