package c2cfa.model.cfa;

import java.util.Objects;

public class Guard {

	public enum Kind {
		ALWAYS,
		WHEN,
		UNLESS,
	}

	private static final Guard ALWAYS = new Guard(Kind.ALWAYS, null);

	private final Kind kind;
	private final Expression condition;

	private Guard(Kind kind, Expression condition) {
		this.kind = kind;
		this.condition = condition;
	}

	public static Guard always() {
		return ALWAYS;
	}

	public static Guard when(Expression condition) {
		return new Guard(Kind.WHEN, condition);
	}

	public static Guard unless(Expression condition) {
		return new Guard(Kind.UNLESS, condition);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the tested condition, or null for unconditional guards
	 */
	public Expression getCondition() {
		return condition;
	}

	public boolean isUnconditional() {
		return kind == Kind.ALWAYS;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, condition);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Guard other = (Guard) obj;
		return kind == other.kind && Objects.equals(condition, other.condition);
	}

	@Override
	public String toString() {
		switch (kind) {
			case WHEN:
				return "[" + condition + "]";
			case UNLESS:
				return "[!(" + condition + ")]";
			default:
				return "[true]";
		}
	}

}
