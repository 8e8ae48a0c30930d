package c2cfa.model.cfa;

import c2cfa.Unreachable;
import c2cfa.formatters.ExpressionFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base of the symbolic expression values scheduled as updates and used as guards.
 *
 * Expressions are values: the source line they came from is carried along for
 * diagnostics but takes no part in equality. Whenever one expression is needed
 * in two places, one of the uses gets a {@link #copy()}.
 */
public abstract class Expression {

	private final int line;

	public Expression(int line) {
		this.line = line;
	}

	public int getLine() {
		return line;
	}

	public abstract Expression copy();

	public abstract <T, E extends Throwable> T accept(ExpressionVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		try {
			accept(new ExpressionFormattingVisitor(w));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
