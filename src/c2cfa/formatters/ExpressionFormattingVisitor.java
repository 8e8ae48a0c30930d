package c2cfa.formatters;

import c2cfa.model.cfa.Constant;
import c2cfa.model.cfa.Expression;
import c2cfa.model.cfa.ExpressionVisitor;
import c2cfa.model.cfa.Operation;
import c2cfa.model.cfa.Variable;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Renders expressions in a C-like notation: operators spelled like C operators
 * are written infix (binary) or prefix (unary) and fully parenthesised,
 * everything else is written as a call.
 */
public class ExpressionFormattingVisitor extends ExpressionVisitor<Void, IOException> {

	private static final Set<String> SYMBOLIC = new HashSet<>(Arrays.asList(
			"+", "-", "*", "/", "%", "<", ">", "<=", ">=", "==", "!=", "&&", "||", "&", "|", "^", "<<", ">>",
			"!", "~", "sizeof"));

	private final Writer out;

	public ExpressionFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(Variable variable) throws IOException {
		out.write(variable.getName());
		return null;
	}

	@Override
	public Void visit(Constant constant) throws IOException {
		out.write(constant.getValue());
		return null;
	}

	@Override
	public Void visit(Operation operation) throws IOException {
		String name = operation.getName();
		if (name.equals(Operation.INDEX) && operation.getArgs().size() == 2) {
			operation.getArg(0).accept(this);
			out.write("[");
			operation.getArg(1).accept(this);
			out.write("]");
		} else if (SYMBOLIC.contains(name) && operation.getArgs().size() == 2) {
			out.write("(");
			operation.getArg(0).accept(this);
			out.write(" ");
			out.write(name);
			out.write(" ");
			operation.getArg(1).accept(this);
			out.write(")");
		} else if (SYMBOLIC.contains(name) && operation.getArgs().size() == 1) {
			out.write(name);
			out.write("(");
			operation.getArg(0).accept(this);
			out.write(")");
		} else {
			out.write(name);
			out.write("(");
			boolean first = true;
			for (Expression arg : operation.getArgs()) {
				if (first) {
					first = false;
				} else {
					out.write(", ");
				}
				arg.accept(this);
			}
			out.write(")");
		}
		return null;
	}

}
