package c2cfa.trans.passes.cfa;

import c2cfa.model.cfa.Constant;
import c2cfa.model.cfa.Expression;
import c2cfa.model.cfa.Operation;
import c2cfa.model.cfa.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Models <code>printf</code> as appending to the output stream
 * <code>$out</code> and <code>scanf</code> as consuming typed values from the
 * input stream <code>$in</code>.
 */
public class IOCallModeling {
	private IOCallModeling() {}

	// "%%" and assignment-suppressing "%*d" bind no argument; widths are dropped
	static final Pattern SCANF_SPECIFIER = Pattern.compile("%(%|\\*?)[0-9]*([hlLqjzt]*[a-zA-Z])?");

	static final String ANY_TYPE = "*";

	public static void printf(CfaBuilder builder, List<Expression> args, int line) {
		Constant format;
		List<Expression> formatArgs;
		if (args.isEmpty()) {
			builder.warn("'printf' with zero args at line " + line, line);
			format = new Constant(Constant.UNKNOWN_FORMAT, line);
			formatArgs = args;
		} else if (args.get(0) instanceof Constant) {
			format = (Constant) args.get(0);
			formatArgs = args.subList(1, args.size());
		} else {
			builder.warn("First argument of 'printf' at line " + line + " should be a format", line);
			format = new Constant(Constant.UNKNOWN_FORMAT, line);
			formatArgs = args;
		}
		String normalised = format.getValue()
				.replace("%lf", "%f")
				.replace("%ld", "%d")
				.replace("%lld", "%d");

		List<Expression> strFormatArgs = new ArrayList<>();
		strFormatArgs.add(new Constant(normalised, format.getLine()));
		strFormatArgs.addAll(formatArgs);
		builder.schedule(Variable.OUT, new Operation(Operation.STR_APPEND, line,
				new Variable(Variable.OUT, line),
				new Operation(Operation.STR_FORMAT, strFormatArgs, line)));
	}

	static List<String> specifiers(String format) {
		List<String> found = new ArrayList<>();
		Matcher m = SCANF_SPECIFIER.matcher(format);
		while (m.find()) {
			if (m.group(1).isEmpty() && m.group(2) != null) {
				found.add("%" + m.group(2));
			}
		}
		return found;
	}

	static String typeOf(String specifier) {
		switch (specifier) {
			case "%d":
			case "%i":
			case "%ld":
			case "%li":
			case "%lld":
			case "%lli":
				return "int";
			case "%c":
				return "char";
			case "%s":
				return "string";
			case "%f":
			case "%lf":
				return "float";
			case ANY_TYPE:
				return ANY_TYPE;
			default:
				return null;
		}
	}

	public static void scanf(CfaBuilder builder, List<Expression> args, int line) {
		if (args.isEmpty()) {
			builder.warn("'scanf' without arguments at line " + line + " (ignored)", line);
			return;
		}
		List<String> specifiers;
		List<Expression> targets;
		Expression format = args.get(0);
		if (format instanceof Constant && ((Constant) format).isStringLiteral()) {
			String text = ((Constant) format).getValue();
			specifiers = specifiers(text.substring(1, text.length() - 1));
			targets = args.subList(1, args.size());
		} else {
			builder.warn("First argument of 'scanf' at line " + line + " should be a (string) format (ignored)", line);
			specifiers = new ArrayList<>();
			targets = new ArrayList<>();
		}

		if (specifiers.size() != targets.size()) {
			builder.warn("Mismatch between format and number of argument(s) of 'scanf' at line " + line + ".", line);
		}

		for (int i = 0; i < targets.size(); ++i) {
			String specifier = i < specifiers.size() ? specifiers.get(i) : ANY_TYPE;
			String type = typeOf(specifier);
			if (type == null) {
				builder.warn("Invalid 'scanf' format " + specifier + " at line " + line + ".", line);
				type = ANY_TYPE;
			}

			Expression target = targets.get(i);
			if (target instanceof Operation && ((Operation) target).getName().equals("&")
					&& ((Operation) target).getArgs().size() == 1) {
				target = ((Operation) target).getArg(0);
			} else if (target instanceof Variable || CExpressionCfaVisitor.isIndexOfVariable(target)) {
				builder.warn("Forgotten '&' in 'scanf' at line " + line + "?", line);
			} else {
				throw new UnsupportedFeatureIssue("argument to scanf: '" + target + "'", line);
			}

			Expression read = new Operation(Operation.LIST_HEAD, line, new Constant(type, line),
					new Variable(Variable.IN, line));
			if (target instanceof Variable) {
				builder.schedule(((Variable) target).getName(), read);
			} else if (CExpressionCfaVisitor.isIndexOfVariable(target)) {
				Operation index = (Operation) target;
				builder.schedule(((Variable) index.getArg(0)).getName(), new Operation(Operation.ARRAY_ASSIGN, line,
						index.getArg(0).copy(), index.getArg(1).copy(), read));
			} else {
				throw new UnsupportedFeatureIssue("argument to scanf: '" + target + "'", line);
			}
			builder.schedule(Variable.IN, new Operation(Operation.LIST_TAIL, line, new Variable(Variable.IN, line)));
		}
	}

}
