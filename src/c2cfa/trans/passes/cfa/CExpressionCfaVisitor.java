package c2cfa.trans.passes.cfa;

import c2cfa.model.c.*;
import c2cfa.model.cfa.Checkpoint;
import c2cfa.model.cfa.Constant;
import c2cfa.model.cfa.Expression;
import c2cfa.model.cfa.Operation;
import c2cfa.model.cfa.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the symbolic value of a C expression, scheduling its side effects as
 * updates on the current location. A visit returns null when the expression has
 * no value (a <code>printf</code> call or a ternary that had to be split into
 * branches).
 *
 * Each instance counts the postfix increments it scheduled, so that an
 * assignment can put its own update ahead of them; the right-hand side of an
 * assignment is built by a fresh instance.
 */
public class CExpressionCfaVisitor extends CExpressionVisitor<Expression, RuntimeException> {

	static final Set<String> SYMBOLIC_CONSTANTS = new HashSet<>(Arrays.asList("EOF"));

	static final Set<String> LIBRARY_FUNCTIONS = new HashSet<>(Arrays.asList(
			"floor", "ceil", "pow", "abs", "sqrt", "log2", "log10", "log", "exp"));

	private final CfaBuilder builder;
	private final String scope;
	private final boolean inSwitch;
	private int pendingPostfix;

	public CExpressionCfaVisitor(CfaBuilder builder, String scope, boolean inSwitch) {
		this.builder = builder;
		this.scope = scope;
		this.inSwitch = inSwitch;
		this.pendingPostfix = 0;
	}

	public int getPendingPostfix() {
		return pendingPostfix;
	}

	private CExpressionCfaVisitor fresh() {
		return new CExpressionCfaVisitor(builder, scope, inSwitch);
	}

	/**
	 * Builds an expression whose value is needed.
	 */
	public Expression valueOf(CExpression expression) {
		Expression value = expression.accept(this);
		if (value == null) {
			throw new UnsupportedFeatureIssue("expression without a value used as an operand", expression.getLine());
		}
		return value;
	}

	private List<Expression> valuesOf(List<CExpression> expressions) {
		List<Expression> values = new ArrayList<>();
		for (CExpression expression : expressions) {
			values.add(valueOf(expression));
		}
		return values;
	}

	@Override
	public Expression visit(CIdentifier identifier) {
		if (SYMBOLIC_CONSTANTS.contains(identifier.getName())) {
			return new Constant(identifier.getName(), identifier.getLine());
		}
		return new Variable(identifier.getName(), identifier.getLine());
	}

	@Override
	public Expression visit(CConstant constant) {
		return new Constant(constant.getValue(), constant.getLine());
	}

	@Override
	public Expression visit(CBinaryOp binaryOp) {
		Expression lhs = valueOf(binaryOp.getLHS());
		Expression rhs = valueOf(binaryOp.getRHS());
		return new Operation(binaryOp.getOperator(), binaryOp.getLine(), lhs, rhs);
	}

	@Override
	public Expression visit(CUnaryOp unaryOp) {
		String operator = unaryOp.getOperator();
		int line = unaryOp.getLine();
		if (operator.equals("sizeof") && unaryOp.getOperand() instanceof CTypename) {
			return new Operation(operator, line, unaryOp.getOperand().accept(this));
		}
		Expression operand = valueOf(unaryOp.getOperand());
		switch (operator) {
			case "++":
			case "--":
				increment(operand, operator, line);
				return operand;
			case CUnaryOp.POST_INCREMENT:
			case CUnaryOp.POST_DECREMENT:
				increment(operand, operator, line);
				pendingPostfix++;
				return operand;
			default:
				return new Operation(operator, line, operand);
		}
	}

	private void increment(Expression operand, String operator, int line) {
		if (!(operand instanceof Variable)) {
			throw new UnsupportedFeatureIssue("'" + operator + "' applied to something other than a variable", line);
		}
		Variable variable = (Variable) operand;
		// "++" and "p++" both step by "+"
		String step = operator.substring(operator.length() - 1);
		builder.schedule(variable.getName(),
				new Operation(step, line, variable.copy(), new Constant("1", line)));
	}

	@Override
	public Expression visit(CAssignment assignment) {
		int line = assignment.getLine();
		Expression lvalue = valueOf(assignment.getLvalue());
		builder.recordLine(line, scope);

		CExpressionCfaVisitor rhsVisitor = fresh();
		Expression rvalue = assignment.getRvalue().accept(rhsVisitor);
		int postfix = rhsVisitor.getPendingPostfix();
		if (rvalue == null) {
			rvalue = new Constant(Constant.UNKNOWN_FORMAT, line);
		}

		String operator = assignment.getOperator();
		if (operator.length() == 2 && operator.charAt(1) == '=') {
			// "x op= e" becomes "x = x op e"
			rvalue = new Operation(operator.substring(0, 1), line, lvalue.copy(), rvalue);
		} else if (!operator.equals("=")) {
			throw new UnsupportedFeatureIssue("assignment operator '" + operator + "'", line);
		}

		String target;
		if (lvalue instanceof Variable) {
			target = ((Variable) lvalue).getName();
		} else if (isIndexOfVariable(lvalue)) {
			Operation index = (Operation) lvalue;
			target = ((Variable) index.getArg(0)).getName();
			rvalue = new Operation(Operation.ARRAY_ASSIGN, line, index.getArg(0).copy(), index.getArg(1).copy(), rvalue);
		} else {
			throw new UnsupportedFeatureIssue("assignment to '" + lvalue + "'", line);
		}

		builder.schedule(target, rvalue.copy(), postfix);
		return lvalue;
	}

	static boolean isIndexOfVariable(Expression expression) {
		if (!(expression instanceof Operation)) {
			return false;
		}
		Operation operation = (Operation) expression;
		return operation.getName().equals(Operation.INDEX) && operation.getArgs().size() == 2
				&& operation.getArg(0) instanceof Variable;
	}

	@Override
	public Expression visit(CArrayRef arrayRef) {
		Expression base = valueOf(arrayRef.getBase());
		if (!(base instanceof Variable)) {
			throw new UnsupportedFeatureIssue("indexing '" + base + "', which is not an array variable", arrayRef.getLine());
		}
		Expression subscript = valueOf(arrayRef.getSubscript());
		return new Operation(Operation.INDEX, arrayRef.getLine(), base, subscript);
	}

	@Override
	public Expression visit(CCast cast) {
		Expression type = cast.getType().accept(this);
		builder.recordLine(cast.getLine(), scope);
		Expression inner = valueOf(cast.getExpression());
		return new Operation(Operation.CAST, cast.getLine(), type, inner);
	}

	@Override
	public Expression visit(CTernaryOp ternaryOp) {
		int line = ternaryOp.getLine();
		Expression condition = valueOf(ternaryOp.getCondition());
		builder.recordLine(line, scope);
		if (builder.isAtFileScope()) {
			return new Operation(Operation.ITE, line, condition,
					valueOf(ternaryOp.getYes()), valueOf(ternaryOp.getNo()));
		}

		Checkpoint checkpoint = builder.checkpoint();
		Expression yes = ternaryOp.getYes().accept(this);
		Expression no = ternaryOp.getNo().accept(this);
		if (yes != null && no != null && !checkpoint.hasChangesSince(builder.getCurrent())) {
			return new Operation(Operation.ITE, line, condition, yes, no);
		}

		// the branches have effects of their own: withdraw them and translate as if/else
		builder.rollback(checkpoint);
		new CStatementCfaVisitor(builder, scope, inSwitch).translateIf(condition,
				new CExpressionStatement(ternaryOp.getYes().getLocation(), ternaryOp.getYes()),
				new CExpressionStatement(ternaryOp.getNo().getLocation(), ternaryOp.getNo()),
				line, scope);
		// whatever was pending now sits on a location that control has already left
		pendingPostfix = 0;
		return null;
	}

	@Override
	public Expression visit(CFunctionCall functionCall) {
		int line = functionCall.getLine();
		Expression callee = valueOf(functionCall.getFunction());
		builder.recordLine(line, scope);
		if (!(callee instanceof Variable)) {
			throw new UnsupportedFeatureIssue("call through '" + callee + "', which is not a function name", line);
		}
		String name = ((Variable) callee).getName();
		List<Expression> args = valuesOf(functionCall.getArguments());

		switch (name) {
			case "printf":
				IOCallModeling.printf(builder, args, line);
				return null;
			case "scanf":
				IOCallModeling.scanf(builder, args, line);
				return null;
			default:
				break;
		}
		if (builder.getAutomaton().isFunctionRegistered(name)) {
			List<Expression> callArgs = new ArrayList<>();
			callArgs.add(callee);
			callArgs.addAll(args);
			return new Operation(Operation.FUNC_CALL, callArgs, line);
		}
		if (LIBRARY_FUNCTIONS.contains(name)) {
			return new Operation(name, args, line);
		}
		throw new UnsupportedFeatureIssue("unsupported function call '" + name + "'", line);
	}

	@Override
	public Expression visit(CCommaExpression commaExpression) {
		Expression last = null;
		int before = pendingPostfix;
		for (CExpression expression : commaExpression.getExpressions()) {
			// increments of earlier operands are complete at the comma
			pendingPostfix = before;
			last = expression.accept(this);
		}
		return last;
	}

	@Override
	public Expression visit(CInitList initList) {
		builder.recordLine(initList.getLine(), scope);
		return new Operation(Operation.ARRAY_INIT, valuesOf(initList.getExpressions()), initList.getLine());
	}

	@Override
	public Expression visit(CTypename typename) {
		DeclaredEntity entity = typename.getDeclarator().accept(new DeclaratorResolver());
		builder.recordLine(typename.getLine(), scope);
		return new Constant(entity.getType(), typename.getLine());
	}

}
