package c2cfa.trans.passes.cfa;

import c2cfa.model.c.*;
import c2cfa.model.cfa.Checkpoint;
import c2cfa.model.cfa.Constant;
import c2cfa.model.cfa.Expression;
import c2cfa.model.cfa.Guard;
import c2cfa.model.cfa.Location;
import c2cfa.model.cfa.Operation;
import c2cfa.model.cfa.Variable;

/**
 * Translates statements into locations and transitions, starting at the
 * builder's current location and leaving a new current location behind.
 *
 * An instance carries the dotted scope used for the line map and whether it is
 * inside a desugared <code>switch</code>; nested constructs get their own
 * instances.
 */
public class CStatementCfaVisitor extends CStatementVisitor<Void, RuntimeException> {

	private final CfaBuilder builder;
	private final String scope;
	private final boolean inSwitch;

	public CStatementCfaVisitor(CfaBuilder builder, String scope, boolean inSwitch) {
		this.builder = builder;
		this.scope = scope;
		this.inSwitch = inSwitch;
	}

	private CExpressionCfaVisitor expressions(String expressionScope) {
		return new CExpressionCfaVisitor(builder, expressionScope, inSwitch);
	}

	private static Expression requireCondition(Expression condition, String construct, int line) {
		if (condition == null) {
			throw new UnsupportedFeatureIssue("condition of " + construct + " has no value", line);
		}
		return condition;
	}

	@Override
	public Void visit(CCompound compound) {
		for (CStatement item : compound.getItems()) {
			item.accept(this);
		}
		builder.recordLine(compound.getLine(), scope);
		return null;
	}

	@Override
	public Void visit(CExpressionStatement expressionStatement) {
		Expression value = expressionStatement.getExpression().accept(expressions(scope));
		// calls of program functions stay visible through the discard variable
		if (value instanceof Operation && ((Operation) value).getName().equals(Operation.FUNC_CALL)) {
			builder.schedule(Variable.DISCARD, value);
		}
		builder.recordLine(expressionStatement.getLine(), scope);
		return null;
	}

	@Override
	public Void visit(CDeclarationStatement declarationStatement) {
		DeclarationTranslator declarations = new DeclarationTranslator(builder, scope, inSwitch);
		for (CDeclaration declaration : declarationStatement.getDeclarations()) {
			declarations.translate(declaration);
		}
		builder.recordLine(declarationStatement.getLine(), scope);
		return null;
	}

	@Override
	public Void visit(CIf cIf) {
		String ifScope = scope + "if.";
		Expression condition = expressions(ifScope).valueOf(cIf.getCondition());
		translateIf(condition, cIf.getYes(), cIf.getNo(), cIf.getLine(), ifScope);
		builder.recordLine(cIf.getLine(), ifScope);
		return null;
	}

	/**
	 * Branches on a condition that has already been built at the current
	 * location. A missing else branch becomes an empty location.
	 */
	void translateIf(Expression condition, CStatement yes, CStatement no, int line, String branchScope) {
		Location branch = builder.getCurrent();
		Location yesLocation = builder.newLocation("inside the if-branch starting at line " + line);
		Location noLocation = builder.newLocation("inside the else-branch starting at line " + line);
		builder.addTransition(branch, Guard.when(condition), yesLocation);
		builder.addTransition(branch, Guard.unless(condition.copy()), noLocation);

		CStatementCfaVisitor branches = new CStatementCfaVisitor(builder, branchScope, inSwitch);
		builder.setCurrent(yesLocation);
		yes.accept(branches);
		Location yesEnd = builder.getCurrent();

		builder.setCurrent(noLocation);
		if (no != null) {
			no.accept(branches);
		}
		Location noEnd = builder.getCurrent();

		Location join = builder.newLocation("after the if-statement beginning at line " + line);
		builder.addTransition(yesEnd, Guard.always(), join);
		builder.addTransition(noEnd, Guard.always(), join);
		builder.setCurrent(join);
	}

	private void rejectInsideSwitch(String loop, int line) {
		if (inSwitch) {
			throw new UnsupportedFeatureIssue("'" + loop + "' loop inside a switch statement", line);
		}
	}

	@Override
	public Void visit(CWhile cWhile) {
		rejectInsideSwitch("while", cWhile.getLine());
		translateLoop("while", null, cWhile.getCondition(), null, cWhile.getBody(), false, cWhile.getLine(),
				scope + "while.");
		builder.recordLine(cWhile.getLine(), scope + "while.");
		return null;
	}

	@Override
	public Void visit(CDoWhile doWhile) {
		rejectInsideSwitch("do-while", doWhile.getLine());
		translateLoop("do-while", null, doWhile.getCondition(), null, doWhile.getBody(), true, doWhile.getLine(),
				scope + "dowhile.");
		builder.recordLine(doWhile.getLine(), scope + "dowhile.");
		return null;
	}

	@Override
	public Void visit(CFor cFor) {
		rejectInsideSwitch("for", cFor.getLine());
		translateLoop("for", cFor.getInit(), cFor.getCondition(), cFor.getNext(), cFor.getBody(), false,
				cFor.getLine(), scope + "for.");
		builder.recordLine(cFor.getLine(), scope + "for.");
		return null;
	}

	private void translateLoop(String kind, CStatement init, CExpression condition, CExpression next, CStatement body,
	                           boolean bodyFirst, int line, String loopScope) {
		CStatementCfaVisitor inner = new CStatementCfaVisitor(builder, loopScope, inSwitch);
		if (init != null) {
			init.accept(inner);
		}
		Location before = builder.getCurrent();
		Location conditionLocation = builder.newLocation("the condition of the '" + kind + "' loop at line " + line);
		Location bodyLocation = builder.newLocation(
				"inside the body of the '" + kind + "' loop beginning at line " + line);
		Location exitLocation = builder.newLocation("after the '" + kind + "' loop starting at line " + line);
		Location nextLocation = next == null ? null
				: builder.newLocation("update of the '" + kind + "' loop at line " + line);
		builder.addTransition(before, Guard.always(), bodyFirst ? bodyLocation : conditionLocation);

		builder.setCurrent(conditionLocation);
		Expression test = condition == null
				? new Constant("1", line)
				: requireCondition(condition.accept(new CExpressionCfaVisitor(builder, loopScope, inSwitch)),
						"the '" + kind + "' loop", line);
		Location conditionEnd = builder.getCurrent();
		builder.addTransition(conditionEnd, Guard.when(test), bodyLocation);
		builder.addTransition(conditionEnd, Guard.unless(test.copy()), exitLocation);

		builder.pushLoop(new LoopFrame(conditionLocation, exitLocation, nextLocation));
		builder.setCurrent(bodyLocation);
		body.accept(inner);
		builder.popLoop();

		if (nextLocation != null) {
			builder.jumpTo(nextLocation);
			next.accept(new CExpressionCfaVisitor(builder, loopScope, inSwitch));
		}
		builder.addTransition(builder.getCurrent(), Guard.always(), conditionLocation);
		builder.setCurrent(exitLocation);
	}

	@Override
	public Void visit(CSwitch cSwitch) {
		String switchScope = scope + "switch.";
		int line = cSwitch.getLine();

		// the tested expression is rebuilt for every case, so it must be pure
		Checkpoint checkpoint = builder.checkpoint();
		cSwitch.getCondition().accept(expressions(switchScope));
		boolean sideEffects = checkpoint.hasChangesSince(builder.getCurrent());
		builder.rollback(checkpoint);
		if (sideEffects) {
			throw new UnsupportedFeatureIssue("switch on an expression with side effects", line);
		}

		CStatement desugared = SwitchDesugarer.desugar(cSwitch);
		if (desugared != null) {
			desugared.accept(new CStatementCfaVisitor(builder, switchScope, true));
		}
		builder.recordLine(line, switchScope);
		return null;
	}

	@Override
	public Void visit(CCase cCase) {
		throw new UnsupportedFeatureIssue("'case' label outside of a switch body", cCase.getLine());
	}

	@Override
	public Void visit(CDefault cDefault) {
		throw new UnsupportedFeatureIssue("'default' label outside of a switch body", cDefault.getLine());
	}

	@Override
	public Void visit(CBreak cBreak) {
		if (inSwitch || builder.isSuppressingBreakContinue()) {
			return null;
		}
		LoopFrame loop = builder.innermostLoop();
		if (loop == null) {
			builder.warn("'break' outside loop at line " + cBreak.getLine(), cBreak.getLine());
			return null;
		}
		leaveTo(loop.getExit(), "after 'break' statement at line " + cBreak.getLine());
		builder.recordLine(cBreak.getLine(), scope);
		return null;
	}

	@Override
	public Void visit(CContinue cContinue) {
		if (builder.isSuppressingBreakContinue()) {
			return null;
		}
		LoopFrame loop = builder.innermostLoop();
		if (loop == null) {
			builder.warn("'continue' outside loop at line " + cContinue.getLine(), cContinue.getLine());
			return null;
		}
		leaveTo(loop.getContinueTarget(), "after 'continue' statement at line " + cContinue.getLine());
		builder.recordLine(cContinue.getLine(), scope);
		return null;
	}

	private void leaveTo(Location target, String unreachableDescription) {
		builder.getAutomaton().markNonLocalExits();
		Location from = builder.getCurrent();
		builder.addTransition(from, Guard.always(), target);
		// anything after the jump lands on a location nothing leads to
		builder.setCurrent(builder.newLocation(unreachableDescription));
	}

	@Override
	public Void visit(CReturn cReturn) {
		Expression value = null;
		if (cReturn.getExpression() != null) {
			value = cReturn.getExpression().accept(expressions(scope));
		}
		if (value == null) {
			value = Constant.top(cReturn.getLine());
		}
		builder.schedule(Variable.RET, value);
		builder.recordLine(cReturn.getLine(), scope);
		return null;
	}

	@Override
	public Void visit(CLabel label) {
		builder.warn("Ignoring label at line " + label.getLine() + ".", label.getLine());
		builder.recordLine(label.getLine(), scope);
		return label.getStatement().accept(this);
	}

	@Override
	public Void visit(CGoto cGoto) {
		throw new UnsupportedFeatureIssue("'goto " + cGoto.getTarget() + "' is not supported", cGoto.getLine());
	}

	@Override
	public Void visit(CEmptyStatement emptyStatement) {
		return null;
	}

}
