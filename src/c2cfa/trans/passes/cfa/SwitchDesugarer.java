package c2cfa.trans.passes.cfa;

import c2cfa.model.c.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a <code>switch</code> into a chain of <code>if</code>/<code>else</code>
 * statements comparing the tested expression against each case label.
 *
 * Only structured switches are accepted: the body is a block made of case
 * groups with an optional trailing <code>default</code>, and every group but the
 * last leaves the switch with <code>break</code>, <code>continue</code> or
 * <code>return</code>. Labels without statements share the statements of the
 * next group.
 */
public class SwitchDesugarer {
	private SwitchDesugarer() {}

	private static class Group {
		final CStatement label;
		final List<CExpression> values = new ArrayList<>();
		final List<CStatement> statements = new ArrayList<>();
		boolean isDefault;

		Group(CStatement label) {
			this.label = label;
		}
	}

	/**
	 * @return the equivalent statement, or null for a switch without groups
	 */
	public static CStatement desugar(CSwitch cSwitch) {
		if (!(cSwitch.getBody() instanceof CCompound)) {
			throw new UnsupportedFeatureIssue("switch body is not a block of case labels", cSwitch.getLine());
		}
		List<Group> groups = group(cSwitch, (CCompound) cSwitch.getBody());
		if (groups.isEmpty()) {
			return null;
		}
		for (int i = 0; i < groups.size() - 1; ++i) {
			Group group = groups.get(i);
			if (!leavesSwitch(group.statements)) {
				throw new UnsupportedFeatureIssue("fallthrough between switch cases", group.label.getLine());
			}
		}

		CStatement chain = null;
		int start = groups.size() - 1;
		Group last = groups.get(start);
		if (last.isDefault) {
			chain = new CCompound(last.label.getLocation(), last.statements);
			start--;
		}
		for (int i = start; i >= 0; --i) {
			Group group = groups.get(i);
			CExpression test = null;
			for (CExpression value : group.values) {
				CExpression comparison = new CBinaryOp(value.getLocation(), "==", cSwitch.getCondition(), value);
				test = test == null ? comparison : new CBinaryOp(value.getLocation(), "||", test, comparison);
			}
			chain = new CIf(group.label.getLocation(), test,
					new CCompound(group.label.getLocation(), group.statements), chain);
		}
		return chain;
	}

	private static List<Group> group(CSwitch cSwitch, CCompound body) {
		List<Group> groups = new ArrayList<>();
		List<CExpression> pendingValues = new ArrayList<>();
		boolean sawDefault = false;
		for (CStatement item : body.getItems()) {
			if (sawDefault) {
				throw new UnsupportedFeatureIssue("'default' must be the last label of a switch", item.getLine());
			}
			Group group = new Group(item);
			if (item instanceof CCase) {
				CCase cCase = (CCase) item;
				pendingValues.add(cCase.getExpression());
				if (cCase.getStatements().isEmpty()) {
					continue;
				}
				group.statements.addAll(cCase.getStatements());
				group.values.addAll(pendingValues);
			} else if (item instanceof CDefault) {
				sawDefault = true;
				group.isDefault = true;
				group.statements.addAll(((CDefault) item).getStatements());
			} else {
				throw new UnsupportedFeatureIssue("switch body contains a statement outside of any case label",
						item.getLine());
			}
			pendingValues.clear();
			groups.add(group);
		}
		if (!pendingValues.isEmpty()) {
			// trailing labels without statements
			Group group = new Group(body.getItems().get(body.getItems().size() - 1));
			group.values.addAll(pendingValues);
			groups.add(group);
		}
		return groups;
	}

	private static boolean leavesSwitch(List<CStatement> statements) {
		if (statements.isEmpty()) {
			return false;
		}
		CStatement last = statements.get(statements.size() - 1);
		while (last instanceof CLabel) {
			last = ((CLabel) last).getStatement();
		}
		if (last instanceof CCompound) {
			return leavesSwitch(((CCompound) last).getItems());
		}
		return last instanceof CBreak || last instanceof CContinue || last instanceof CReturn;
	}

}
