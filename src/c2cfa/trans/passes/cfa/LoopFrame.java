package c2cfa.trans.passes.cfa;

import c2cfa.model.cfa.Location;

/**
 * Jump targets of the innermost enclosing loop.
 */
public class LoopFrame {

	private final Location condition;
	private final Location exit;
	private final Location continueTarget;

	public LoopFrame(Location condition, Location exit, Location continueTarget) {
		this.condition = condition;
		this.exit = exit;
		this.continueTarget = continueTarget;
	}

	public Location getCondition() {
		return condition;
	}

	public Location getExit() {
		return exit;
	}

	/**
	 * @return where <code>continue</code> jumps: the update clause of a
	 * <code>for</code> loop if it has one, the condition otherwise
	 */
	public Location getContinueTarget() {
		return continueTarget != null ? continueTarget : condition;
	}

}
