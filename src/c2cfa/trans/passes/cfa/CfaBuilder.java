package c2cfa.trans.passes.cfa;

import c2cfa.InternalCompilerError;
import c2cfa.model.cfa.Checkpoint;
import c2cfa.model.cfa.ControlFlowAutomaton;
import c2cfa.model.cfa.Expression;
import c2cfa.model.cfa.Guard;
import c2cfa.model.cfa.Location;
import c2cfa.model.cfa.TranslationWarning;
import c2cfa.model.cfa.Update;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable state shared by the translation visitors: the automaton, the current
 * location and the stack of enclosing loops.
 *
 * The current location never has outgoing transitions. At file scope there is no
 * current location and scheduled updates become global initial updates.
 */
public class CfaBuilder {

	private final ControlFlowAutomaton cfa;
	private final boolean suppressBreakContinue;
	private final Deque<LoopFrame> loops;
	private Location current;

	public CfaBuilder(ControlFlowAutomaton cfa, boolean suppressBreakContinue) {
		this.cfa = cfa;
		this.suppressBreakContinue = suppressBreakContinue;
		this.loops = new ArrayDeque<>();
		this.current = null;
	}

	public ControlFlowAutomaton getAutomaton() {
		return cfa;
	}

	public boolean isSuppressingBreakContinue() {
		return suppressBreakContinue;
	}

	public boolean isAtFileScope() {
		return current == null;
	}

	public Location getCurrent() {
		if (current == null) {
			throw new InternalCompilerError("no current location at file scope");
		}
		return current;
	}

	public void setCurrent(Location location) {
		this.current = location;
	}

	public Location newLocation(String description) {
		return cfa.createLocation(description);
	}

	public void addTransition(Location from, Guard guard, Location to) {
		cfa.addTransition(from, guard, to);
	}

	/**
	 * Moves on to a fresh location reached unconditionally from the current one.
	 */
	public Location jumpTo(Location target) {
		cfa.addTransition(getCurrent(), Guard.always(), target);
		current = target;
		return target;
	}

	public void schedule(String variable, Expression expression) {
		schedule(variable, expression, 0);
	}

	/**
	 * Schedules an update on the current location, ahead of the last
	 * <code>beforeLast</code> updates already there.
	 */
	public void schedule(String variable, Expression expression, int beforeLast) {
		Update update = new Update(variable, expression);
		if (current == null) {
			cfa.addGlobalUpdate(update);
		} else if (beforeLast == 0) {
			cfa.addUpdate(current, update);
		} else {
			cfa.addUpdate(current, update, beforeLast);
		}
	}

	public Checkpoint checkpoint() {
		return cfa.checkpoint(getCurrent());
	}

	public void rollback(Checkpoint checkpoint) {
		cfa.rollback(checkpoint);
		current = checkpoint.getLocation();
	}

	public void warn(String message, int line) {
		cfa.recordWarning(new TranslationWarning(message, line));
	}

	public void recordLine(int line, String scope) {
		cfa.recordLineScope(line, scope);
	}

	public void pushLoop(LoopFrame frame) {
		loops.push(frame);
	}

	public void popLoop() {
		if (loops.isEmpty()) {
			throw new InternalCompilerError("loop stack underflow");
		}
		loops.pop();
	}

	/**
	 * @return the innermost enclosing loop, or null outside of loops
	 */
	public LoopFrame innermostLoop() {
		return loops.peek();
	}

}
