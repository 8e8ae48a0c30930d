package c2cfa.model.cfa;

public class Transition {

	private final Location from;
	private final Guard guard;
	private final Location to;

	public Transition(Location from, Guard guard, Location to) {
		this.from = from;
		this.guard = guard;
		this.to = to;
	}

	public Location getFrom() {
		return from;
	}

	public Guard getGuard() {
		return guard;
	}

	public Location getTo() {
		return to;
	}

	@Override
	public String toString() {
		return from + " --" + guard + "--> " + to;
	}

}
