package c2cfa.model.cfa;

/**
 * A position in the append-only history of a function's automaton, taken so the
 * most recent additions can be withdrawn again.
 */
public class Checkpoint {

	private final CfaFunction function;
	private final Location location;
	private final int updateCount;
	private final int locationCount;
	private final int transitionCount;
	private final int warningCount;

	Checkpoint(CfaFunction function, Location location, int updateCount, int locationCount, int transitionCount,
	           int warningCount) {
		this.function = function;
		this.location = location;
		this.updateCount = updateCount;
		this.locationCount = locationCount;
		this.transitionCount = transitionCount;
		this.warningCount = warningCount;
	}

	public CfaFunction getFunction() {
		return function;
	}

	public Location getLocation() {
		return location;
	}

	int getUpdateCount() {
		return updateCount;
	}

	int getLocationCount() {
		return locationCount;
	}

	int getTransitionCount() {
		return transitionCount;
	}

	int getWarningCount() {
		return warningCount;
	}

	/**
	 * @return whether anything was scheduled or created since this checkpoint, given
	 * the location that is current now
	 */
	public boolean hasChangesSince(Location current) {
		return current != location
				|| location.countUpdates() != updateCount
				|| function.getLocations().size() != locationCount
				|| function.getTransitions().size() != transitionCount;
	}

}
