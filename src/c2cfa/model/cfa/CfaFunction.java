package c2cfa.model.cfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The automaton of one C function. A function that was only declared by a
 * prototype has a signature but no entry location.
 */
public class CfaFunction {

	private final String name;
	private final String returnType;
	private final List<Parameter> params;
	private final List<Location> locations;
	private final List<Transition> transitions;
	private final TypeRegistry types;
	private Location entry;
	private boolean usesNonLocalExits;

	public CfaFunction(String name, String returnType, List<Parameter> params) {
		this.name = name;
		this.returnType = returnType;
		this.params = Collections.unmodifiableList(new ArrayList<>(params));
		this.locations = new ArrayList<>();
		this.transitions = new ArrayList<>();
		this.types = new TypeRegistry();
		this.entry = null;
		this.usesNonLocalExits = false;
	}

	public String getName() {
		return name;
	}

	public String getReturnType() {
		return returnType;
	}

	public List<Parameter> getParams() {
		return params;
	}

	public boolean isDefined() {
		return entry != null;
	}

	/**
	 * @return the entry location, or null for a prototype
	 */
	public Location getEntry() {
		return entry;
	}

	public List<Location> getLocations() {
		return Collections.unmodifiableList(locations);
	}

	public List<Transition> getTransitions() {
		return Collections.unmodifiableList(transitions);
	}

	/**
	 * @return the transitions leaving the given location, in creation order
	 */
	public List<Transition> getTransitionsFrom(Location from) {
		List<Transition> result = new ArrayList<>();
		for (Transition t : transitions) {
			if (t.getFrom() == from) {
				result.add(t);
			}
		}
		return result;
	}

	public TypeRegistry getTypes() {
		return types;
	}

	public boolean usesNonLocalExits() {
		return usesNonLocalExits;
	}

	void markNonLocalExits() {
		usesNonLocalExits = true;
	}

	Location newLocation(String description) {
		Location location = new Location(locations.size(), description);
		locations.add(location);
		if (entry == null) {
			entry = location;
		}
		return location;
	}

	void addTransition(Transition transition) {
		transitions.add(transition);
	}

	void truncate(int locationCount, int transitionCount) {
		while (locations.size() > locationCount) {
			locations.remove(locations.size() - 1);
		}
		while (transitions.size() > transitionCount) {
			transitions.remove(transitions.size() - 1);
		}
	}

}
