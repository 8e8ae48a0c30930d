package c2cfa.model.cfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A control point of one function's automaton. The updates scheduled on a
 * location are applied in order when control leaves it, after which the guards
 * of its outgoing transitions select the successor.
 */
public class Location {

	private final int id;
	private final String description;
	private final List<Update> updates;

	public Location(int id, String description) {
		this.id = id;
		this.description = description;
		this.updates = new ArrayList<>();
	}

	public int getId() {
		return id;
	}

	public String getDescription() {
		return description;
	}

	public List<Update> getUpdates() {
		return Collections.unmodifiableList(updates);
	}

	void addUpdate(int index, Update update) {
		updates.add(index, update);
	}

	void truncateUpdates(int size) {
		while (updates.size() > size) {
			updates.remove(updates.size() - 1);
		}
	}

	int countUpdates() {
		return updates.size();
	}

	@Override
	public String toString() {
		return "L" + id;
	}

}
