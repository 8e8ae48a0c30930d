package c2cfa.model.cfa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class TypeRegistry {

	private final Map<String, String> types = new LinkedHashMap<>();

	/**
	 * Records the declared type of a variable.
	 *
	 * @throws DuplicateTypeException if the name already has a type
	 */
	public void register(String name, String type) throws DuplicateTypeException {
		String existing = types.get(name);
		if (existing != null) {
			throw new DuplicateTypeException(name, existing);
		}
		types.put(name, type);
	}

	public boolean contains(String name) {
		return types.containsKey(name);
	}

	/**
	 * @return the registered type, or null
	 */
	public String lookup(String name) {
		return types.get(name);
	}

	public Map<String, String> asMap() {
		return Collections.unmodifiableMap(types);
	}

}
