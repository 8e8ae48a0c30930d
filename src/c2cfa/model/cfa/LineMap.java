package c2cfa.model.cfa;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps source lines to the dotted scope path they were translated in, such as
 * <code>main.while.if.</code>. Later records of a line replace earlier ones.
 */
public class LineMap {

	private final Map<Integer, String> scopes = new TreeMap<>();

	public void record(int line, String scope) {
		if (line < 0) {
			return;
		}
		scopes.put(line, scope);
	}

	public String lookup(int line) {
		return scopes.get(line);
	}

	public Map<Integer, String> asMap() {
		return Collections.unmodifiableMap(scopes);
	}

}
