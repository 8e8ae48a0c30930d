package c2cfa.trans.passes.cfa;

import c2cfa.model.c.CIdentifierType;

import java.util.HashMap;
import java.util.Map;

/**
 * Normalises C type names: the specifier keywords are joined with underscores
 * and the integral and floating variants collapse to <code>int</code> and
 * <code>float</code>.
 */
public class TypeNames {
	private TypeNames() {}

	public static final String ARRAY_SUFFIX = "[]";

	static final Map<String, String> SYNONYMS = new HashMap<>();
	static {
		SYNONYMS.put("double", "float");
		SYNONYMS.put("long", "int");
		SYNONYMS.put("long_int", "int");
		SYNONYMS.put("long_long_int", "int");
		SYNONYMS.put("unsigned", "int");
		SYNONYMS.put("unsigned_int", "int");
		SYNONYMS.put("unsigned_long", "int");
		SYNONYMS.put("unsigned_long_int", "int");
	}

	public static String normalise(CIdentifierType type) {
		return normalise(type.joinedName());
	}

	public static String normalise(String joinedName) {
		return SYNONYMS.getOrDefault(joinedName, joinedName);
	}

	public static String arrayOf(String elementType) {
		return elementType + ARRAY_SUFFIX;
	}

	public static boolean isArray(String type) {
		return type.endsWith(ARRAY_SUFFIX);
	}

}
