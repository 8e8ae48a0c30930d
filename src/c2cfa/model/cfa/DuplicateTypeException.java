package c2cfa.model.cfa;

public class DuplicateTypeException extends RuntimeException {

	private final String name;
	private final String existingType;

	public DuplicateTypeException(String name, String existingType) {
		super("type of '" + name + "' is already registered as " + existingType);
		this.name = name;
		this.existingType = existingType;
	}

	public String getName() {
		return name;
	}

	public String getExistingType() {
		return existingType;
	}

}
