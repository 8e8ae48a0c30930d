package c2cfa;

public class Unreachable extends RuntimeException {

	public Unreachable(Exception cause) {
		super("unreachable", cause);
	}

}
