package c2cfa;

/**
 * Root of the translator's own exceptions. The message is the detail prefixed
 * with the kind of failure, as in <code>"Option Error: missing input file"</code>.
 */
public abstract class C2CfaException extends RuntimeException {

	private final String msg;

	protected C2CfaException(String kind, String msg) {
		super(kind + ": " + msg);
		this.msg = msg;
	}

	/**
	 * @return the detail, without the kind prefix
	 */
	public String getMsg() {
		return msg;
	}

}
