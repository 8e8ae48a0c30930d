package c2cfa;

@SuppressWarnings("serial")
public class C2CfaOptionException extends C2CfaException {

	public C2CfaOptionException(String msg) {
		super("Option Error", msg);
	}

}
