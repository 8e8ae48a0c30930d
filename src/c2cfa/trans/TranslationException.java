package c2cfa.trans;

import c2cfa.C2CfaException;

/**
 * Failure while turning a C source file into a control-flow automaton.
 */
@SuppressWarnings("serial")
public class TranslationException extends C2CfaException {

	public TranslationException(String msg) {
		super("Translation Error", msg);
	}

}
