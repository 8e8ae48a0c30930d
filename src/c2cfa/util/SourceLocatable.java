package c2cfa.util;

/**
 *
 * A common abstract base, typically meant for syntax tree nodes and tokens, that
 * should be implemented by anything that needs to be traced back to its
 * original location.
 *
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

	public int getLine() {
		return getLocation().getLine();
	}

}
