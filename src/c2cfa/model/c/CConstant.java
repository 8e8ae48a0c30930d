package c2cfa.model.c;

import c2cfa.util.SourceLocation;

/**
 * A literal exactly as written; string and character literals keep their quotes
 * and escapes.
 */
public class CConstant extends CExpression {

	public enum Kind {
		INT,
		FLOAT,
		CHAR,
		STRING,
	}

	private final Kind kind;
	private final String value;

	public CConstant(SourceLocation location, Kind kind, String value) {
		super(location);
		this.kind = kind;
		this.value = value;
	}

	public Kind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
