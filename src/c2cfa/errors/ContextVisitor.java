package c2cfa.errors;

import c2cfa.frontend.WhileTranslatingFile;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileTranslatingFile whileTranslatingFile) throws E;

}
