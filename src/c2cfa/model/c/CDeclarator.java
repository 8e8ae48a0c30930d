package c2cfa.model.c;

import c2cfa.util.SourceLocation;

/**
 * The part of a declaration that names the entity and wraps its base type:
 * plain names, arrays, pointers and function signatures nest inside each other
 * the way C declarators do, so <code>int a[3]</code> is an array declarator
 * around the type declarator <code>a : int</code>.
 */
public abstract class CDeclarator extends CNode {

	public CDeclarator(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CDeclaratorVisitor<T, E> v) throws E;

}
