package c2cfa.trans.passes.cfa;

import c2cfa.model.c.CArrayDeclarator;
import c2cfa.model.c.CDeclaratorVisitor;
import c2cfa.model.c.CFunctionDeclarator;
import c2cfa.model.c.CPointerDeclarator;
import c2cfa.model.c.CTypeDeclarator;

/**
 * Resolves variable declarators: scalars and one-dimensional arrays.
 */
public class DeclaratorResolver extends CDeclaratorVisitor<DeclaredEntity, RuntimeException> {

	@Override
	public DeclaredEntity visit(CTypeDeclarator typeDeclarator) {
		return new DeclaredEntity(typeDeclarator.getName(), TypeNames.normalise(typeDeclarator.getType()), null);
	}

	@Override
	public DeclaredEntity visit(CArrayDeclarator arrayDeclarator) {
		DeclaredEntity inner = arrayDeclarator.getInner().accept(this);
		if (inner.getDimension() != null || TypeNames.isArray(inner.getType())) {
			throw new UnsupportedFeatureIssue("multi-dimensional array", arrayDeclarator.getLine());
		}
		return new DeclaredEntity(inner.getName(), TypeNames.arrayOf(inner.getType()),
				arrayDeclarator.getDimension());
	}

	@Override
	public DeclaredEntity visit(CPointerDeclarator pointerDeclarator) {
		throw new UnsupportedFeatureIssue("pointer declaration", pointerDeclarator.getLine());
	}

	@Override
	public DeclaredEntity visit(CFunctionDeclarator functionDeclarator) {
		throw new UnsupportedFeatureIssue("function declarator in a variable declaration", functionDeclarator.getLine());
	}

}
