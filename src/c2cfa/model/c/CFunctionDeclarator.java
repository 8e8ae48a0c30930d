package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

public class CFunctionDeclarator extends CDeclarator {

	private final CDeclarator inner;
	private final List<CDeclaration> params;

	public CFunctionDeclarator(SourceLocation location, CDeclarator inner, List<CDeclaration> params) {
		super(location);
		this.inner = inner;
		this.params = params;
	}

	/**
	 * @return the declarator carrying the function name and return type
	 */
	public CDeclarator getInner() {
		return inner;
	}

	public List<CDeclaration> getParams() {
		return params;
	}

	@Override
	public <T, E extends Throwable> T accept(CDeclaratorVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
