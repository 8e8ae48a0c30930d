package c2cfa.model.c;

import java.util.List;

import c2cfa.util.SourceLocation;

public class CTranslationUnit extends CNode {

	private final List<CExternalDeclaration> externals;

	public CTranslationUnit(SourceLocation location, List<CExternalDeclaration> externals) {
		super(location);
		this.externals = externals;
	}

	public List<CExternalDeclaration> getExternals() {
		return externals;
	}

}
