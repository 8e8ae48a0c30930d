package c2cfa.formatters;

import c2cfa.errors.ContextVisitor;
import c2cfa.frontend.WhileTranslatingFile;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileTranslatingFile whileTranslatingFile) throws IOException {
		out.write("while translating ");
		out.write(whileTranslatingFile.getFile().toString());
		out.write(" as ");
		out.write(whileTranslatingFile.getLanguage());
		return null;
	}

}
