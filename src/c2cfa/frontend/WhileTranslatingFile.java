package c2cfa.frontend;

import c2cfa.errors.Context;
import c2cfa.errors.ContextVisitor;

import java.nio.file.Path;

public class WhileTranslatingFile extends Context {

	private final Path file;
	private final String language;

	public WhileTranslatingFile(Path file, String language) {
		this.file = file;
		this.language = language;
	}

	public Path getFile() {
		return file;
	}

	public String getLanguage() {
		return language;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
