package c2cfa.formatters;

import c2cfa.errors.IssueVisitor;
import c2cfa.errors.IssueWithContext;
import c2cfa.frontend.UnknownLanguageIssue;
import c2cfa.trans.passes.cfa.UnsupportedFeatureIssue;
import c2cfa.trans.passes.parse.ParsingIssue;
import c2cfa.trans.passes.parse.option.OptionParserIssue;
import c2cfa.trans.passes.preprocess.PreprocessingIssue;
import c2cfa.trans.passes.preprocess.SourceReadingIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDetail());
		return null;
	}

	@Override
	public Void visit(SourceReadingIssue sourceReadingIssue) throws IOException {
		out.write("unable to read ");
		out.write(sourceReadingIssue.getFile().toString());
		out.write(": ");
		out.write(sourceReadingIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(PreprocessingIssue preprocessingIssue) throws IOException {
		out.write("preprocessing failed: ");
		out.write(preprocessingIssue.getDetail());
		String output = preprocessingIssue.getOutput();
		if (output != null && !output.isEmpty()) {
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (String line : output.split("\\R")) {
					out.newLine();
					out.write(line);
				}
			}
		}
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing " + parsingIssue.getLanguage() + ": ");
		out.write(parsingIssue.getError().getMessage());
		return null;
	}

	@Override
	public Void visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws IOException {
		out.write("unsupported construct");
		if (unsupportedFeatureIssue.getLine() >= 0) {
			out.write(" at line ");
			out.write(Integer.toString(unsupportedFeatureIssue.getLine()));
		}
		out.write(": ");
		out.write(unsupportedFeatureIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(UnknownLanguageIssue unknownLanguageIssue) throws IOException {
		out.write("no front end for language '");
		out.write(unknownLanguageIssue.getTag());
		out.write("'; known languages are ");
		out.write(String.join(", ", unknownLanguageIssue.getKnownTags()));
		return null;
	}

}
