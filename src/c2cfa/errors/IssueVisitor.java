package c2cfa.errors;

import c2cfa.frontend.UnknownLanguageIssue;
import c2cfa.trans.passes.cfa.UnsupportedFeatureIssue;
import c2cfa.trans.passes.parse.ParsingIssue;
import c2cfa.trans.passes.parse.option.OptionParserIssue;
import c2cfa.trans.passes.preprocess.PreprocessingIssue;
import c2cfa.trans.passes.preprocess.SourceReadingIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(SourceReadingIssue sourceReadingIssue) throws E;
	public abstract T visit(PreprocessingIssue preprocessingIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(UnsupportedFeatureIssue unsupportedFeatureIssue) throws E;
	public abstract T visit(UnknownLanguageIssue unknownLanguageIssue) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
}
