package c2cfa.trans.passes.parse;

import c2cfa.errors.Issue;
import c2cfa.lexer.CLexer;
import c2cfa.model.c.CTranslationUnit;
import c2cfa.parser.CParser;
import c2cfa.parser.ParsingError;

import java.nio.file.Path;

public class CParsingPass {
	private CParsingPass() {}

	public static CTranslationUnit perform(Path inputFileName, String preprocessedContents) throws Issue {
		try {
			CLexer lexer = new CLexer(inputFileName, preprocessedContents);
			return new CParser(lexer.readTokens()).parseTranslationUnit();
		} catch (ParsingError e) {
			throw new ParsingIssue("C", e);
		}
	}
}
