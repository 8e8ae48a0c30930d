package c2cfa.lexer;

import c2cfa.parser.ParsingError;
import c2cfa.util.SourceLocation;

@SuppressWarnings("serial")
public class CLexerException extends ParsingError {

	public CLexerException(SourceLocation location, String msg) {
		super(location, msg);
	}

}
