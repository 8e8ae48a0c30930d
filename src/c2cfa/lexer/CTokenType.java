package c2cfa.lexer;

public enum CTokenType {
	IDENT,
	KEYWORD,
	INT_CONSTANT,
	FLOAT_CONSTANT,
	CHAR_CONSTANT,
	STRING,
	PUNCTUATOR,
	// end of input, always the last token
	EOF,
}
