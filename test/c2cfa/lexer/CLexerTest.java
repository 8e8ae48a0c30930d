package c2cfa.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import c2cfa.util.SourceLocation;

@RunWith(Parameterized.class)
public class CLexerTest {

	static Path testFile = Paths.get("TEST");

	private static CToken tok(String value, CTokenType type, int line, int column) {
		return new CToken(value, type, new SourceLocation(testFile, line, column));
	}

	private static CToken tok(Path file, String value, CTokenType type, int line, int column) {
		return new CToken(value, type, new SourceLocation(file, line, column));
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{"", Collections.singletonList(tok("", CTokenType.EOF, 1, 1))},
			{"int x;", Arrays.asList(
					tok("int", CTokenType.KEYWORD, 1, 1),
					tok("x", CTokenType.IDENT, 1, 5),
					tok(";", CTokenType.PUNCTUATOR, 1, 6),
					tok("", CTokenType.EOF, 1, 7))},
			{"x <<= 0x1F;", Arrays.asList(
					tok("x", CTokenType.IDENT, 1, 1),
					tok("<<=", CTokenType.PUNCTUATOR, 1, 3),
					tok("0x1F", CTokenType.INT_CONSTANT, 1, 7),
					tok(";", CTokenType.PUNCTUATOR, 1, 11),
					tok("", CTokenType.EOF, 1, 12))},
			{"1.5e3 10UL .5", Arrays.asList(
					tok("1.5e3", CTokenType.FLOAT_CONSTANT, 1, 1),
					tok("10UL", CTokenType.INT_CONSTANT, 1, 7),
					tok(".5", CTokenType.FLOAT_CONSTANT, 1, 12),
					tok("", CTokenType.EOF, 1, 14))},
			{"'a' \"s\\\"t\"", Arrays.asList(
					tok("'a'", CTokenType.CHAR_CONSTANT, 1, 1),
					tok("\"s\\\"t\"", CTokenType.STRING, 1, 5),
					tok("", CTokenType.EOF, 1, 11))},
			{"a++ + b", Arrays.asList(
					tok("a", CTokenType.IDENT, 1, 1),
					tok("++", CTokenType.PUNCTUATOR, 1, 2),
					tok("+", CTokenType.PUNCTUATOR, 1, 5),
					tok("b", CTokenType.IDENT, 1, 7),
					tok("", CTokenType.EOF, 1, 8))},
			{"a // rest\n/* multi\nline */ b", Arrays.asList(
					tok("a", CTokenType.IDENT, 1, 1),
					tok("b", CTokenType.IDENT, 3, 9),
					tok("", CTokenType.EOF, 3, 10))},
			{"#pragma once\nwhile", Arrays.asList(
					tok("while", CTokenType.KEYWORD, 2, 1),
					tok("", CTokenType.EOF, 2, 6))},
			{"# 1 \"<stdin>\"\nx\n# 10 \"<stdin>\"\ny", Arrays.asList(
					tok("x", CTokenType.IDENT, 1, 1),
					tok("y", CTokenType.IDENT, 10, 1),
					tok("", CTokenType.EOF, 10, 2))},
			{"#line 7 \"prog.c\"\nz", Arrays.asList(
					tok(Paths.get("prog.c"), "z", CTokenType.IDENT, 7, 1),
					tok(Paths.get("prog.c"), "", CTokenType.EOF, 7, 2))},
			{"a \\\nb", Arrays.asList(
					tok("a", CTokenType.IDENT, 1, 1),
					tok("b", CTokenType.IDENT, 2, 1),
					tok("", CTokenType.EOF, 2, 2))},
		});
	}

	private String input;
	private List<CToken> expected;

	public CLexerTest(String input, List<CToken> expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() throws CLexerException {
		CLexer lexer = new CLexer(testFile, input);
		assertThat(lexer.readTokens(), is(expected));
	}

}
