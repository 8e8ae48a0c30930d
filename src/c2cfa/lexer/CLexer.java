package c2cfa.lexer;

import c2cfa.util.SourceLocation;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A lexer for preprocessed C.
 *
 * Comments are skipped so that unpreprocessed text can be lexed as well. Line
 * markers left behind by cpp (<code># 12 "file.c"</code> or
 * <code>#line 12 "file.c"</code>) reset the line counter, so token locations
 * refer to the original file; <code>#pragma</code> lines are ignored and any
 * other directive is an error.
 */
public class CLexer {

	static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
			"auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum",
			"extern", "float", "for", "goto", "if", "inline", "int", "long", "register", "restrict", "return",
			"short", "signed", "sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void",
			"volatile", "while", "_Bool"));

	// longest first
	static final String[] PUNCTUATORS = {
			"...", "<<=", ">>=",
			"->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
			"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
			"[", "]", "(", ")", "{", "}", ".", ";", ",", ":", "?", "~", "!",
			"+", "-", "*", "/", "%", "<", ">", "=", "&", "|", "^",
	};

	static final Pattern IDENT = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9]*");

	static final Pattern FLOAT = Pattern.compile(
			"(?:[0-9]*\\.[0-9]+(?:[eE][+-]?[0-9]+)?|[0-9]+\\.(?:[eE][+-]?[0-9]+)?|[0-9]+[eE][+-]?[0-9]+)[fFlL]?");
	static final Pattern INT = Pattern.compile("(?:0[xX][0-9a-fA-F]+|[0-9]+)[uUlL]*");

	static final Pattern LINE_MARKER = Pattern.compile("#\\s*(?:line\\s+)?([0-9]+)(?:\\s+\"((?:[^\"\\\\]|\\\\.)*)\")?.*");
	static final Pattern PRAGMA = Pattern.compile("#\\s*pragma\\b.*");

	private final String text;
	private final Path originalFile;

	private int pos;
	private int line;
	private int lineStart;
	private Path file;

	public CLexer(Path file, String text) {
		this.text = text;
		this.originalFile = file;
	}

	/**
	 * @return the tokens of the input, terminated by an {@link CTokenType#EOF} token
	 * @throws CLexerException if part of the input is not a C token
	 */
	public List<CToken> readTokens() throws CLexerException {
		pos = 0;
		line = 1;
		lineStart = 0;
		file = originalFile;
		List<CToken> tokens = new ArrayList<>();
		boolean atLineStart = true;
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (c == '\n') {
				newLine(pos + 1);
				atLineStart = true;
				continue;
			}
			if (c == '\\' && pos + 1 < text.length() && (text.charAt(pos + 1) == '\n' || text.charAt(pos + 1) == '\r')) {
				pos += text.charAt(pos + 1) == '\r' && pos + 2 < text.length() && text.charAt(pos + 2) == '\n' ? 3 : 2;
				line++;
				lineStart = pos;
				continue;
			}
			if (Character.isWhitespace(c)) {
				pos++;
				continue;
			}
			if (c == '#' && atLineStart) {
				readDirective();
				continue;
			}
			atLineStart = false;
			if (text.startsWith("//", pos)) {
				int end = text.indexOf('\n', pos);
				pos = end == -1 ? text.length() : end;
				continue;
			}
			if (text.startsWith("/*", pos)) {
				skipBlockComment();
				continue;
			}
			tokens.add(readToken());
		}
		tokens.add(new CToken("", CTokenType.EOF, location()));
		return tokens;
	}

	private void newLine(int next) {
		pos = next;
		line++;
		lineStart = next;
	}

	private SourceLocation location() {
		return new SourceLocation(file, line, pos - lineStart + 1);
	}

	private void readDirective() throws CLexerException {
		int end = text.indexOf('\n', pos);
		if (end == -1) {
			end = text.length();
		}
		String directive = text.substring(pos, end).trim();
		Matcher marker = LINE_MARKER.matcher(directive);
		if (marker.matches()) {
			String name = marker.group(2);
			if (name != null && !name.startsWith("<")) {
				file = Paths.get(name);
			} else if (name != null) {
				file = originalFile;
			}
			// the marker names the line that follows it
			pos = end;
			if (pos < text.length()) {
				newLine(pos + 1);
			}
			line = Integer.parseInt(marker.group(1));
			return;
		}
		if (PRAGMA.matcher(directive).matches()) {
			pos = end;
			return;
		}
		throw new CLexerException(location(), "unexpected preprocessor directive '" + directive + "'");
	}

	private void skipBlockComment() throws CLexerException {
		SourceLocation start = location();
		pos += 2;
		while (pos < text.length()) {
			if (text.startsWith("*/", pos)) {
				pos += 2;
				return;
			}
			if (text.charAt(pos) == '\n') {
				newLine(pos + 1);
			} else {
				pos++;
			}
		}
		throw new CLexerException(start, "unterminated comment");
	}

	private CToken readToken() throws CLexerException {
		SourceLocation start = location();
		char c = text.charAt(pos);
		if (c == '"' || c == '\'') {
			return readQuoted(c, start);
		}
		Matcher m = IDENT.matcher(text).region(pos, text.length());
		if (m.lookingAt()) {
			String value = m.group();
			pos = m.end();
			return new CToken(value, KEYWORDS.contains(value) ? CTokenType.KEYWORD : CTokenType.IDENT, start);
		}
		if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
			m = FLOAT.matcher(text).region(pos, text.length());
			if (m.lookingAt()) {
				pos = m.end();
				return new CToken(m.group(), CTokenType.FLOAT_CONSTANT, start);
			}
			m = INT.matcher(text).region(pos, text.length());
			if (m.lookingAt()) {
				pos = m.end();
				return new CToken(m.group(), CTokenType.INT_CONSTANT, start);
			}
		}
		for (String punctuator : PUNCTUATORS) {
			if (text.startsWith(punctuator, pos)) {
				pos += punctuator.length();
				return new CToken(punctuator, CTokenType.PUNCTUATOR, start);
			}
		}
		throw new CLexerException(start, "unexpected character '" + c + "'");
	}

	private CToken readQuoted(char quote, SourceLocation start) throws CLexerException {
		int begin = pos;
		pos++;
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (c == '\\' && pos + 1 < text.length()) {
				pos += 2;
			} else if (c == quote) {
				pos++;
				String value = text.substring(begin, pos);
				return new CToken(value, quote == '"' ? CTokenType.STRING : CTokenType.CHAR_CONSTANT, start);
			} else if (c == '\n') {
				break;
			} else {
				pos++;
			}
		}
		throw new CLexerException(start, quote == '"' ? "unterminated string literal" : "unterminated character constant");
	}

}
