package c2cfa.parser;

import c2cfa.lexer.CToken;
import c2cfa.lexer.CTokenType;
import c2cfa.model.c.*;
import c2cfa.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A recursive-descent parser for the supported subset of C.
 *
 * Declarators are read into a list of modifiers in the order they apply to the
 * declared name and then folded into nested {@link CDeclarator}s, so
 * <code>int *a[3]</code> becomes an array declarator around a pointer declarator
 * around <code>a : int</code>. Statements following a <code>case</code> or
 * <code>default</code> label, up to the next label or the end of the enclosing
 * block, belong to that label.
 */
public class CParser {

	static final Set<String> TYPE_SPECIFIERS = new HashSet<>(Arrays.asList(
			"void", "char", "short", "int", "long", "float", "double", "signed", "unsigned", "_Bool"));

	static final Set<String> IGNORED_SPECIFIERS = new HashSet<>(Arrays.asList(
			"const", "volatile", "restrict", "static", "extern", "register", "auto", "inline"));

	static final Set<String> ASSIGNMENT_OPERATORS = new HashSet<>(Arrays.asList(
			"=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>="));

	// binary operators, loosest first
	static final String[][] BINARY_PRECEDENCE = {
			{"||"},
			{"&&"},
			{"|"},
			{"^"},
			{"&"},
			{"==", "!="},
			{"<", ">", "<=", ">="},
			{"<<", ">>"},
			{"+", "-"},
			{"*", "/", "%"},
	};

	private static class Modifier {
		enum Kind {
			POINTER,
			ARRAY,
			FUNCTION,
		}

		final Kind kind;
		final SourceLocation location;
		final CExpression dimension;
		final List<CDeclaration> params;

		Modifier(Kind kind, SourceLocation location, CExpression dimension, List<CDeclaration> params) {
			this.kind = kind;
			this.location = location;
			this.dimension = dimension;
			this.params = params;
		}
	}

	private static class PartialDeclarator {
		final SourceLocation location;
		String name;
		final List<Modifier> modifiers = new ArrayList<>();

		PartialDeclarator(SourceLocation location) {
			this.location = location;
		}

		boolean isFunction() {
			return !modifiers.isEmpty() && modifiers.get(0).kind == Modifier.Kind.FUNCTION;
		}
	}

	private final List<CToken> tokens;
	private int current;

	public CParser(List<CToken> tokens) {
		this.tokens = tokens;
		this.current = 0;
	}

	public CTranslationUnit parseTranslationUnit() throws ParsingError {
		SourceLocation start = peek().getLocation();
		List<CExternalDeclaration> externals = new ArrayList<>();
		while (peek().getType() != CTokenType.EOF) {
			if (peek().is(";")) {
				advance();
				continue;
			}
			externals.add(parseExternalDeclaration());
		}
		return new CTranslationUnit(start, externals);
	}

	private CToken peek() {
		return tokens.get(current);
	}

	private CToken peek(int ahead) {
		return tokens.get(Math.min(current + ahead, tokens.size() - 1));
	}

	private CToken advance() {
		CToken token = tokens.get(current);
		if (token.getType() != CTokenType.EOF) {
			current++;
		}
		return token;
	}

	private boolean accept(String text) {
		if (peek().is(text)) {
			advance();
			return true;
		}
		return false;
	}

	private CToken expect(String text) throws ParsingError {
		if (!peek().is(text)) {
			throw unexpected("'" + text + "'");
		}
		return advance();
	}

	private ParsingError unexpected(String wanted) {
		CToken token = peek();
		String found = token.getType() == CTokenType.EOF ? "end of input" : "'" + token.getValue() + "'";
		return new ParsingError(token.getLocation(), "expected " + wanted + " but found " + found);
	}

	private boolean startsDeclaration(CToken token) {
		if (token.getType() != CTokenType.KEYWORD) {
			return false;
		}
		String value = token.getValue();
		return TYPE_SPECIFIERS.contains(value) || IGNORED_SPECIFIERS.contains(value) || value.equals("struct")
				|| value.equals("union") || value.equals("enum") || value.equals("typedef");
	}

	// declarations

	private CExternalDeclaration parseExternalDeclaration() throws ParsingError {
		SourceLocation start = peek().getLocation();
		CIdentifierType type = parseDeclarationSpecifiers();
		PartialDeclarator first = parseDeclarator(false);
		if (first.isFunction() && peek().is("{")) {
			CDeclaration declaration = new CDeclaration(start, buildDeclarator(first, type), null);
			return new CFunctionDefinition(start, declaration, parseCompound());
		}
		return new CGlobalDeclaration(start, parseInitDeclarators(type, first));
	}

	private List<CDeclaration> parseDeclaration() throws ParsingError {
		CIdentifierType type = parseDeclarationSpecifiers();
		return parseInitDeclarators(type, parseDeclarator(false));
	}

	private List<CDeclaration> parseInitDeclarators(CIdentifierType type, PartialDeclarator first) throws ParsingError {
		List<CDeclaration> declarations = new ArrayList<>();
		PartialDeclarator next = first;
		while (true) {
			CExpression init = null;
			if (accept("=")) {
				init = parseInitializer();
			}
			declarations.add(new CDeclaration(next.location, buildDeclarator(next, type), init));
			if (!accept(",")) {
				break;
			}
			next = parseDeclarator(false);
		}
		expect(";");
		return declarations;
	}

	private CExpression parseInitializer() throws ParsingError {
		if (!peek().is("{")) {
			return parseAssignment();
		}
		SourceLocation start = advance().getLocation();
		List<CExpression> elements = new ArrayList<>();
		while (!peek().is("}")) {
			elements.add(parseInitializer());
			if (!accept(",")) {
				break;
			}
		}
		expect("}");
		return new CInitList(start, elements);
	}

	private CIdentifierType parseDeclarationSpecifiers() throws ParsingError {
		SourceLocation start = peek().getLocation();
		List<String> names = new ArrayList<>();
		while (peek().getType() == CTokenType.KEYWORD) {
			String value = peek().getValue();
			if (TYPE_SPECIFIERS.contains(value)) {
				names.add(value);
			} else if (IGNORED_SPECIFIERS.contains(value)) {
				// qualifiers and storage classes do not change the modelled type
			} else if (value.equals("struct") || value.equals("union") || value.equals("enum")
					|| value.equals("typedef")) {
				throw new ParsingError(peek().getLocation(), "'" + value + "' declarations are not supported");
			} else {
				break;
			}
			advance();
		}
		if (names.isEmpty()) {
			throw unexpected("a type specifier");
		}
		return new CIdentifierType(start, names);
	}

	private PartialDeclarator parseDeclarator(boolean allowAbstract) throws ParsingError {
		PartialDeclarator result = new PartialDeclarator(peek().getLocation());
		List<Modifier> pointers = new ArrayList<>();
		while (peek().is("*")) {
			pointers.add(new Modifier(Modifier.Kind.POINTER, advance().getLocation(), null, null));
			while (peek().getType() == CTokenType.KEYWORD && IGNORED_SPECIFIERS.contains(peek().getValue())) {
				advance();
			}
		}
		if (peek().getType() == CTokenType.IDENT) {
			result.name = advance().getValue();
		} else if (peek().is("(") && (peek(1).is("*") || peek(1).is("(") || peek(1).is("[")
				|| peek(1).getType() == CTokenType.IDENT)) {
			advance();
			PartialDeclarator nested = parseDeclarator(allowAbstract);
			expect(")");
			result.name = nested.name;
			result.modifiers.addAll(nested.modifiers);
		} else if (!allowAbstract) {
			throw unexpected("a declarator");
		}
		while (true) {
			if (peek().is("[")) {
				SourceLocation location = advance().getLocation();
				CExpression dimension = null;
				if (!peek().is("]")) {
					dimension = parseAssignment();
				}
				expect("]");
				result.modifiers.add(new Modifier(Modifier.Kind.ARRAY, location, dimension, null));
			} else if (peek().is("(")) {
				SourceLocation location = advance().getLocation();
				result.modifiers.add(new Modifier(Modifier.Kind.FUNCTION, location, null, parseParameters()));
			} else {
				break;
			}
		}
		// pointers bind more loosely than the suffixes, the innermost star last
		for (int i = pointers.size() - 1; i >= 0; --i) {
			result.modifiers.add(pointers.get(i));
		}
		return result;
	}

	private List<CDeclaration> parseParameters() throws ParsingError {
		if (accept(")")) {
			return Collections.emptyList();
		}
		List<CDeclaration> params = new ArrayList<>();
		while (true) {
			if (peek().is("...")) {
				throw new ParsingError(peek().getLocation(), "variadic functions are not supported");
			}
			SourceLocation start = peek().getLocation();
			CIdentifierType type = parseDeclarationSpecifiers();
			PartialDeclarator declarator = parseDeclarator(true);
			params.add(new CDeclaration(start, buildDeclarator(declarator, type), null));
			if (!accept(",")) {
				break;
			}
		}
		expect(")");
		return params;
	}

	private CDeclarator buildDeclarator(PartialDeclarator partial, CIdentifierType type) {
		CDeclarator result = new CTypeDeclarator(partial.location, partial.name, type);
		for (int i = partial.modifiers.size() - 1; i >= 0; --i) {
			Modifier modifier = partial.modifiers.get(i);
			switch (modifier.kind) {
				case POINTER:
					result = new CPointerDeclarator(modifier.location, result);
					break;
				case ARRAY:
					result = new CArrayDeclarator(modifier.location, result, modifier.dimension);
					break;
				case FUNCTION:
					result = new CFunctionDeclarator(modifier.location, result, modifier.params);
					break;
			}
		}
		return result;
	}

	private CTypename parseTypename() throws ParsingError {
		SourceLocation start = peek().getLocation();
		CIdentifierType type = parseDeclarationSpecifiers();
		PartialDeclarator declarator = parseDeclarator(true);
		if (declarator.name != null) {
			throw new ParsingError(start, "unexpected name '" + declarator.name + "' in type name");
		}
		return new CTypename(start, buildDeclarator(declarator, type));
	}

	// statements

	private CCompound parseCompound() throws ParsingError {
		SourceLocation start = expect("{").getLocation();
		List<CStatement> items = new ArrayList<>();
		while (!peek().is("}")) {
			if (peek().getType() == CTokenType.EOF) {
				throw unexpected("'}'");
			}
			items.add(parseBlockItem());
		}
		advance();
		return new CCompound(start, items);
	}

	private CStatement parseBlockItem() throws ParsingError {
		if (startsDeclaration(peek())) {
			SourceLocation start = peek().getLocation();
			return new CDeclarationStatement(start, parseDeclaration());
		}
		return parseStatement();
	}

	private List<CStatement> parseLabelledItems() throws ParsingError {
		List<CStatement> items = new ArrayList<>();
		while (!peek().is("}") && !peek().is("case") && !peek().is("default")
				&& peek().getType() != CTokenType.EOF) {
			items.add(parseBlockItem());
		}
		return items;
	}

	private CStatement parseStatement() throws ParsingError {
		CToken token = peek();
		SourceLocation start = token.getLocation();
		if (token.is("{")) {
			return parseCompound();
		}
		if (token.is(";")) {
			advance();
			return new CEmptyStatement(start);
		}
		if (token.is("if")) {
			advance();
			expect("(");
			CExpression condition = parseExpression();
			expect(")");
			CStatement yes = parseStatement();
			CStatement no = null;
			if (accept("else")) {
				no = parseStatement();
			}
			return new CIf(start, condition, yes, no);
		}
		if (token.is("while")) {
			advance();
			expect("(");
			CExpression condition = parseExpression();
			expect(")");
			return new CWhile(start, condition, parseStatement());
		}
		if (token.is("do")) {
			advance();
			CStatement body = parseStatement();
			expect("while");
			expect("(");
			CExpression condition = parseExpression();
			expect(")");
			expect(";");
			return new CDoWhile(start, condition, body);
		}
		if (token.is("for")) {
			return parseFor();
		}
		if (token.is("switch")) {
			advance();
			expect("(");
			CExpression condition = parseExpression();
			expect(")");
			return new CSwitch(start, condition, parseStatement());
		}
		if (token.is("case")) {
			advance();
			CExpression expression = parseConditional();
			expect(":");
			return new CCase(start, expression, parseLabelledItems());
		}
		if (token.is("default")) {
			advance();
			expect(":");
			return new CDefault(start, parseLabelledItems());
		}
		if (token.is("break")) {
			advance();
			expect(";");
			return new CBreak(start);
		}
		if (token.is("continue")) {
			advance();
			expect(";");
			return new CContinue(start);
		}
		if (token.is("return")) {
			advance();
			CExpression expression = null;
			if (!peek().is(";")) {
				expression = parseExpression();
			}
			expect(";");
			return new CReturn(start, expression);
		}
		if (token.is("goto")) {
			advance();
			if (peek().getType() != CTokenType.IDENT) {
				throw unexpected("a label");
			}
			String target = advance().getValue();
			expect(";");
			return new CGoto(start, target);
		}
		if (token.getType() == CTokenType.IDENT && peek(1).is(":")) {
			String name = advance().getValue();
			advance();
			return new CLabel(start, name, parseStatement());
		}
		CExpression expression = parseExpression();
		expect(";");
		return new CExpressionStatement(start, expression);
	}

	private CFor parseFor() throws ParsingError {
		SourceLocation start = expect("for").getLocation();
		expect("(");
		CStatement init = null;
		if (startsDeclaration(peek())) {
			SourceLocation initStart = peek().getLocation();
			init = new CDeclarationStatement(initStart, parseDeclaration());
		} else if (!accept(";")) {
			SourceLocation initStart = peek().getLocation();
			init = new CExpressionStatement(initStart, parseExpression());
			expect(";");
		}
		CExpression condition = null;
		if (!peek().is(";")) {
			condition = parseExpression();
		}
		expect(";");
		CExpression next = null;
		if (!peek().is(")")) {
			next = parseExpression();
		}
		expect(")");
		return new CFor(start, init, condition, next, parseStatement());
	}

	// expressions

	public CExpression parseExpression() throws ParsingError {
		SourceLocation start = peek().getLocation();
		CExpression first = parseAssignment();
		if (!peek().is(",")) {
			return first;
		}
		List<CExpression> expressions = new ArrayList<>();
		expressions.add(first);
		while (accept(",")) {
			expressions.add(parseAssignment());
		}
		return new CCommaExpression(start, expressions);
	}

	private CExpression parseAssignment() throws ParsingError {
		SourceLocation start = peek().getLocation();
		CExpression lhs = parseConditional();
		CToken token = peek();
		if (token.getType() == CTokenType.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(token.getValue())) {
			advance();
			return new CAssignment(start, token.getValue(), lhs, parseAssignment());
		}
		return lhs;
	}

	private CExpression parseConditional() throws ParsingError {
		SourceLocation start = peek().getLocation();
		CExpression condition = parseBinary(0);
		if (!accept("?")) {
			return condition;
		}
		CExpression yes = parseExpression();
		expect(":");
		CExpression no = parseConditional();
		return new CTernaryOp(start, condition, yes, no);
	}

	private CExpression parseBinary(int level) throws ParsingError {
		if (level == BINARY_PRECEDENCE.length) {
			return parseCast();
		}
		SourceLocation start = peek().getLocation();
		CExpression lhs = parseBinary(level + 1);
		while (true) {
			String operator = null;
			for (String candidate : BINARY_PRECEDENCE[level]) {
				if (peek().getType() == CTokenType.PUNCTUATOR && peek().getValue().equals(candidate)) {
					operator = candidate;
					break;
				}
			}
			if (operator == null) {
				return lhs;
			}
			advance();
			lhs = new CBinaryOp(start, operator, lhs, parseBinary(level + 1));
		}
	}

	private CExpression parseCast() throws ParsingError {
		if (peek().is("(") && startsDeclaration(peek(1))) {
			SourceLocation start = advance().getLocation();
			CTypename type = parseTypename();
			expect(")");
			if (peek().is("{")) {
				throw new ParsingError(start, "compound literals are not supported");
			}
			return new CCast(start, type, parseCast());
		}
		return parseUnary();
	}

	private CExpression parseUnary() throws ParsingError {
		CToken token = peek();
		SourceLocation start = token.getLocation();
		if (token.is("++") || token.is("--")) {
			advance();
			return new CUnaryOp(start, token.getValue(), parseUnary());
		}
		if (token.is("&") || token.is("*") || token.is("+") || token.is("-") || token.is("~") || token.is("!")) {
			advance();
			return new CUnaryOp(start, token.getValue(), parseCast());
		}
		if (token.is("sizeof")) {
			advance();
			if (peek().is("(") && startsDeclaration(peek(1))) {
				advance();
				CTypename type = parseTypename();
				expect(")");
				return new CUnaryOp(start, "sizeof", type);
			}
			return new CUnaryOp(start, "sizeof", parseUnary());
		}
		return parsePostfix();
	}

	private CExpression parsePostfix() throws ParsingError {
		SourceLocation start = peek().getLocation();
		CExpression expression = parsePrimary();
		while (true) {
			CToken token = peek();
			if (token.is("[")) {
				advance();
				CExpression subscript = parseExpression();
				expect("]");
				expression = new CArrayRef(start, expression, subscript);
			} else if (token.is("(")) {
				advance();
				List<CExpression> arguments = new ArrayList<>();
				if (!peek().is(")")) {
					do {
						arguments.add(parseAssignment());
					} while (accept(","));
				}
				expect(")");
				expression = new CFunctionCall(start, expression, arguments);
			} else if (token.is("++")) {
				advance();
				expression = new CUnaryOp(start, CUnaryOp.POST_INCREMENT, expression);
			} else if (token.is("--")) {
				advance();
				expression = new CUnaryOp(start, CUnaryOp.POST_DECREMENT, expression);
			} else if (token.is(".") || token.is("->")) {
				throw new ParsingError(token.getLocation(), "member access is not supported");
			} else {
				return expression;
			}
		}
	}

	private CExpression parsePrimary() throws ParsingError {
		CToken token = peek();
		SourceLocation start = token.getLocation();
		switch (token.getType()) {
			case IDENT:
				advance();
				return new CIdentifier(start, token.getValue());
			case INT_CONSTANT:
				advance();
				return new CConstant(start, CConstant.Kind.INT, token.getValue());
			case FLOAT_CONSTANT:
				advance();
				return new CConstant(start, CConstant.Kind.FLOAT, token.getValue());
			case CHAR_CONSTANT:
				advance();
				return new CConstant(start, CConstant.Kind.CHAR, token.getValue());
			case STRING: {
				// adjacent literals are concatenated
				StringBuilder value = new StringBuilder(advance().getValue());
				while (peek().getType() == CTokenType.STRING) {
					value.setLength(value.length() - 1);
					value.append(advance().getValue().substring(1));
				}
				return new CConstant(start, CConstant.Kind.STRING, value.toString());
			}
			default:
				if (accept("(")) {
					CExpression inner = parseExpression();
					expect(")");
					return inner;
				}
				throw unexpected("an expression");
		}
	}

}
