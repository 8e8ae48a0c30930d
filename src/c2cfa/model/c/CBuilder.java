package c2cfa.model.c;

import c2cfa.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static helpers for building syntax trees by hand. All nodes get unknown source
 * locations.
 */
public class CBuilder {
	private CBuilder() {}

	private static SourceLocation loc() {
		return SourceLocation.unknown();
	}

	public static CTranslationUnit unit(CExternalDeclaration... externals) {
		return new CTranslationUnit(loc(), Arrays.asList(externals));
	}

	public static CIdentifierType type(String... names) {
		return new CIdentifierType(loc(), Arrays.asList(names));
	}

	public static CDeclaration decl(CIdentifierType type, String name) {
		return new CDeclaration(loc(), new CTypeDeclarator(loc(), name, type), null);
	}

	public static CDeclaration decl(CIdentifierType type, String name, CExpression init) {
		return new CDeclaration(loc(), new CTypeDeclarator(loc(), name, type), init);
	}

	public static CDeclaration arrayDecl(CIdentifierType type, String name, CExpression dimension) {
		return new CDeclaration(loc(),
				new CArrayDeclarator(loc(), new CTypeDeclarator(loc(), name, type), dimension), null);
	}

	public static CDeclaration arrayDecl(CIdentifierType type, String name, CExpression dimension, CExpression init) {
		return new CDeclaration(loc(),
				new CArrayDeclarator(loc(), new CTypeDeclarator(loc(), name, type), dimension), init);
	}

	public static CDeclaration param(CIdentifierType type, String name) {
		return decl(type, name);
	}

	public static CDeclaration voidParam() {
		return new CDeclaration(loc(), new CTypeDeclarator(loc(), null, type("void")), null);
	}

	public static CDeclaration signature(CIdentifierType returnType, String name, CDeclaration... params) {
		return new CDeclaration(loc(),
				new CFunctionDeclarator(loc(), new CTypeDeclarator(loc(), name, returnType), Arrays.asList(params)),
				null);
	}

	public static CFunctionDefinition function(CIdentifierType returnType, String name, List<CDeclaration> params,
	                                           CStatement... body) {
		return new CFunctionDefinition(loc(),
				signature(returnType, name, params.toArray(new CDeclaration[0])),
				compound(body));
	}

	public static CGlobalDeclaration global(CDeclaration... declarations) {
		return new CGlobalDeclaration(loc(), Arrays.asList(declarations));
	}

	public static CIdentifier id(String name) {
		return new CIdentifier(loc(), name);
	}

	public static CConstant num(int value) {
		return new CConstant(loc(), CConstant.Kind.INT, Integer.toString(value));
	}

	public static CConstant str(String contents) {
		return new CConstant(loc(), CConstant.Kind.STRING, "\"" + contents + "\"");
	}

	public static CConstant chr(String contents) {
		return new CConstant(loc(), CConstant.Kind.CHAR, "'" + contents + "'");
	}

	public static CBinaryOp binop(String operator, CExpression lhs, CExpression rhs) {
		return new CBinaryOp(loc(), operator, lhs, rhs);
	}

	public static CUnaryOp unop(String operator, CExpression operand) {
		return new CUnaryOp(loc(), operator, operand);
	}

	public static CUnaryOp postInc(CExpression operand) {
		return unop(CUnaryOp.POST_INCREMENT, operand);
	}

	public static CUnaryOp postDec(CExpression operand) {
		return unop(CUnaryOp.POST_DECREMENT, operand);
	}

	public static CUnaryOp preInc(CExpression operand) {
		return unop("++", operand);
	}

	public static CUnaryOp addressOf(CExpression operand) {
		return unop("&", operand);
	}

	public static CAssignment assign(CExpression lvalue, CExpression rvalue) {
		return new CAssignment(loc(), "=", lvalue, rvalue);
	}

	public static CAssignment assign(String operator, CExpression lvalue, CExpression rvalue) {
		return new CAssignment(loc(), operator, lvalue, rvalue);
	}

	public static CArrayRef index(CExpression base, CExpression subscript) {
		return new CArrayRef(loc(), base, subscript);
	}

	public static CTypename typename(String... names) {
		return new CTypename(loc(), new CTypeDeclarator(loc(), null, type(names)));
	}

	public static CCast cast(CTypename type, CExpression expression) {
		return new CCast(loc(), type, expression);
	}

	public static CTernaryOp ternary(CExpression condition, CExpression yes, CExpression no) {
		return new CTernaryOp(loc(), condition, yes, no);
	}

	public static CFunctionCall call(String name, CExpression... arguments) {
		return new CFunctionCall(loc(), id(name), Arrays.asList(arguments));
	}

	public static CCommaExpression comma(CExpression... expressions) {
		return new CCommaExpression(loc(), Arrays.asList(expressions));
	}

	public static CInitList initList(CExpression... expressions) {
		return new CInitList(loc(), Arrays.asList(expressions));
	}

	public static CExpressionStatement exprS(CExpression expression) {
		return new CExpressionStatement(loc(), expression);
	}

	public static CDeclarationStatement declS(CDeclaration... declarations) {
		return new CDeclarationStatement(loc(), Arrays.asList(declarations));
	}

	public static CCompound compound(CStatement... items) {
		return new CCompound(loc(), new ArrayList<>(Arrays.asList(items)));
	}

	public static CIf ifS(CExpression condition, CStatement yes) {
		return new CIf(loc(), condition, yes, null);
	}

	public static CIf ifS(CExpression condition, CStatement yes, CStatement no) {
		return new CIf(loc(), condition, yes, no);
	}

	public static CWhile whileS(CExpression condition, CStatement body) {
		return new CWhile(loc(), condition, body);
	}

	public static CDoWhile doWhileS(CExpression condition, CStatement body) {
		return new CDoWhile(loc(), condition, body);
	}

	public static CFor forS(CStatement init, CExpression condition, CExpression next, CStatement body) {
		return new CFor(loc(), init, condition, next, body);
	}

	public static CSwitch switchS(CExpression condition, CStatement... groups) {
		return new CSwitch(loc(), condition, compound(groups));
	}

	public static CCase caseS(CExpression expression, CStatement... statements) {
		return new CCase(loc(), expression, Arrays.asList(statements));
	}

	public static CDefault defaultS(CStatement... statements) {
		return new CDefault(loc(), Arrays.asList(statements));
	}

	public static CBreak breakS() {
		return new CBreak(loc());
	}

	public static CContinue continueS() {
		return new CContinue(loc());
	}

	public static CReturn returnS() {
		return new CReturn(loc(), null);
	}

	public static CReturn returnS(CExpression expression) {
		return new CReturn(loc(), expression);
	}

	public static CLabel label(String name, CStatement statement) {
		return new CLabel(loc(), name, statement);
	}

	public static CGoto gotoS(String target) {
		return new CGoto(loc(), target);
	}

	public static CEmptyStatement empty() {
		return new CEmptyStatement(loc());
	}

	public static List<CDeclaration> params(CDeclaration... params) {
		if (params.length == 0) {
			return Collections.emptyList();
		}
		return Arrays.asList(params);
	}

}
