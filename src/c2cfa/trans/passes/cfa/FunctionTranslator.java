package c2cfa.trans.passes.cfa;

import c2cfa.model.c.CArrayDeclarator;
import c2cfa.model.c.CDeclaration;
import c2cfa.model.c.CDeclarator;
import c2cfa.model.c.CFunctionDeclarator;
import c2cfa.model.c.CFunctionDefinition;
import c2cfa.model.c.CTypeDeclarator;
import c2cfa.model.cfa.CfaFunction;
import c2cfa.model.cfa.ControlFlowAutomaton;
import c2cfa.model.cfa.DuplicateTypeException;
import c2cfa.model.cfa.Parameter;
import c2cfa.model.cfa.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates function definitions and registers prototypes.
 */
public class FunctionTranslator {
	private FunctionTranslator() {}

	private static CFunctionDeclarator signatureOf(CDeclaration declaration) {
		if (!(declaration.getDeclarator() instanceof CFunctionDeclarator)) {
			throw new UnsupportedFeatureIssue("function definition without a parameter list", declaration.getLine());
		}
		CFunctionDeclarator signature = (CFunctionDeclarator) declaration.getDeclarator();
		if (!(signature.getInner() instanceof CTypeDeclarator)) {
			throw new UnsupportedFeatureIssue("function returning a pointer, array or function", signature.getLine());
		}
		return signature;
	}

	private static boolean isVoid(CDeclaration param) {
		if (!(param.getDeclarator() instanceof CTypeDeclarator)) {
			return false;
		}
		CTypeDeclarator declarator = (CTypeDeclarator) param.getDeclarator();
		return declarator.getName() == null && declarator.getType().joinedName().equals("void");
	}

	/**
	 * Resolves a parameter list; a lone <code>void</code> means no parameters.
	 * Unnamed parameters are only allowed in prototypes, where they are called
	 * <code>_</code>.
	 */
	static List<Parameter> resolveParameters(CFunctionDeclarator signature, boolean definition) {
		List<Parameter> params = new ArrayList<>();
		List<CDeclaration> declarations = signature.getParams();
		if (declarations.size() == 1 && isVoid(declarations.get(0))) {
			return params;
		}
		DeclaratorResolver resolver = new DeclaratorResolver();
		for (CDeclaration declaration : declarations) {
			CDeclarator declarator = declaration.getDeclarator();
			if (!(declarator instanceof CTypeDeclarator) && !(declarator instanceof CArrayDeclarator)) {
				throw new UnsupportedFeatureIssue("parameter that is a pointer or a function", declaration.getLine());
			}
			DeclaredEntity entity = declarator.accept(resolver);
			String name = entity.getName();
			if (name == null) {
				if (definition) {
					throw new UnsupportedFeatureIssue("unnamed parameter in a function definition",
							declaration.getLine());
				}
				name = Variable.DISCARD;
			}
			params.add(new Parameter(name, entity.getType()));
		}
		return params;
	}

	public static void declare(CfaBuilder builder, CDeclaration declaration, String scope) {
		CFunctionDeclarator signature = signatureOf(declaration);
		CTypeDeclarator returned = (CTypeDeclarator) signature.getInner();
		List<Parameter> params = resolveParameters(signature, false);
		builder.getAutomaton().declareFunction(returned.getName(), TypeNames.normalise(returned.getType()), params);
		builder.recordLine(declaration.getLine(), scope);
	}

	public static void define(CfaBuilder builder, CFunctionDefinition definition) {
		CDeclaration declaration = definition.getDeclaration();
		CFunctionDeclarator signature = signatureOf(declaration);
		CTypeDeclarator returned = (CTypeDeclarator) signature.getInner();
		String name = returned.getName();
		int line = definition.getLine();
		ControlFlowAutomaton cfa = builder.getAutomaton();

		CfaFunction previous = cfa.getFunction(name);
		if (previous != null && previous.isDefined()) {
			throw new UnsupportedFeatureIssue("redefinition of function '" + name + "'", line);
		}
		List<Parameter> params = resolveParameters(signature, true);
		String scope = name + ".";
		builder.recordLine(line, scope);

		CfaFunction fn = cfa.beginFunction(name, TypeNames.normalise(returned.getType()), params,
				"at the beginning of the function '" + name + "' at line " + line);
		for (Parameter param : params) {
			try {
				cfa.registerType(param.getName(), param.getType());
			} catch (DuplicateTypeException e) {
				throw new UnsupportedFeatureIssue("duplicate parameter '" + param.getName() + "'", line);
			}
		}
		builder.setCurrent(fn.getEntry());
		definition.getBody().accept(new CStatementCfaVisitor(builder, scope, false));
		builder.recordLine(line, scope);
		builder.setCurrent(null);
		cfa.endFunction();
	}

}
