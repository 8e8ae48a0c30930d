package c2cfa.trans.passes.cfa;

import c2cfa.model.c.CDeclaration;
import c2cfa.model.c.CFunctionDeclarator;
import c2cfa.model.cfa.ControlFlowAutomaton;
import c2cfa.model.cfa.DuplicateTypeException;
import c2cfa.model.cfa.Expression;
import c2cfa.model.cfa.Operation;

/**
 * Translates variable declarations. Inside a function body the type goes to the
 * function's registry and initialisation is scheduled on the current location;
 * at file scope both go to the program's globals.
 */
public class DeclarationTranslator {

	private final CfaBuilder builder;
	private final String scope;
	private final boolean inSwitch;

	public DeclarationTranslator(CfaBuilder builder, String scope, boolean inSwitch) {
		this.builder = builder;
		this.scope = scope;
		this.inSwitch = inSwitch;
	}

	public void translate(CDeclaration declaration) {
		int line = declaration.getLine();
		if (declaration.getDeclarator() instanceof CFunctionDeclarator) {
			FunctionTranslator.declare(builder, declaration, scope);
			return;
		}
		DeclaredEntity entity = declaration.getDeclarator().accept(new DeclaratorResolver());
		builder.recordLine(line, scope);
		if (entity.getName() == null) {
			throw new UnsupportedFeatureIssue("declaration without a name", line);
		}

		CExpressionCfaVisitor expressions = new CExpressionCfaVisitor(builder, scope, inSwitch);
		Expression init = null;
		if (declaration.getInit() != null) {
			init = expressions.valueOf(declaration.getInit());
		}

		if (!register(entity, line)) {
			return;
		}

		if (init != null && entity.getDimension() != null) {
			throw new UnsupportedFeatureIssue("array '" + entity.getName() + "' both created with a size and initialised",
					line);
		}
		if (init != null) {
			builder.schedule(entity.getName(), init);
		}
		if (entity.getDimension() != null) {
			Expression dimension = expressions.valueOf(entity.getDimension());
			builder.schedule(entity.getName(), new Operation(Operation.ARRAY_CREATE, line, dimension));
		}
	}

	/**
	 * @return whether the declaration should go on to initialise the variable
	 */
	private boolean register(DeclaredEntity entity, int line) {
		ControlFlowAutomaton cfa = builder.getAutomaton();
		try {
			if (builder.isAtFileScope()) {
				cfa.registerGlobalType(entity.getName(), entity.getType());
			} else {
				cfa.registerType(entity.getName(), entity.getType());
			}
			return true;
		} catch (DuplicateTypeException e) {
			if (builder.isAtFileScope()) {
				builder.warn("Ignored global definition '" + entity.getName() + "' on line " + line + ".", line);
				return false;
			}
			if (!e.getExistingType().equals(entity.getType())) {
				builder.warn("Redeclaration of '" + entity.getName() + "' as " + entity.getType() + " on line " + line
						+ " (keeping " + e.getExistingType() + ").", line);
			}
			return true;
		}
	}

}
