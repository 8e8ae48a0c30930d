package c2cfa.trans.passes.cfa;

import c2cfa.errors.Issue;
import c2cfa.model.c.CDeclaration;
import c2cfa.model.c.CExternalDeclaration;
import c2cfa.model.c.CExternalDeclarationVisitor;
import c2cfa.model.c.CFunctionDefinition;
import c2cfa.model.c.CGlobalDeclaration;
import c2cfa.model.c.CTranslationUnit;
import c2cfa.model.cfa.ControlFlowAutomaton;

public class CfaGenerationPass {
	private CfaGenerationPass() {}

	/**
	 * Translates a whole unit into the automaton.
	 *
	 * @param suppressBreakContinue whether <code>break</code> and
	 *                              <code>continue</code> are dropped instead of
	 *                              translated into jumps
	 * @throws UnsupportedFeatureIssue on the first construct that cannot be translated
	 */
	public static void perform(ControlFlowAutomaton cfa, CTranslationUnit unit, boolean suppressBreakContinue)
			throws Issue {
		CfaBuilder builder = new CfaBuilder(cfa, suppressBreakContinue);
		DeclarationTranslator globals = new DeclarationTranslator(builder, "", false);
		for (CExternalDeclaration external : unit.getExternals()) {
			external.accept(new CExternalDeclarationVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(CFunctionDefinition functionDefinition) {
					FunctionTranslator.define(builder, functionDefinition);
					return null;
				}

				@Override
				public Void visit(CGlobalDeclaration globalDeclaration) {
					for (CDeclaration declaration : globalDeclaration.getDeclarations()) {
						globals.translate(declaration);
					}
					return null;
				}
			});
		}
	}

}
