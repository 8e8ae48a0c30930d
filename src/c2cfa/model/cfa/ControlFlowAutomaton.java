package c2cfa.model.cfa;

import java.util.List;

/**
 * The mutation interface the translation passes build an automaton through.
 * Everything is append-only, apart from {@link #rollback(Checkpoint)}.
 */
public interface ControlFlowAutomaton {

	/**
	 * Registers the signature of a function without a body. Redeclarations of a
	 * known function are ignored.
	 */
	void declareFunction(String name, String returnType, List<Parameter> params);

	/**
	 * Opens the scope of a function definition and creates its entry location.
	 * A previous prototype of the same name is replaced.
	 */
	CfaFunction beginFunction(String name, String returnType, List<Parameter> params, String entryDescription);

	void endFunction();

	/**
	 * @return the function whose body is being translated, or null at file scope
	 */
	CfaFunction getCurrentFunction();

	/**
	 * @return the function registered under this name, or null
	 */
	CfaFunction getFunction(String name);

	boolean isFunctionRegistered(String name);

	Location createLocation(String description);

	void addTransition(Location from, Guard guard, Location to);

	/**
	 * Records a variable type in the current function's registry, or in the
	 * global one at file scope.
	 */
	void registerType(String name, String type) throws DuplicateTypeException;

	void registerGlobalType(String name, String type) throws DuplicateTypeException;

	/**
	 * Looks the name up in the current function's registry, then in the global
	 * one.
	 */
	String lookupType(String name);

	void addUpdate(Location location, Update update);

	/**
	 * Schedules an update ahead of the last <code>beforeLast</code> updates
	 * already scheduled on the location.
	 */
	void addUpdate(Location location, Update update, int beforeLast);

	int countUpdates(Location location);

	void addGlobalUpdate(Update update);

	Checkpoint checkpoint(Location current);

	/**
	 * Withdraws every update, location, transition and warning added since the
	 * checkpoint was taken.
	 */
	void rollback(Checkpoint checkpoint);

	void recordWarning(TranslationWarning warning);

	void recordLineScope(int line, String scope);

	void markNonLocalExits();

	void setIncorrect(boolean incorrect);

	void setFeedback(String feedback);

}
