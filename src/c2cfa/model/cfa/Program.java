package c2cfa.model.cfa;

import c2cfa.InternalCompilerError;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The translation of one C translation unit: its functions, the file-scope
 * variables with their initial updates, the line map, the warnings and the
 * metadata read from directive comments.
 */
public class Program implements ControlFlowAutomaton {

	private final String name;
	private final Map<String, CfaFunction> functions;
	private final TypeRegistry globalTypes;
	private final List<Update> globalUpdates;
	private final LineMap lineMap;
	private final List<TranslationWarning> warnings;
	private CfaFunction current;
	private boolean incorrect;
	private String feedback;

	public Program(String name) {
		this.name = name;
		this.functions = new LinkedHashMap<>();
		this.globalTypes = new TypeRegistry();
		this.globalUpdates = new ArrayList<>();
		this.lineMap = new LineMap();
		this.warnings = new ArrayList<>();
		this.current = null;
		this.incorrect = false;
		this.feedback = null;
	}

	public String getName() {
		return name;
	}

	public Collection<CfaFunction> getFunctions() {
		return Collections.unmodifiableCollection(functions.values());
	}

	public TypeRegistry getGlobalTypes() {
		return globalTypes;
	}

	public List<Update> getGlobalUpdates() {
		return Collections.unmodifiableList(globalUpdates);
	}

	public LineMap getLineMap() {
		return lineMap;
	}

	public List<TranslationWarning> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	public boolean isIncorrect() {
		return incorrect;
	}

	/**
	 * @return the feedback text, or null if the source carried none
	 */
	public String getFeedback() {
		return feedback;
	}

	@Override
	public void declareFunction(String name, String returnType, List<Parameter> params) {
		if (!functions.containsKey(name)) {
			functions.put(name, new CfaFunction(name, returnType, params));
		}
	}

	@Override
	public CfaFunction beginFunction(String name, String returnType, List<Parameter> params,
	                                 String entryDescription) {
		if (current != null) {
			throw new InternalCompilerError("function " + name + " opened inside " + current.getName());
		}
		CfaFunction fn = new CfaFunction(name, returnType, params);
		fn.newLocation(entryDescription);
		functions.put(name, fn);
		current = fn;
		return fn;
	}

	@Override
	public void endFunction() {
		if (current == null) {
			throw new InternalCompilerError("no function to close");
		}
		current = null;
	}

	@Override
	public CfaFunction getCurrentFunction() {
		return current;
	}

	@Override
	public CfaFunction getFunction(String name) {
		return functions.get(name);
	}

	@Override
	public boolean isFunctionRegistered(String name) {
		return functions.containsKey(name);
	}

	private CfaFunction requireCurrent() {
		if (current == null) {
			throw new InternalCompilerError("control flow requested outside of a function body");
		}
		return current;
	}

	@Override
	public Location createLocation(String description) {
		return requireCurrent().newLocation(description);
	}

	@Override
	public void addTransition(Location from, Guard guard, Location to) {
		requireCurrent().addTransition(new Transition(from, guard, to));
	}

	@Override
	public void registerType(String name, String type) throws DuplicateTypeException {
		if (current == null) {
			registerGlobalType(name, type);
		} else {
			current.getTypes().register(name, type);
		}
	}

	@Override
	public void registerGlobalType(String name, String type) throws DuplicateTypeException {
		globalTypes.register(name, type);
	}

	@Override
	public String lookupType(String name) {
		if (current != null && current.getTypes().contains(name)) {
			return current.getTypes().lookup(name);
		}
		return globalTypes.lookup(name);
	}

	@Override
	public void addUpdate(Location location, Update update) {
		location.addUpdate(location.countUpdates(), update);
	}

	@Override
	public void addUpdate(Location location, Update update, int beforeLast) {
		int size = location.countUpdates();
		if (beforeLast < 0 || beforeLast > size) {
			throw new InternalCompilerError("cannot insert " + beforeLast + " updates from the end of " + size);
		}
		location.addUpdate(size - beforeLast, update);
	}

	@Override
	public int countUpdates(Location location) {
		return location.countUpdates();
	}

	@Override
	public void addGlobalUpdate(Update update) {
		globalUpdates.add(update);
	}

	@Override
	public Checkpoint checkpoint(Location location) {
		CfaFunction fn = requireCurrent();
		return new Checkpoint(fn, location, location.countUpdates(), fn.getLocations().size(),
				fn.getTransitions().size(), warnings.size());
	}

	@Override
	public void rollback(Checkpoint checkpoint) {
		if (checkpoint.getFunction() != current) {
			throw new InternalCompilerError("checkpoint taken in another function");
		}
		checkpoint.getLocation().truncateUpdates(checkpoint.getUpdateCount());
		current.truncate(checkpoint.getLocationCount(), checkpoint.getTransitionCount());
		while (warnings.size() > checkpoint.getWarningCount()) {
			warnings.remove(warnings.size() - 1);
		}
	}

	@Override
	public void recordWarning(TranslationWarning warning) {
		warnings.add(warning);
	}

	@Override
	public void recordLineScope(int line, String scope) {
		lineMap.record(line, scope);
	}

	@Override
	public void markNonLocalExits() {
		requireCurrent().markNonLocalExits();
	}

	@Override
	public void setIncorrect(boolean incorrect) {
		this.incorrect = incorrect;
	}

	@Override
	public void setFeedback(String feedback) {
		this.feedback = feedback;
	}

}
