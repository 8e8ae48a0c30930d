package c2cfa.formatters;

import c2cfa.model.cfa.CfaFunction;
import c2cfa.model.cfa.Constant;
import c2cfa.model.cfa.Expression;
import c2cfa.model.cfa.ExpressionVisitor;
import c2cfa.model.cfa.Guard;
import c2cfa.model.cfa.Location;
import c2cfa.model.cfa.Operation;
import c2cfa.model.cfa.Parameter;
import c2cfa.model.cfa.Program;
import c2cfa.model.cfa.Transition;
import c2cfa.model.cfa.TranslationWarning;
import c2cfa.model.cfa.TypeRegistry;
import c2cfa.model.cfa.Update;
import c2cfa.model.cfa.Variable;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Serialises a translated program to JSON. Expressions become objects with a
 * single <code>var</code> or <code>const</code> key, or an <code>op</code> key
 * plus an <code>args</code> array.
 */
public class ProgramJsonWriter {

	private static final int INDENT = 2;

	private ProgramJsonWriter() {}

	public static void write(Program program, Writer out) throws IOException {
		out.write(toJson(program).toString(INDENT));
		out.write(System.lineSeparator());
		out.flush();
	}

	public static JSONObject toJson(Program program) {
		JSONObject json = new JSONObject();
		json.put("name", program.getName());
		json.put("incorrect", program.isIncorrect());
		if (program.getFeedback() != null) {
			json.put("feedback", program.getFeedback());
		}
		json.put("globals", toJson(program.getGlobalTypes()));
		json.put("globalUpdates", toJson(program.getGlobalUpdates()));
		JSONArray functions = new JSONArray();
		for (CfaFunction fn : program.getFunctions()) {
			functions.put(toJson(fn));
		}
		json.put("functions", functions);
		JSONArray warnings = new JSONArray();
		for (TranslationWarning warning : program.getWarnings()) {
			warnings.put(new JSONObject()
					.put("line", warning.getLine())
					.put("message", warning.getMessage()));
		}
		json.put("warnings", warnings);
		JSONObject lines = new JSONObject();
		for (Map.Entry<Integer, String> entry : program.getLineMap().asMap().entrySet()) {
			lines.put(entry.getKey().toString(), entry.getValue());
		}
		json.put("lines", lines);
		return json;
	}

	static JSONObject toJson(CfaFunction fn) {
		JSONObject json = new JSONObject();
		json.put("name", fn.getName());
		json.put("returnType", fn.getReturnType());
		JSONArray params = new JSONArray();
		for (Parameter param : fn.getParams()) {
			params.put(new JSONObject().put("name", param.getName()).put("type", param.getType()));
		}
		json.put("params", params);
		json.put("defined", fn.isDefined());
		if (!fn.isDefined()) {
			return json;
		}
		json.put("entry", fn.getEntry().getId());
		json.put("usesNonLocalExits", fn.usesNonLocalExits());
		json.put("types", toJson(fn.getTypes()));
		JSONArray locations = new JSONArray();
		for (Location location : fn.getLocations()) {
			JSONObject loc = new JSONObject();
			loc.put("id", location.getId());
			if (location.getDescription() != null) {
				loc.put("description", location.getDescription());
			}
			loc.put("updates", toJson(location.getUpdates()));
			locations.put(loc);
		}
		json.put("locations", locations);
		JSONArray transitions = new JSONArray();
		for (Transition transition : fn.getTransitions()) {
			JSONObject t = new JSONObject();
			t.put("from", transition.getFrom().getId());
			t.put("to", transition.getTo().getId());
			Guard guard = transition.getGuard();
			t.put("guard", guard.getKind().name().toLowerCase());
			if (!guard.isUnconditional()) {
				t.put("condition", toJson(guard.getCondition()));
			}
			transitions.put(t);
		}
		json.put("transitions", transitions);
		return json;
	}

	static JSONObject toJson(TypeRegistry types) {
		JSONObject json = new JSONObject();
		for (Map.Entry<String, String> entry : types.asMap().entrySet()) {
			json.put(entry.getKey(), entry.getValue());
		}
		return json;
	}

	static JSONArray toJson(List<Update> updates) {
		JSONArray json = new JSONArray();
		for (Update update : updates) {
			json.put(new JSONObject()
					.put("variable", update.getVariable())
					.put("expression", toJson(update.getExpression())));
		}
		return json;
	}

	static JSONObject toJson(Expression expression) {
		return expression.accept(new ExpressionVisitor<JSONObject, RuntimeException>() {
			@Override
			public JSONObject visit(Variable variable) {
				return new JSONObject().put("var", variable.getName());
			}

			@Override
			public JSONObject visit(Constant constant) {
				return new JSONObject().put("const", constant.getValue());
			}

			@Override
			public JSONObject visit(Operation operation) {
				JSONArray args = new JSONArray();
				for (Expression arg : operation.getArgs()) {
					args.put(arg.accept(this));
				}
				return new JSONObject().put("op", operation.getName()).put("args", args);
			}
		});
	}

}
