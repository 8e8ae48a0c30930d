package c2cfa.formatters;

import c2cfa.model.cfa.CfaFunction;
import c2cfa.model.cfa.Location;
import c2cfa.model.cfa.Parameter;
import c2cfa.model.cfa.Program;
import c2cfa.model.cfa.Transition;
import c2cfa.model.cfa.TranslationWarning;
import c2cfa.model.cfa.TypeRegistry;
import c2cfa.model.cfa.Update;

import java.io.IOException;
import java.util.Map;

/**
 * Writes an indented, human-readable dump of a translated program.
 */
public class ProgramFormattingVisitor {

	private final IndentingWriter out;

	public ProgramFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	public void visit(Program program) throws IOException {
		out.write("program ");
		out.write(program.getName());
		if (program.isIncorrect()) {
			out.write(" (marked incorrect)");
		}
		if (program.getFeedback() != null) {
			try (IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				out.write("feedback: ");
				out.write(program.getFeedback());
			}
		}
		out.newLine();
		out.write("globals:");
		try (IndentingWriter.Indent ignored = out.indent()) {
			visit(program.getGlobalTypes());
			for (Update update : program.getGlobalUpdates()) {
				out.newLine();
				out.write(update.toString());
			}
		}
		for (CfaFunction fn : program.getFunctions()) {
			out.newLine();
			visit(fn);
		}
		if (!program.getWarnings().isEmpty()) {
			out.newLine();
			out.write("warnings:");
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (TranslationWarning warning : program.getWarnings()) {
					out.newLine();
					out.write(warning.toString());
				}
			}
		}
		out.newLine();
		out.write("lines:");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Map.Entry<Integer, String> entry : program.getLineMap().asMap().entrySet()) {
				out.newLine();
				out.write(entry.getKey() + ": " + entry.getValue());
			}
		}
		out.newLine();
	}

	public void visit(CfaFunction fn) throws IOException {
		out.write(fn.isDefined() ? "function " : "prototype ");
		out.write(fn.getReturnType());
		out.write(" ");
		out.write(fn.getName());
		out.write("(");
		boolean first = true;
		for (Parameter param : fn.getParams()) {
			if (first) {
				first = false;
			} else {
				out.write(", ");
			}
			out.write(param.toString());
		}
		out.write(")");
		if (!fn.isDefined()) {
			return;
		}
		if (fn.usesNonLocalExits()) {
			out.write(" [break/continue]");
		}
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			visit(fn.getTypes());
			for (Location location : fn.getLocations()) {
				out.newLine();
				visit(fn, location);
			}
		}
	}

	private void visit(TypeRegistry types) throws IOException {
		for (Map.Entry<String, String> entry : types.asMap().entrySet()) {
			out.newLine();
			out.write(entry.getValue());
			out.write(" ");
			out.write(entry.getKey());
		}
	}

	private void visit(CfaFunction fn, Location location) throws IOException {
		out.write(location.toString());
		if (location.getDescription() != null) {
			out.write(" (");
			out.write(location.getDescription());
			out.write(")");
		}
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Update update : location.getUpdates()) {
				out.newLine();
				out.write(update.toString());
			}
			for (Transition transition : fn.getTransitionsFrom(location)) {
				out.newLine();
				out.write("--");
				out.write(transition.getGuard().toString());
				out.write("--> ");
				out.write(transition.getTo().toString());
			}
		}
	}

}
