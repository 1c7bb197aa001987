// This file has the helper functions needed for output formatting and printing the program

package absint;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Base {

	// Logger for logging messages
	public static class SLF4J {
		public static final Logger LOGGER = LoggerFactory.getLogger(SLF4J.class);
	}

	// Protected functions for formatting output
	protected static String getLineNumber(int lineno) {
		return String.format("%02d", lineno) + ": ";
	}

	public static String formatOutputLine(String var, Sign sign, String prefix) {
		return prefix + var + " -> " + sign;
	}

	public static String formatOutputLine(String var, Sign sign) {
		return formatOutputLine(var, sign, "");
	}

	// One line per bound variable, ordered by variable name
	public static String[] formatOutputData(Memory m, String prefix) {
		String[] outputlines = new String[m.size()];

		int i = 0;
		for (Map.Entry<String, Sign> e : m.entries().entrySet()) {
			outputlines[i] = formatOutputLine(e.getKey(), e.getValue(), prefix);
			i++;
		}
		return outputlines;
	}

	public static String[] formatOutputData(Memory m) {
		return formatOutputData(m, "");
	}

	public static String toOutputString(Memory m) {
		return String.join("\n", formatOutputData(m));
	}

	// Public functions for printing program info
	public static void printLine(int lineno, String line) {
		SLF4J.LOGGER.debug(getLineNumber(lineno) + line);
	}

	public static void printInfo(Stmt program) {
		if (!SLF4J.LOGGER.isDebugEnabled()) {
			return;
		}
		List<String> lines = ProgramPrinter.print(program);
		int lineno = 0;
		for (String line : lines) {
			printLine(lineno, line);
			lineno++;
		}
	}
}
