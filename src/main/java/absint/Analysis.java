/* Sign analysis of a program in the toy imperative language.
 * The program is a statement tree built by the caller; the result is one abstract memory that
 * over-approximates every state the program can end in.
 *
 * Configuration (system properties): absint.maxIterations, absint.refine, absint.trace.
 * See AnalysisOptions.
 */

package absint;

import java.util.Objects;

public class Analysis extends Base {

	private final AnalysisOptions options;
	private final Evaluator evaluator;

	public Analysis(AnalysisOptions options) {
		this.options = Objects.requireNonNull(options, "options");
		ConditionRefiner refiner = options.isRefine() ? new SignRefiner() : ConditionRefiner.IDENTITY;
		FixpointObserver<Memory> observer = options.isTrace() ? FixpointObserver.logging() : FixpointObserver.none();
		this.evaluator = new Evaluator(refiner, new Fixpoint<>(options.getMaxIterations(), observer));
	}

	/**
	 * Analyzes {@code program} from the empty memory, with options taken from
	 * the system properties.
	 */
	public static Memory analyze(Stmt program) {
		return new Analysis(AnalysisOptions.fromSystemProperties()).doAnalysis(program);
	}

	public Memory doAnalysis(Stmt program) {
		Objects.requireNonNull(program, "program");
		SLF4J.LOGGER.info("Analyzing program (" + options + ")");
		printInfo(program);

		Memory result = evaluator.run(program, Memory.bottom());

		SLF4J.LOGGER.info("Result: " + result.size() + " variable(s)");
		for (String line : formatOutputData(result, "\t")) {
			SLF4J.LOGGER.info(line);
		}
		return result;
	}
}
