package absint;

/**
 * Restricts a memory to the states in which a condition holds (the "prune"
 * step before a branch or loop body). The result must over-approximate every
 * state of {@code m} in which {@code cond} evaluates to true; returning
 * {@code m} itself is always sound, only less precise.
 */
@FunctionalInterface
public interface ConditionRefiner {

	ConditionRefiner IDENTITY = (cond, m) -> m;

	Memory refine(Expr cond, Memory m);
}
