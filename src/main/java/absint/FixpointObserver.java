package absint;

/**
 * Receives every iterate of a fixpoint computation before it is tested for
 * convergence. Observers are diagnostic only and cannot change the result.
 */
@FunctionalInterface
public interface FixpointObserver<E> {

	void onIteration(int iteration, E state);

	static <E> FixpointObserver<E> none() {
		return (iteration, state) -> { };
	}

	/**
	 * Logs each iterate at DEBUG level.
	 */
	static <E> FixpointObserver<E> logging() {
		return (iteration, state) -> {
			if (Base.SLF4J.LOGGER.isDebugEnabled()) {
				Base.SLF4J.LOGGER.debug("fixpoint iteration " + iteration + ": " + state);
			}
		};
	}
}
