package absint;

/**
 * Thrown when a fixpoint computation does not stabilize within its iteration
 * cap. With the finite-height lattices and monotone transformers used by the
 * analysis this does not happen, so it signals a misbehaving transformer or
 * a cap set too low.
 */
public class FixpointException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int iterations;

	/**
	 * @param lastState the last accumulated iterate; only its rendering is kept, in the message
	 */
	public FixpointException(int iterations, Object lastState) {
		super("No fixpoint after " + iterations + " iterations, last state: " + lastState);
		this.iterations = iterations;
	}

	public int getIterations() {
		return iterations;
	}
}
