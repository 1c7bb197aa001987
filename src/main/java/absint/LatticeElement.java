package absint;

/* Receiver object of LatticeElement is an abstract fact (a sign or a whole memory).
 * x.join_op(y) -> here x, y are elements of the same lattice and x is the receiver object.
 * Method implementations must not modify the receiver object. A fresh (or shared immutable) object is returned.
 * The fixpoint engine accesses facts only as LatticeElement and works for any implementation of it.
 * Implementations must have finite height, otherwise fixpoint iteration is not guaranteed to stop.
 */

public interface LatticeElement<E extends LatticeElement<E>> {
	E join_op(E r);
	/* represents: "this" JOIN "r"
	 * this - the existing fact
	 * r    - the incoming fact
	 */

	boolean leq(E r);
	/* true iff "this" is below or equal to "r" in the lattice order */
}
