package absint;

import java.util.Objects;
import java.util.function.UnaryOperator;

/* =========================
 * Kleene fixpoint iteration
 * =========================
 * Works on any LatticeElement. Iterates are accumulated with join, so they form an ascending
 * chain from the initial element; on a finite-height lattice the chain is finite and the loop
 * stops at a post-fixpoint (f(m) <= m) above the initial element.
 * Unlike plain iteration m := f(m), the result never drops below an earlier iterate:
 * solve(m -> m.bind("x", ZERO), {x: +}) gives {x: Top}, not {x: 0}.
 */
public final class Fixpoint<E extends LatticeElement<E>> {

	private final int maxIterations;
	private final FixpointObserver<? super E> observer;

	public Fixpoint(int maxIterations, FixpointObserver<? super E> observer) {
		if (maxIterations <= 0) {
			throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
		}
		this.maxIterations = maxIterations;
		this.observer = Objects.requireNonNull(observer, "observer");
	}

	public E solve(UnaryOperator<E> f, E init) {
		Objects.requireNonNull(f, "f");
		E m = Objects.requireNonNull(init, "init");
		for (int i = 0; i < maxIterations; i++) {
			observer.onIteration(i, m);
			E next = f.apply(m);
			if (next.leq(m)) {
				return m;
			}
			m = m.join_op(next);
		}
		throw new FixpointException(maxIterations, m);
	}
}
