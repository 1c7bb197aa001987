package absint;

/* ---------------------------------------------------------
 * Abstract value domain: Sign
 *
 *          TOP
 *        /  |  \
 *       -   0   +
 *        \  |  /
 *         BOTTOM
 *
 * Height 2, so every ascending chain has at most three elements.
 * Truth values are signs as well: ZERO is false, any other sign is true.
 * --------------------------------------------------------- */
public enum Sign implements LatticeElement<Sign> {
	BOTTOM("Bot"),
	TOP("Top"),
	NEGATIVE("-"),
	POSITIVE("+"),
	ZERO("0");

	private final String symbol;

	Sign(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * Abstraction function: the sign of a concrete integer.
	 */
	public static Sign abstraction(long n) {
		if (n > 0) return POSITIVE;
		if (n < 0) return NEGATIVE;
		return ZERO;
	}

	/* -------- Lattice ops -------- */

	@Override
	public boolean leq(Sign r) {
		if (this == BOTTOM || r == TOP) return true;
		return this == r;
	}

	@Override
	public Sign join_op(Sign r) {
		if (this == r) return this;
		if (this == BOTTOM) return r;
		if (r == BOTTOM) return this;
		return TOP;
	}

	/**
	 * Greatest lower bound. Two distinct proper signs have no common value.
	 */
	public Sign meet(Sign r) {
		if (this == r) return this;
		if (this == TOP) return r;
		if (r == TOP) return this;
		return BOTTOM;
	}

	/* -------- Abstract operators -------- */

	public Sign add(Sign r) {
		if (this == BOTTOM || r == BOTTOM) return BOTTOM;
		if (this == TOP || r == TOP) return TOP;
		if (this == ZERO) return r;
		if (r == ZERO) return this;
		// + plus - can be anything
		return this == r ? this : TOP;
	}

	/**
	 * Abstract {@code this == r}, as a truth sign.
	 */
	public Sign equal(Sign r) {
		if (this == BOTTOM || r == BOTTOM) return BOTTOM;
		if (this == TOP || r == TOP) return TOP;
		if (this != r) return ZERO;
		// 0 == 0 always holds, two positives (or negatives) may differ
		return this == ZERO ? POSITIVE : TOP;
	}

	/**
	 * Abstract {@code this < r}, as a truth sign.
	 */
	public Sign less(Sign r) {
		if (this == BOTTOM || r == BOTTOM) return BOTTOM;
		if (this == TOP || r == TOP) return TOP;
		if (this == r) {
			return this == ZERO ? ZERO : TOP;
		}
		return rank() < r.rank() ? POSITIVE : ZERO;
	}

	/**
	 * Truth negation, not arithmetic negation: only ZERO is false, so both
	 * NEGATIVE and POSITIVE negate to ZERO.
	 */
	public Sign logicalNot() {
		switch (this) {
			case BOTTOM:
				return BOTTOM;
			case TOP:
				return TOP;
			case ZERO:
				return POSITIVE;
			default:
				return ZERO;
		}
	}

	// position on the number line, only meaningful for proper signs
	private int rank() {
		switch (this) {
			case NEGATIVE:
				return -1;
			case ZERO:
				return 0;
			case POSITIVE:
				return 1;
			default:
				throw new IllegalStateException("No rank for " + name());
		}
	}

	@Override
	public String toString() {
		return symbol;
	}
}
