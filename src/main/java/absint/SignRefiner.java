package absint;

/**
 * Condition refinement for the sign domain. Narrows the sign of a variable
 * compared against an expression of known sign, and drops branches whose
 * condition is definitely false. An unreachable branch is represented by
 * {@link Memory#unreachable()}, which is neutral for the join at the merge point.
 */
public final class SignRefiner implements ConditionRefiner {

	@Override
	public Memory refine(Expr cond, Memory m) {
		Sign truth = ExprEvaluator.eval(cond, m);
		if (truth == Sign.BOTTOM) return m;
		if (truth == Sign.ZERO) return Memory.unreachable();
		return narrow(cond, true, m);
	}

	private static Memory narrow(Expr cond, boolean holds, Memory m) {
		if (cond instanceof Expr.Not n) {
			return narrow(n.operand, !holds, m);
		}
		if (cond instanceof Expr.Var v) {
			// only 0 is false
			return holds ? exclude(v.name, Sign.ZERO, m) : restrict(v.name, Sign.ZERO, m);
		}
		if (cond instanceof Expr.Less l) {
			return holds ? lessThan(l.left, l.right, m) : atLeast(l.left, l.right, m);
		}
		if (cond instanceof Expr.Equal eq) {
			Memory r = equality(eq.left, eq.right, holds, m);
			return r.isUnreachable() ? r : equality(eq.right, eq.left, holds, r);
		}
		return m;
	}

	// left < right
	private static Memory lessThan(Expr left, Expr right, Memory m) {
		Memory r = m;
		if (left instanceof Expr.Var x) {
			Sign bound = ExprEvaluator.eval(right, m);
			if (bound == Sign.ZERO || bound == Sign.NEGATIVE) {
				r = restrict(x.name, Sign.NEGATIVE, r);
			}
		}
		if (!r.isUnreachable() && right instanceof Expr.Var x) {
			Sign bound = ExprEvaluator.eval(left, m);
			if (bound == Sign.ZERO || bound == Sign.POSITIVE) {
				r = restrict(x.name, Sign.POSITIVE, r);
			}
		}
		return r;
	}

	// left >= right
	private static Memory atLeast(Expr left, Expr right, Memory m) {
		Memory r = m;
		if (left instanceof Expr.Var x) {
			Sign bound = ExprEvaluator.eval(right, m);
			if (bound == Sign.POSITIVE) {
				r = restrict(x.name, Sign.POSITIVE, r);
			} else if (bound == Sign.ZERO) {
				r = exclude(x.name, Sign.NEGATIVE, r);
			}
		}
		if (!r.isUnreachable() && right instanceof Expr.Var x) {
			Sign bound = ExprEvaluator.eval(left, m);
			if (bound == Sign.NEGATIVE) {
				r = restrict(x.name, Sign.NEGATIVE, r);
			} else if (bound == Sign.ZERO) {
				r = exclude(x.name, Sign.POSITIVE, r);
			}
		}
		return r;
	}

	private static Memory equality(Expr left, Expr right, boolean holds, Memory m) {
		if (!(left instanceof Expr.Var x)) return m;
		Sign other = ExprEvaluator.eval(right, m);
		if (holds && other != Sign.TOP && other != Sign.BOTTOM) {
			return restrict(x.name, other, m);
		}
		if (!holds && other == Sign.ZERO) {
			return exclude(x.name, Sign.ZERO, m);
		}
		return m;
	}

	// x meet s, unreachable when empty
	private static Memory restrict(String x, Sign s, Memory m) {
		Sign cur = m.lookup(x);
		if (cur == Sign.BOTTOM) return m;
		Sign met = cur.meet(s);
		return met == Sign.BOTTOM ? Memory.unreachable() : m.bind(x, met);
	}

	// x cannot be s; only decidable when x is exactly s
	private static Memory exclude(String x, Sign s, Memory m) {
		return m.lookup(x) == s ? Memory.unreachable() : m;
	}
}
