package absint;

import java.util.Objects;

/**
 * Abstract semantics of expressions. Pure and total: every expression has a
 * sign in every memory.
 */
public final class ExprEvaluator implements Expr.Visitor<Sign, Memory> {

	static final ExprEvaluator INSTANCE = new ExprEvaluator();

	private ExprEvaluator() {
	}

	public static Sign eval(Expr e, Memory m) {
		Objects.requireNonNull(e, "expr");
		Objects.requireNonNull(m, "memory");
		return e.accept(INSTANCE, m);
	}

	@Override
	public Sign visitNum(Expr.Num e, Memory m) {
		return Sign.abstraction(e.value);
	}

	@Override
	public Sign visitVar(Expr.Var e, Memory m) {
		return m.lookup(e.name);
	}

	@Override
	public Sign visitAdd(Expr.Add e, Memory m) {
		return e.left.accept(this, m).add(e.right.accept(this, m));
	}

	@Override
	public Sign visitEqual(Expr.Equal e, Memory m) {
		return e.left.accept(this, m).equal(e.right.accept(this, m));
	}

	@Override
	public Sign visitLess(Expr.Less e, Memory m) {
		return e.left.accept(this, m).less(e.right.accept(this, m));
	}

	@Override
	public Sign visitNot(Expr.Not e, Memory m) {
		return e.operand.accept(this, m).logicalNot();
	}
}
