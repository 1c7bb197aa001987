package absint;

import java.util.Objects;

/**
 * Abstract semantics of statements: each statement is a transformer from the
 * memory before it to the memory after it. Both arms of a conditional are
 * always explored and joined; loops are summarized by a fixpoint over the
 * body.
 */
public final class Evaluator implements Stmt.Visitor<Memory, Memory> {

	private final ConditionRefiner refiner;
	private final Fixpoint<Memory> fixpoint;

	public Evaluator(ConditionRefiner refiner, Fixpoint<Memory> fixpoint) {
		this.refiner = Objects.requireNonNull(refiner, "refiner");
		this.fixpoint = Objects.requireNonNull(fixpoint, "fixpoint");
	}

	public Sign eval(Expr e, Memory m) {
		return ExprEvaluator.eval(e, m);
	}

	public Memory run(Stmt s, Memory m) {
		Objects.requireNonNull(s, "stmt");
		Objects.requireNonNull(m, "memory");
		return s.accept(this, m);
	}

	@Override
	public Memory visitRead(Stmt.Read s, Memory m) {
		// input is unknown
		return m.bind(s.var, Sign.TOP);
	}

	@Override
	public Memory visitWrite(Stmt.Write s, Memory m) {
		return m;
	}

	@Override
	public Memory visitAssign(Stmt.Assign s, Memory m) {
		return m.bind(s.var, eval(s.expr, m));
	}

	@Override
	public Memory visitIf(Stmt.If s, Memory m) {
		Memory thenOut = s.thenBranch.accept(this, refiner.refine(s.cond, m));
		Memory elseOut = s.elseBranch.accept(this, refiner.refine(Expr.not(s.cond), m));
		return thenOut.join_op(elseOut);
	}

	@Override
	public Memory visitWhile(Stmt.While s, Memory m) {
		// seeded with the entry memory so the zero-iterations path survives refinement
		Memory inv = fixpoint.solve(x -> s.body.accept(this, refiner.refine(s.cond, x)), m);
		return refiner.refine(Expr.not(s.cond), inv);
	}

	@Override
	public Memory visitSeq(Stmt.Seq s, Memory m) {
		return s.second.accept(this, s.first.accept(this, m));
	}
}
