package absint;

import static absint.Expr.add;
import static absint.Expr.less;
import static absint.Expr.num;
import static absint.Expr.var;
import static absint.Stmt.assign;
import static absint.Stmt.ifThenElse;
import static absint.Stmt.read;
import static absint.Stmt.seq;
import static absint.Stmt.whileLoop;

/**
 * Small sample programs shared by the tests. The comment above each one is
 * its source and, after the arrow, the expected result of the default
 * analysis.
 */
final class Programs {

	private Programs() {
	}

	// read x
	static final Stmt INPUT_X = read("x");

	// x := x + 1
	static final Stmt INC_X = assign("x", add(var("x"), num(1)));

	// x := 0    =>  x: 0
	static final Stmt P0 = assign("x", num(0));

	// x := 1    =>  x: +
	static final Stmt P1 = assign("x", num(1));

	// y := -1   =>  y: -
	static final Stmt P2 = assign("y", num(-1));

	// x := 1; y := -1    =>  x: +, y: -
	static final Stmt P3 = seq(P1, P2);

	// while (1) x := x + y    =>  {} (x only ever gets Bot, which binds nothing new)
	static final Stmt P4 = whileLoop(num(1), assign("x", add(var("x"), var("y"))));

	// x := 1; y := -1; while (1) x := x + y    =>  x: Top, y: -
	static final Stmt P5 = seq(P3, P4);

	// if (1) x := 0 else x := 1    =>  x: Top
	static final Stmt P6 = ifThenElse(num(1), P0, P1);

	// read x; while (x < 10) x := x + 1    =>  x: Top
	static final Stmt P7 = seq(INPUT_X, whileLoop(less(var("x"), num(10)), INC_X));

	// x := 1; while (x < 10) x := x + 1    =>  x: +
	static final Stmt COUNT_UP = seq(P1, whileLoop(less(var("x"), num(10)), INC_X));

	// read x; if (0 < x) y := x else y := 1    =>  x: Top, y: Top (y: + with refinement)
	static final Stmt POSITIVE_OR_ONE = seq(INPUT_X,
			ifThenElse(less(num(0), var("x")), assign("y", var("x")), assign("y", num(1))));
}
