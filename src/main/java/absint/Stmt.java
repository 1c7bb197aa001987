package absint;

import java.util.Objects;

/**
 * Statements of the analyzed language. A program is a single statement,
 * usually a chain of {@link Seq} nodes. Like {@link Expr}, the node set is
 * closed behind {@link Visitor}.
 */
public abstract class Stmt {

	public interface Visitor<R, A> {
		R visitRead(Read s, A arg);

		R visitWrite(Write s, A arg);

		R visitAssign(Assign s, A arg);

		R visitIf(If s, A arg);

		R visitWhile(While s, A arg);

		R visitSeq(Seq s, A arg);
	}

	private Stmt() {
	}

	public abstract <R, A> R accept(Visitor<R, A> v, A arg);

	@Override
	public String toString() {
		return String.join("\n", ProgramPrinter.print(this));
	}

	/* -------- Factories -------- */

	public static Stmt read(String x) {
		return new Read(x);
	}

	public static Stmt write(Expr e) {
		return new Write(e);
	}

	public static Stmt assign(String x, Expr e) {
		return new Assign(x, e);
	}

	public static Stmt ifThenElse(Expr cond, Stmt thenBranch, Stmt elseBranch) {
		return new If(cond, thenBranch, elseBranch);
	}

	public static Stmt whileLoop(Expr cond, Stmt body) {
		return new While(cond, body);
	}

	public static Stmt seq(Stmt first, Stmt second) {
		return new Seq(first, second);
	}

	/**
	 * Left-nested sequence: {@code seq(a, b, c)} is {@code seq(seq(a, b), c)}.
	 */
	public static Stmt seq(Stmt first, Stmt second, Stmt... rest) {
		Stmt s = new Seq(first, second);
		for (Stmt r : rest) {
			s = new Seq(s, r);
		}
		return s;
	}

	/* -------- Node types -------- */

	public static final class Read extends Stmt {
		public final String var;

		Read(String var) {
			this.var = Objects.requireNonNull(var, "var");
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitRead(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Read other && var.equals(other.var);
		}

		@Override
		public int hashCode() {
			return Objects.hash("read", var);
		}
	}

	public static final class Write extends Stmt {
		public final Expr expr;

		Write(Expr expr) {
			this.expr = Objects.requireNonNull(expr, "expr");
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitWrite(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Write other && expr.equals(other.expr);
		}

		@Override
		public int hashCode() {
			return Objects.hash("write", expr);
		}
	}

	public static final class Assign extends Stmt {
		public final String var;
		public final Expr expr;

		Assign(String var, Expr expr) {
			this.var = Objects.requireNonNull(var, "var");
			this.expr = Objects.requireNonNull(expr, "expr");
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitAssign(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Assign other && var.equals(other.var) && expr.equals(other.expr);
		}

		@Override
		public int hashCode() {
			return Objects.hash("assign", var, expr);
		}
	}

	public static final class If extends Stmt {
		public final Expr cond;
		public final Stmt thenBranch;
		public final Stmt elseBranch;

		If(Expr cond, Stmt thenBranch, Stmt elseBranch) {
			this.cond = Objects.requireNonNull(cond, "cond");
			this.thenBranch = Objects.requireNonNull(thenBranch, "thenBranch");
			this.elseBranch = Objects.requireNonNull(elseBranch, "elseBranch");
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitIf(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof If other && cond.equals(other.cond)
					&& thenBranch.equals(other.thenBranch) && elseBranch.equals(other.elseBranch);
		}

		@Override
		public int hashCode() {
			return Objects.hash("if", cond, thenBranch, elseBranch);
		}
	}

	public static final class While extends Stmt {
		public final Expr cond;
		public final Stmt body;

		While(Expr cond, Stmt body) {
			this.cond = Objects.requireNonNull(cond, "cond");
			this.body = Objects.requireNonNull(body, "body");
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitWhile(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof While other && cond.equals(other.cond) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash("while", cond, body);
		}
	}

	public static final class Seq extends Stmt {
		public final Stmt first;
		public final Stmt second;

		Seq(Stmt first, Stmt second) {
			this.first = Objects.requireNonNull(first, "first");
			this.second = Objects.requireNonNull(second, "second");
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitSeq(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Seq other && first.equals(other.first) && second.equals(other.second);
		}

		@Override
		public int hashCode() {
			return Objects.hash("seq", first, second);
		}
	}
}
