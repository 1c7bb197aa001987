package absint;

import java.util.Objects;

/**
 * Expressions of the analyzed language. The set of node types is closed:
 * every consumer goes through {@link Visitor}, so a new node type does not
 * compile until each visitor handles it.
 */
public abstract class Expr {

	public interface Visitor<R, A> {
		R visitNum(Num e, A arg);

		R visitVar(Var e, A arg);

		R visitAdd(Add e, A arg);

		R visitEqual(Equal e, A arg);

		R visitLess(Less e, A arg);

		R visitNot(Not e, A arg);
	}

	private Expr() {
	}

	public abstract <R, A> R accept(Visitor<R, A> v, A arg);

	/* -------- Factories -------- */

	public static Expr num(long n) {
		return new Num(n);
	}

	public static Expr var(String x) {
		return new Var(x);
	}

	public static Expr add(Expr e1, Expr e2) {
		return new Add(e1, e2);
	}

	public static Expr equal(Expr e1, Expr e2) {
		return new Equal(e1, e2);
	}

	public static Expr less(Expr e1, Expr e2) {
		return new Less(e1, e2);
	}

	public static Expr not(Expr e) {
		return new Not(e);
	}

	/* -------- Node types -------- */

	public static final class Num extends Expr {
		public final long value;

		Num(long value) {
			this.value = value;
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitNum(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Num other && value == other.value;
		}

		@Override
		public int hashCode() {
			return Long.hashCode(value);
		}

		@Override
		public String toString() {
			return String.valueOf(value);
		}
	}

	public static final class Var extends Expr {
		public final String name;

		Var(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitVar(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Var other && name.equals(other.name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/** Shared shape of the binary operators. */
	abstract static class Binary extends Expr {
		public final Expr left;
		public final Expr right;

		Binary(Expr left, Expr right) {
			this.left = Objects.requireNonNull(left, "left");
			this.right = Objects.requireNonNull(right, "right");
		}

		abstract String operator();

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || o.getClass() != getClass()) return false;
			Binary other = (Binary) o;
			return left.equals(other.left) && right.equals(other.right);
		}

		@Override
		public int hashCode() {
			return Objects.hash(getClass().getSimpleName(), left, right);
		}

		@Override
		public String toString() {
			return "(" + left + " " + operator() + " " + right + ")";
		}
	}

	public static final class Add extends Binary {
		Add(Expr left, Expr right) {
			super(left, right);
		}

		@Override
		String operator() {
			return "+";
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitAdd(this, arg);
		}
	}

	public static final class Equal extends Binary {
		Equal(Expr left, Expr right) {
			super(left, right);
		}

		@Override
		String operator() {
			return "==";
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitEqual(this, arg);
		}
	}

	public static final class Less extends Binary {
		Less(Expr left, Expr right) {
			super(left, right);
		}

		@Override
		String operator() {
			return "<";
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitLess(this, arg);
		}
	}

	public static final class Not extends Expr {
		public final Expr operand;

		Not(Expr operand) {
			this.operand = Objects.requireNonNull(operand, "operand");
		}

		@Override
		public <R, A> R accept(Visitor<R, A> v, A arg) {
			return v.visitNot(this, arg);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Not other && operand.equals(other.operand);
		}

		@Override
		public int hashCode() {
			return 31 * operand.hashCode() + 7;
		}

		@Override
		public String toString() {
			return "!" + operand;
		}
	}
}
