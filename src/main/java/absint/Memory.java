package absint;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/* ---------------------------------------------------------
 * Abstract memory: Var -> Sign
 * Unbound variables read as BOTTOM ("never assigned on this path").
 * Instances are immutable, every update returns a fresh Memory.
 *
 * UNREACHABLE sits below the empty memory: it describes no state at all and
 * absorbs updates. Only condition refinement produces it.
 * --------------------------------------------------------- */
public final class Memory implements LatticeElement<Memory> {

	private static final Memory BOTTOM = new Memory(new TreeMap<>(), false);
	private static final Memory UNREACHABLE = new Memory(new TreeMap<>(), true);

	// identifier -> sign, ordered by identifier
	private final SortedMap<String, Sign> signs;
	private final boolean unreachable;

	private Memory(TreeMap<String, Sign> signs, boolean unreachable) {
		this.signs = Collections.unmodifiableSortedMap(signs);
		this.unreachable = unreachable;
	}

	public static Memory bottom() {
		return BOTTOM;
	}

	public static Memory unreachable() {
		return UNREACHABLE;
	}

	public Sign lookup(String x) {
		Objects.requireNonNull(x, "identifier");
		Sign s = signs.get(x);
		return (s == null) ? Sign.BOTTOM : s;
	}

	public Memory bind(String x, Sign s) {
		Objects.requireNonNull(x, "identifier");
		Objects.requireNonNull(s, "sign");
		if (unreachable) return this;
		TreeMap<String, Sign> m = new TreeMap<>(signs);
		m.put(x, s); // strong update
		return new Memory(m, false);
	}

	public boolean isBot() {
		return signs.isEmpty() && !unreachable;
	}

	public boolean isUnreachable() {
		return unreachable;
	}

	/* -------- Lattice ops -------- */

	/**
	 * Pointwise order over the variables bound in this memory only. Variables
	 * bound only in {@code r} read as BOTTOM here and are trivially below.
	 */
	@Override
	public boolean leq(Memory r) {
		Objects.requireNonNull(r, "memory");
		for (Map.Entry<String, Sign> e : signs.entrySet()) {
			if (!e.getValue().leq(r.lookup(e.getKey()))) return false;
		}
		return true;
	}

	@Override
	public Memory join_op(Memory r) {
		Objects.requireNonNull(r, "memory");
		if (this == r || unreachable) return r;
		if (r.unreachable) return this;
		if (isBot()) return r;
		if (r.isBot()) return this;
		TreeMap<String, Sign> m = new TreeMap<>(r.signs);
		for (Map.Entry<String, Sign> e : signs.entrySet()) {
			m.put(e.getKey(), e.getValue().join_op(r.lookup(e.getKey())));
		}
		return new Memory(m, false);
	}

	/**
	 * Read-only bindings, ordered by identifier.
	 */
	public SortedMap<String, Sign> entries() {
		return signs;
	}

	public int size() {
		return signs.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Memory other)) return false;
		return unreachable == other.unreachable && signs.equals(other.signs);
	}

	@Override
	public int hashCode() {
		return unreachable ? -1 : signs.hashCode();
	}

	@Override
	public String toString() {
		if (unreachable) return "unreachable";
		StringBuilder sb = new StringBuilder("{");
		for (Map.Entry<String, Sign> e : signs.entrySet()) {
			if (sb.length() > 1) sb.append(", ");
			sb.append(e.getKey()).append(": ").append(e.getValue());
		}
		return sb.append('}').toString();
	}
}
