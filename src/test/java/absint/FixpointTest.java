package absint;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import org.junit.Test;

public class FixpointTest {

	private static final class Recorder implements FixpointObserver<Memory> {
		final List<Memory> seen = new ArrayList<>();

		@Override
		public void onIteration(int iteration, Memory state) {
			assertEquals(seen.size(), iteration);
			seen.add(state);
		}
	}

	@Test
	public void stableInputIsReturnedImmediately() {
		Recorder rec = new Recorder();
		Memory m = Memory.bottom().bind("x", Sign.POSITIVE);

		Memory result = new Fixpoint<Memory>(10, rec).solve(UnaryOperator.identity(), m);

		assertSame(m, result);
		assertEquals(1, rec.seen.size());
	}

	@Test
	public void iteratesAreJoinedUntilStable() {
		Recorder rec = new Recorder();
		// x := x + 1 starting from x = 0
		UnaryOperator<Memory> inc = m -> m.bind("x", m.lookup("x").add(Sign.POSITIVE));

		Memory result = new Fixpoint<Memory>(10, rec).solve(inc, Memory.bottom().bind("x", Sign.ZERO));

		assertEquals(Memory.bottom().bind("x", Sign.TOP), result);
		assertEquals(2, rec.seen.size());
		assertEquals(Sign.ZERO, rec.seen.get(0).lookup("x"));
		assertEquals(Sign.TOP, rec.seen.get(1).lookup("x"));
	}

	@Test
	public void resultIsAPostFixpointAboveTheStart() {
		// x := 0 keeps the entry value of x through the join
		UnaryOperator<Memory> reset = m -> m.bind("x", Sign.ZERO);
		Memory start = Memory.bottom().bind("x", Sign.POSITIVE);

		Memory result = new Fixpoint<Memory>(10, FixpointObserver.none()).solve(reset, start);

		assertTrue(start.leq(result));
		assertTrue(reset.apply(result).leq(result));
		assertEquals(Sign.TOP, result.lookup("x"));
	}

	@Test
	public void terminatesWithinLatticeHeight() {
		String[] vars = {"a", "b", "c", "d", "e"};
		// each step pushes one variable one level up: unbound -> + -> Top
		UnaryOperator<Memory> climb = m -> {
			for (String v : vars) {
				Sign s = m.lookup(v);
				if (s == Sign.BOTTOM) return m.bind(v, Sign.POSITIVE);
				if (s == Sign.POSITIVE) return m.bind(v, Sign.TOP);
			}
			return m;
		};
		Recorder rec = new Recorder();

		Memory result = new Fixpoint<Memory>(100, rec).solve(climb, Memory.bottom());

		for (String v : vars) {
			assertEquals(Sign.TOP, result.lookup(v));
		}
		assertTrue(rec.seen.size() <= 3 * vars.length);
	}

	@Test
	public void worksOnSignsToo() {
		Sign result = new Fixpoint<Sign>(10, FixpointObserver.none()).solve(s -> s.add(Sign.NEGATIVE), Sign.POSITIVE);
		assertEquals(Sign.TOP, result);
	}

	@Test
	public void exceedingTheCapThrows() {
		// a fresh variable every step never stabilizes
		UnaryOperator<Memory> grow = m -> m.bind("v" + m.size(), Sign.POSITIVE);
		try {
			new Fixpoint<Memory>(5, FixpointObserver.none()).solve(grow, Memory.bottom());
			fail("expected FixpointException");
		} catch (FixpointException e) {
			assertEquals(5, e.getIterations());
			assertTrue(e.getMessage(), e.getMessage().endsWith("last state: {v0: +, v1: +, v2: +, v3: +, v4: +}"));
		}
	}

	@Test
	public void earlierIteratesAreNeverLost() {
		Memory start = Memory.bottom().bind("x", Sign.POSITIVE);
		Memory result = new Fixpoint<Memory>(10, FixpointObserver.none()).solve(m -> m.bind("x", Sign.ZERO), start);
		assertEquals(Sign.TOP, result.lookup("x"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void capMustBePositive() {
		new Fixpoint<Memory>(0, FixpointObserver.none());
	}
}
