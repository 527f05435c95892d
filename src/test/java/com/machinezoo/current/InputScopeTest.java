// Part of Current
package com.machinezoo.current;

import static java.util.stream.Collectors.*;
import static org.awaitility.Awaitility.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.closeablescope.*;

public class InputScopeTest extends TestBase {
	Var<String> a = new Var<>("a", "alpha");
	Var<String> b = new Var<>("b", "beta");
	private static List<String> describe(List<Watch> watches) {
		return watches.stream().map(Watch::describe).collect(toList());
	}
	@Test
	public void collect() {
		InputScope s = new InputScope();
		try (CloseableScope c = s.enter()) {
			assertSame(s, InputScope.current());
			assertEquals(Output.ok("alpha"), a.track());
			assertEquals(Output.ok("beta"), b.track());
		}
		assertNull(InputScope.current());
		assertEquals(Arrays.asList("a", "b"), describe(s.watches()));
	}
	@Test
	public void nested() {
		InputScope outer = new InputScope();
		InputScope inner = new InputScope();
		try (CloseableScope o = outer.enter()) {
			a.track();
			try (CloseableScope i = inner.enter()) {
				assertSame(inner, InputScope.current());
				b.track();
			}
			// Leaving inner scope restores the outer one.
			assertSame(outer, InputScope.current());
		}
		assertNull(InputScope.current());
		assertEquals(Arrays.asList("a"), describe(outer.watches()));
		assertEquals(Arrays.asList("b"), describe(inner.watches()));
	}
	@Test
	public void recursive() {
		InputScope s = new InputScope();
		try (CloseableScope c = s.enter()) {
			assertThrows(IllegalStateException.class, s::enter);
		}
		// Scope can be entered again after it was left.
		try (CloseableScope c = s.enter()) {
			assertSame(s, InputScope.current());
		}
	}
	@Test
	public void untracked() {
		TestDriver driver = new TestDriver();
		Monitor<Integer> monitor = new Monitor<>("resource", driver);
		// Outside of any scope, watches are released immediately.
		assertEquals(Output.pending(), monitor.track());
		assertEquals(0, monitor.refCount());
		await().until(monitor::state, equalTo(MonitorState.INACTIVE));
	}
	@Test
	public void release() {
		Monitor<Integer> monitor = new Monitor<>("resource", new TestDriver());
		InputScope s = new InputScope();
		try (CloseableScope c = s.enter()) {
			monitor.track();
			monitor.track();
		}
		assertEquals(2, monitor.refCount());
		s.release();
		assertEquals(0, monitor.refCount());
		assertTrue(s.watches().isEmpty());
		await().until(monitor::state, equalTo(MonitorState.INACTIVE));
	}
	@Test
	public void evaluator() {
		Evaluator<String> joined = Evaluator.tracking(() -> Output.ok(a.track().result() + b.track().result()));
		Snapshot<String> snapshot = joined.evaluate();
		assertEquals(Output.ok("alphabeta"), snapshot.output());
		assertEquals(Arrays.asList("a", "b"), describe(snapshot.watches()));
		// Evaluation does not leave its scope behind.
		assertNull(InputScope.current());
	}
	@Test
	public void evaluatorFailure() {
		Monitor<Integer> monitor = new Monitor<>("resource", new TestDriver());
		Evaluator<Integer> broken = Evaluator.tracking(() -> {
			monitor.track();
			throw new IllegalStateException("broken");
		});
		assertThrows(IllegalStateException.class, broken::evaluate);
		// Watches collected before the exception are released.
		assertEquals(0, monitor.refCount());
		assertNull(InputScope.current());
		Evaluator<Integer> empty = Evaluator.tracking(() -> {
			monitor.track();
			return null;
		});
		assertThrows(NullPointerException.class, empty::evaluate);
		assertEquals(0, monitor.refCount());
		await().until(monitor::state, equalTo(MonitorState.INACTIVE));
	}
	@Test
	public void constant() {
		Snapshot<String> snapshot = Input.constant(Output.ok("fixed")).get();
		assertEquals(Output.ok("fixed"), snapshot.output());
		assertTrue(snapshot.watches().isEmpty());
	}
}
