// Part of Current
package com.machinezoo.current;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;

public class VarTest extends TestBase {
	@Test
	public void crud() {
		Var<String> v = new Var<>("greeting", "hello");
		assertEquals("greeting", v.name());
		assertEquals(Output.ok("hello"), v.value());
		v.set("world");
		assertEquals(Output.ok("world"), v.value());
		v.value(Output.error("boom"));
		assertEquals(Output.error("boom"), v.value());
		// Variable can start pending.
		Var<String> p = new Var<>("pending", Output.pending());
		assertEquals(Output.pending(), p.value());
	}
	@Test
	public void snapshot() {
		Var<String> v = new Var<>("greeting", "hello");
		Snapshot<String> s = v.get();
		assertEquals(Output.ok("hello"), s.output());
		assertEquals(1, s.watches().size());
		Watch w = s.watches().get(0);
		assertEquals("greeting", w.describe());
		// Variable watches have no cancellation hook and releasing them twice is harmless.
		assertFalse(w.cancel().isPresent());
		w.release();
		w.release();
	}
	@Test
	public void releaseStopsWaiting() {
		Var<String> v = new Var<>("greeting", "hello");
		for (int i = 0; i < 1000; ++i) {
			Watch w = v.get().watches().get(0);
			w.changed();
			w.release();
		}
		// Released watches are forgotten, even when equal values are written.
		assertEquals(0, v.waiting());
		v.set("hello");
		assertEquals(0, v.waiting());
		Watch live = v.get().watches().get(0);
		CompletableFuture<Void> changed = live.changed();
		assertEquals(1, v.waiting());
		v.set(new String("hello"));
		assertEquals(1, v.waiting());
		// Fired watch is forgotten too.
		v.set("hi");
		assertTrue(changed.isDone());
		assertEquals(0, v.waiting());
		// Released watch never fires.
		Watch released = v.get().watches().get(0);
		CompletableFuture<Void> abandoned = released.changed();
		released.release();
		v.set("bye");
		assertFalse(abandoned.isDone());
		assertEquals(0, v.waiting());
	}
	@Test
	public void fireOnChange() {
		Var<String> v = new Var<>("greeting", "hello");
		CompletableFuture<Void> changed = v.get().watches().get(0).changed();
		assertFalse(changed.isDone());
		// Waiters are notified on the writing thread.
		v.set("hi");
		assertTrue(changed.isDone());
		// Watch that was created after the change waits for another change.
		CompletableFuture<Void> next = v.get().watches().get(0).changed();
		assertFalse(next.isDone());
		v.set("bye");
		assertTrue(next.isDone());
	}
	@Test
	public void ignoreEqualWrites() {
		Var<String> v = new Var<>("greeting", "hello");
		CompletableFuture<Void> changed = v.get().watches().get(0).changed();
		// Writer wakes up the watch, but the watch notices that nothing has changed.
		v.set(new String("hello"));
		v.set("hello");
		assertFalse(changed.isDone());
		v.set("hi");
		assertTrue(changed.isDone());
	}
	@Test
	public void finalValueDecides() {
		Var<String> v = new Var<>("greeting", "hello");
		Watch reverted = v.get().watches().get(0);
		v.set("hi");
		v.set("hello");
		// Value is back where it was when the watch was created.
		assertFalse(reverted.changed().isDone());
		Watch moved = v.get().watches().get(0);
		v.set("hi");
		v.set("bye");
		assertTrue(moved.changed().isDone());
	}
	@Test
	public void repeatedChangedCalls() {
		Var<String> v = new Var<>("greeting", "hello");
		Watch w = v.get().watches().get(0);
		CompletableFuture<Void> first = w.changed();
		CompletableFuture<Void> second = w.changed();
		v.set("hi");
		assertTrue(first.isDone());
		assertTrue(second.isDone());
		// Completing the returned future does not affect other callers.
		Watch fresh = v.get().watches().get(0);
		fresh.changed().complete(null);
		assertFalse(fresh.changed().isDone());
	}
	@Test
	public void errors() {
		Var<String> v = new Var<>("input", Output.error("boom"));
		CompletableFuture<Void> changed = v.get().watches().get(0).changed();
		// The same error is not a change.
		v.value(Output.error("boom"));
		assertFalse(changed.isDone());
		// Different error message is a change.
		v.value(Output.error("bang"));
		assertTrue(changed.isDone());
	}
	@Test
	public void pending() {
		Var<String> v = new Var<>("input", Output.pending());
		CompletableFuture<Void> changed = v.get().watches().get(0).changed();
		v.value(Output.pending());
		assertFalse(changed.isDone());
		v.set("ready");
		assertTrue(changed.isDone());
	}
	@Test
	public void customEquality() {
		Var<String> v = new Var<String>("greeting", "hello").equality(String::equalsIgnoreCase);
		CompletableFuture<Void> changed = v.get().watches().get(0).changed();
		v.set("HELLO");
		assertFalse(changed.isDone());
		assertEquals(Output.ok("HELLO"), v.value());
		v.set("bye");
		assertTrue(changed.isDone());
	}
	@Test
	public void update() {
		Var<Integer> v = new Var<>("counter", 1);
		CompletableFuture<Void> changed = v.get().watches().get(0).changed();
		v.update(o -> o.map(n -> n + 1));
		assertEquals(Output.ok(2), v.value());
		assertTrue(changed.isDone());
		// Update that does not change anything does not fire.
		CompletableFuture<Void> unchanged = v.get().watches().get(0).changed();
		v.update(o -> o);
		assertFalse(unchanged.isDone());
	}
	@Test
	public void concurrentUpdates() throws Exception {
		Var<Integer> v = new Var<>("counter", 0);
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int i = 0; i < 4; ++i) {
				futures.add(executor.submit(() -> {
					for (int j = 0; j < 1000; ++j)
						v.update(o -> o.map(n -> n + 1));
				}));
			}
			for (Future<?> future : futures)
				future.get(10, TimeUnit.SECONDS);
		} finally {
			executor.shutdown();
		}
		assertEquals(Output.ok(4000), v.value());
	}
	@Test
	public void waitOnAnotherThread() throws Exception {
		Var<String> v = new Var<>("greeting", "hello");
		CompletableFuture<Void> changed = v.get().watches().get(0).changed();
		CompletableFuture.runAsync(() -> v.set("hi"));
		changed.get(10, TimeUnit.SECONDS);
		assertEquals(Output.ok("hi"), v.value());
	}
}
