// Part of Current
package com.machinezoo.current;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.current.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.opentracing.*;
import io.opentracing.util.*;

/**
 * Mutable cell holding single {@link Output} that can be used as an {@link Input}.
 * It is the simplest watchable input and a bridge between imperative code and pipelines.
 * Imperative code calls {@link #set(Object)} or {@link #value(Output)} and pipelines observe the change via {@link #get()}.
 * <p>
 * Every write wakes up all pending watches, even if the new value is equal to the old one.
 * Watches compare the current value with the value they observed and fire only if they differ
 * according to {@link Output#equals(Output, BiPredicate)} and configured {@link #equality(BiPredicate)}.
 * <p>
 * All methods are thread-safe. Writes are serialized, which makes {@link #update(UnaryOperator)} atomic.
 *
 * @param <T>
 *            type of the stored result
 *
 * @see Monitor
 */
@DraftDocs("link to pipeline docs")
public class Var<T> implements Input<T> {
	private static final Counter writes = Metrics.counter("current.var.writes");
	private final String name;
	public String name() {
		return name;
	}
	private Output<T> current;
	/*
	 * Watches that asked for notification and have not fired yet. Released watches are removed.
	 */
	private final Set<VarWatch> waiting = new HashSet<>();
	synchronized int waiting() {
		return waiting.size();
	}
	private volatile BiPredicate<? super T, ? super T> equality = Objects::equals;
	public BiPredicate<? super T, ? super T> equality() {
		return equality;
	}
	/**
	 * Configures equality used by watches to decide whether the value has changed.
	 * Default is {@link Objects#equals(Object, Object)}.
	 * This should be configured before the variable is used for the first time.
	 *
	 * @param equality
	 *            equality test for successful results
	 * @return {@code this} (fluent method)
	 */
	public Var<T> equality(BiPredicate<? super T, ? super T> equality) {
		Objects.requireNonNull(equality);
		this.equality = equality;
		return this;
	}
	public Var(String name, Output<T> initial) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(initial);
		this.name = name;
		current = initial;
		OwnerTrace.of(this)
			.alias("var")
			.tag("name", name);
	}
	public Var(String name, T initial) {
		this(name, Output.ok(initial));
	}
	/**
	 * Returns current value without creating a watch.
	 *
	 * @return current value
	 */
	public synchronized Output<T> value() {
		return current;
	}
	@Override
	public synchronized Snapshot<T> get() {
		return new Snapshot<>(current, new VarWatch(current));
	}
	/**
	 * Replaces current value. All watches are woken up and they fire if the new value differs from what they observed.
	 *
	 * @param value
	 *            new value
	 */
	public void value(Output<T> value) {
		Objects.requireNonNull(value);
		List<VarWatch> fired;
		synchronized (this) {
			current = value;
			fired = wake();
		}
		fire(fired);
	}
	public void set(T result) {
		value(Output.ok(result));
	}
	/**
	 * Replaces current value with the result of applying the function to it.
	 * Writes are serialized, so concurrent updates do not lose writes.
	 *
	 * @param update
	 *            function computing new value from the current one
	 */
	public void update(UnaryOperator<Output<T>> update) {
		Objects.requireNonNull(update);
		List<VarWatch> fired;
		synchronized (this) {
			current = Objects.requireNonNull(update.apply(current));
			fired = wake();
		}
		fire(fired);
	}
	/*
	 * Every write re-checks all waiting watches. Watches whose observed value still holds keep waiting.
	 */
	private List<VarWatch> wake() {
		writes.increment();
		List<VarWatch> fired = new ArrayList<>();
		for (Iterator<VarWatch> iterator = waiting.iterator(); iterator.hasNext();) {
			VarWatch watch = iterator.next();
			if (!current.equals(watch.observed, equality)) {
				iterator.remove();
				fired.add(watch);
			}
		}
		return fired;
	}
	/*
	 * Waiters run their callbacks on the writing thread. Never call this while holding the lock.
	 */
	private void fire(List<VarWatch> fired) {
		if (fired.isEmpty())
			return;
		Span span = GlobalTracer.get().buildSpan("current.var.change")
			.withTag("component", "current")
			.start();
		OwnerTrace.of(this).fill(span);
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			for (VarWatch watch : fired)
				watch.changed.complete(null);
		} finally {
			span.finish();
		}
	}
	private class VarWatch implements Watch {
		final Output<T> observed;
		final CompletableFuture<Void> changed = new CompletableFuture<>();
		/*
		 * Both flags are guarded by the variable's lock.
		 */
		boolean requested;
		boolean released;
		VarWatch(Output<T> observed) {
			this.observed = observed;
		}
		@Override
		public String describe() {
			return name;
		}
		/*
		 * Comparison starts only when someone asks for the notification. Writes that cancel each other out before that are invisible.
		 */
		@Override
		public CompletableFuture<Void> changed() {
			boolean fire = false;
			synchronized (Var.this) {
				if (!requested && !released) {
					requested = true;
					if (current.equals(observed, equality))
						waiting.add(this);
					else
						fire = true;
				}
			}
			if (fire)
				changed.complete(null);
			return changed.copy();
		}
		@Override
		public void release() {
			synchronized (Var.this) {
				released = true;
				waiting.remove(this);
			}
		}
		@Override
		public String toString() {
			return "watch of " + Var.this;
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + value();
	}
}
