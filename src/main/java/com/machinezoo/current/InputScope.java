// Part of Current
package com.machinezoo.current;

import java.util.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.current.util.*;
import com.machinezoo.stagean.*;

/*
 * Evaluators walk arbitrarily deep pipeline code. Passing watch lists through all of it would be tedious,
 * so inputs read via Input.track() deposit their watches in a thread-local scope instead.
 *
 * Scope is not thread-safe. Evaluation is expected to run on a single thread.
 */
/**
 * Thread-local collector of {@link Watch}es observed during evaluation.
 *
 * @see Input#track()
 * @see Evaluator#tracking(java.util.function.Supplier)
 */
@StubDocs
public class InputScope {
	private static final ThreadLocal<InputScope> current = new ThreadLocal<>();
	public static InputScope current() {
		return current.get();
	}
	private final List<Watch> watches = new ArrayList<>();
	private InputScope parent;
	private boolean entered;
	public InputScope() {
		OwnerTrace.of(this).alias("scope");
	}
	public CloseableScope enter() {
		if (entered)
			throw new IllegalStateException("Cannot enter the same input scope recursively.");
		entered = true;
		parent = current.get();
		current.set(this);
		return () -> {
			if (parent != null)
				current.set(parent);
			else
				current.remove();
			parent = null;
			entered = false;
		};
	}
	public void add(Watch watch) {
		Objects.requireNonNull(watch);
		watches.add(watch);
	}
	/**
	 * Returns watches collected so far. The caller takes ownership of the watches.
	 *
	 * @return watches in the order they were recorded
	 */
	public List<Watch> watches() {
		return new ArrayList<>(watches);
	}
	/**
	 * Releases all collected watches and forgets them.
	 * This is used when the evaluation is abandoned and nobody is going to consume the watches.
	 */
	public void release() {
		List<Watch> abandoned = new ArrayList<>(watches);
		watches.clear();
		for (Watch watch : abandoned)
			watch.release();
	}
	/**
	 * Records watches in current scope. If there is no current scope, the watches are released immediately.
	 *
	 * @param watches
	 *            watches to record
	 */
	public static void record(List<Watch> watches) {
		Objects.requireNonNull(watches);
		InputScope scope = current();
		if (scope != null) {
			for (Watch watch : watches)
				scope.add(watch);
		} else {
			for (Watch watch : watches)
				watch.release();
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " with " + watches.size() + " watches";
	}
}
