// Part of Current
package com.machinezoo.current;

import java.util.*;

/*
 * Inputs are plain function values. Persistent state lives in whatever the input closes over,
 * typically Monitor or Var, which implement this interface directly.
 */
/**
 * Watchable computation that returns current {@link Output} and {@link Watch}es for its dependencies.
 * Implementations must return promptly. Expensive work belongs in a background task, for example in {@link Monitor}.
 *
 * @param <T>
 *            type of the successful result
 *
 * @see Var
 * @see Monitor
 * @see InputScope
 */
@FunctionalInterface
public interface Input<T> {
	/**
	 * Observes the input. Caller takes ownership of the returned watches and must eventually release them.
	 *
	 * @return current output and watches that fire when it might change
	 */
	Snapshot<T> get();
	/**
	 * Observes the input and records its watches in current {@link InputScope}.
	 * If there is no current scope, the watches are released immediately, because nobody is going to consume them.
	 *
	 * @return current output
	 *
	 * @see InputScope#record(List)
	 */
	default Output<T> track() {
		Snapshot<T> snapshot = get();
		InputScope.record(snapshot.watches());
		return snapshot.output();
	}
	/**
	 * Creates input that always returns the same output and never changes.
	 *
	 * @param <T>
	 *            type of the successful result
	 * @param output
	 *            output that is returned on every call
	 * @return input that has no dependencies
	 */
	static <T> Input<T> constant(Output<T> output) {
		Objects.requireNonNull(output);
		return () -> new Snapshot<>(output, Collections.emptyList());
	}
}
