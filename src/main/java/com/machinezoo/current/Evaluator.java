// Part of Current
package com.machinezoo.current;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;

/**
 * Evaluator of a pipeline that is run once per {@link Engine} cycle.
 * It returns the pipeline's output and all {@link Watch}es touched during evaluation.
 * Evaluator must not block indefinitely except by reading inputs.
 * Exceptions thrown by the evaluator are fatal and terminate {@link Engine#run()}.
 *
 * @param <R>
 *            type of the pipeline's result
 */
@FunctionalInterface
public interface Evaluator<R> {
	Snapshot<R> evaluate();
	/**
	 * Creates evaluator that runs the supplier in fresh {@link InputScope}.
	 * Inputs read via {@link Input#track()} in the supplier have their watches collected.
	 * If the supplier throws, the collected watches are released before the exception propagates.
	 *
	 * @param <R>
	 *            type of the pipeline's result
	 * @param supplier
	 *            pipeline computation
	 * @return evaluator collecting watches of tracked inputs
	 */
	static <R> Evaluator<R> tracking(Supplier<Output<R>> supplier) {
		Objects.requireNonNull(supplier);
		return () -> {
			InputScope scope = new InputScope();
			Output<R> output = null;
			boolean completed = false;
			try (CloseableScope computation = scope.enter()) {
				output = Objects.requireNonNull(supplier.get(), "Evaluation must produce non-null output.");
				completed = true;
			} finally {
				if (!completed)
					scope.release();
			}
			return new Snapshot<>(output, scope.watches());
		};
	}
}
