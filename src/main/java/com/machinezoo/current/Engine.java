// Part of Current
package com.machinezoo.current;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.current.util.*;
import com.machinezoo.noexception.slf4j.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/**
 * Loop that evaluates a pipeline and re-evaluates it whenever any of its inputs changes.
 * Every cycle runs the {@link Evaluator}, releases {@link Watch}es from the previous cycle, reports the result to the {@link #trace()},
 * and waits until the first of the current cycle's watches fires.
 * <p>
 * The loop runs on the calling thread when started with {@link #run()} or on its own daemon thread when started with {@link #start()}.
 * It keeps running until {@link #stop()} is called or until the evaluator throws.
 * Exceptions thrown by the evaluator are never caught. They propagate out of {@link #run()} and complete {@link #future()} exceptionally.
 *
 * @param <R>
 *            type of the pipeline's result
 */
public class Engine<R> {
	private static final Logger logger = LoggerFactory.getLogger(Engine.class);
	private static final Timer timer = Metrics.timer("current.engine.evaluations");
	private static volatile BiConsumer<Output<?>, List<Watch>> traceDefault = Engine::log;
	/**
	 * Configures process-wide default trace. Engines that do not have explicitly configured {@link #trace()} report their results here.
	 * The initial default logs the result and descriptions of the watches.
	 *
	 * @param trace
	 *            new default trace
	 */
	public static void traceDefault(BiConsumer<Output<?>, List<Watch>> trace) {
		Objects.requireNonNull(trace);
		traceDefault = trace;
	}
	public static BiConsumer<Output<?>, List<Watch>> traceDefault() {
		return traceDefault;
	}
	private static void log(Output<?> result, List<Watch> watches) {
		logger.info("Evaluation complete:\n  Result: {}\n  Watching: {}", result, watches.stream().map(Watch::describe).collect(toList()));
	}
	private final Evaluator<R> evaluator;
	public Evaluator<R> evaluator() {
		return evaluator;
	}
	private BiConsumer<? super Output<R>, ? super List<Watch>> trace = (result, watches) -> traceDefault.accept(result, watches);
	public synchronized BiConsumer<? super Output<R>, ? super List<Watch>> trace() {
		return trace;
	}
	/**
	 * Configures callback that is invoked once per cycle with the result and current watches.
	 * It runs after watches from the previous cycle are released.
	 *
	 * @param trace
	 *            callback receiving result and watches of every cycle
	 * @return {@code this} (fluent method)
	 * @throws IllegalStateException
	 *             if the engine was already started
	 */
	public synchronized Engine<R> trace(BiConsumer<? super Output<R>, ? super List<Watch>> trace) {
		Objects.requireNonNull(trace);
		ensureNotStarted();
		this.trace = trace;
		return this;
	}
	private boolean started;
	private void ensureNotStarted() {
		if (started)
			throw new IllegalStateException("Engine was already started.");
	}
	private volatile boolean stopping;
	/*
	 * Race of the current cycle's watches. It lives only for one cycle, so stop() completes it directly.
	 */
	private CompletableFuture<?> waiting;
	private final CompletableFuture<Void> future = new CompletableFuture<>();
	/**
	 * Completes normally when the engine is stopped and exceptionally when the evaluator throws.
	 *
	 * @return future tracking termination of the loop
	 */
	public CompletableFuture<Void> future() {
		return future;
	}
	private volatile long cycles;
	/**
	 * Number of completed evaluations.
	 *
	 * @return number of times the evaluator returned
	 */
	public long cycles() {
		return cycles;
	}
	public Engine(Evaluator<R> evaluator) {
		Objects.requireNonNull(evaluator);
		this.evaluator = evaluator;
		OwnerTrace.of(this).alias("engine");
	}
	/**
	 * Runs the loop on the calling thread. It returns only after {@link #stop()} is called.
	 *
	 * @throws IllegalStateException
	 *             if the engine was already started
	 */
	public void run() {
		synchronized (this) {
			ensureNotStarted();
			started = true;
		}
		execute();
	}
	/**
	 * Runs the loop on new daemon thread. If the engine is already started, this method has no effect.
	 *
	 * @return the same as {@link #future()}
	 */
	public synchronized CompletableFuture<Void> start() {
		if (!started) {
			started = true;
			Thread thread = new Thread(ExceptionLogging.log(logger).runnable(this::execute));
			thread.setDaemon(true);
			thread.setName("current-engine-" + thread.getId());
			thread.start();
		}
		return future;
	}
	/**
	 * Stops the loop. The loop finishes current evaluation if there is one, releases its watches, and completes {@link #future()}.
	 * Stopping engine that was not started prevents it from ever running.
	 *
	 * @return {@code this}
	 */
	public synchronized Engine<R> stop() {
		stopping = true;
		if (waiting != null)
			waiting.complete(null);
		if (!started) {
			started = true;
			future.complete(null);
		}
		return this;
	}
	private void execute() {
		try {
			loop();
			future.complete(null);
		} catch (Throwable ex) {
			future.completeExceptionally(ex);
			throw ex;
		}
	}
	private void loop() {
		List<Watch> previous = Collections.emptyList();
		try {
			while (!stopping) {
				logger.info("Evaluating...");
				Snapshot<R> snapshot = evaluate();
				++cycles;
				List<Watch> old = previous;
				previous = snapshot.watches();
				release(old);
				trace().accept(snapshot.output(), snapshot.watches());
				logger.info("Waiting for inputs to change...");
				await(snapshot.watches());
			}
		} finally {
			release(previous);
		}
	}
	private Snapshot<R> evaluate() {
		Span span = GlobalTracer.get().buildSpan("current.engine.evaluation")
			.withTag("component", "current")
			.start();
		OwnerTrace.of(this).fill(span);
		Supplier<Snapshot<R>> evaluation = evaluator::evaluate;
		try (Scope scope = GlobalTracer.get().activateSpan(span)) {
			return Objects.requireNonNull(timer.record(evaluation), "Evaluator must return non-null snapshot.");
		} finally {
			span.finish();
		}
	}
	private static void release(List<Watch> watches) {
		for (Watch watch : watches)
			watch.release();
	}
	/*
	 * Whichever watch fires first wins. The other notifications are abandoned together with the watches.
	 */
	private void await(List<Watch> watches) {
		if (watches.isEmpty())
			logger.warn("Engine {} has nothing to watch. Waiting until it is stopped.", this);
		CompletableFuture<?>[] changes = new CompletableFuture<?>[watches.size()];
		for (int i = 0; i < watches.size(); ++i)
			changes[i] = watches.get(i).changed();
		CompletableFuture<Object> race = CompletableFuture.anyOf(changes);
		synchronized (this) {
			if (stopping)
				return;
			waiting = race;
		}
		try {
			race.join();
		} finally {
			synchronized (this) {
				waiting = null;
			}
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
