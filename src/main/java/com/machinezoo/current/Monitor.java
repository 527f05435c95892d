// Part of Current
package com.machinezoo.current;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.slf4j.*;
import com.machinezoo.current.util.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Monitor is a state machine driven by a single background task:
 *
 * INACTIVE -> INSTALLING -> READING -> WAITING -> READING -> ... -> WAITING -> UNINSTALLING -> INACTIVE
 *
 * Task is started by the first get() after the monitor was inactive. It stops after the last watch is released,
 * unless somebody calls get() again while the subscription is being closed, in which case it subscribes again.
 *
 * The 'active' flag is tested and set under the lock, which guarantees there is at most one task per monitor.
 * Driver calls may block, so they are made without holding the lock. Everything else happens under the lock.
 * The lock is never held for long, so the refresh callback can take it without blocking on driver work.
 */
/**
 * Cached, reference-counted {@link Input} backed by external resource.
 * Any number of consumers share one subscription to the resource and one cached value.
 * Resource is accessed via {@link MonitorDriver} from a background task, which exists only while there are unreleased watches.
 * <p>
 * Freshly activated monitor returns pending output until the first read completes.
 * Value cached before deactivation is discarded, because it might be stale by the time the monitor is activated again.
 * <p>
 * Refresh requests that arrive while the resource is being read are never lost. They cause another read after the current one completes.
 * <p>
 * If the background task is interrupted, the monitor deactivates and fires all outstanding watches,
 * so that consumers reactivate it with their next call to {@link #get()}.
 *
 * @param <T>
 *            type of the value read from the resource
 *
 * @see MonitorDriver
 * @see MonitorCache
 */
@DraftDocs("link to pipeline docs")
public class Monitor<T> implements Input<T> {
	private static final Logger logger = LoggerFactory.getLogger(Monitor.class);
	private static final Counter reads = Metrics.counter("current.monitor.reads");
	private static final AtomicInteger running = Metrics.gauge("current.monitor.active", new AtomicInteger());
	/*
	 * Driver calls may block for a long time, so monitors run on an unbounded pool rather than on a compute-sized one.
	 */
	private static final ExecutorService common = Executors.newCachedThreadPool(new ThreadFactory() {
		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable);
			thread.setDaemon(true);
			thread.setName("current-monitor-" + thread.getId());
			return thread;
		}
	});
	public static ExecutorService common() {
		return common;
	}
	private final String name;
	public String name() {
		return name;
	}
	private final MonitorDriver<T> driver;
	private Executor executor = common;
	/**
	 * Configures executor that runs the background task. Default is {@link #common()}.
	 * The executor must run tasks on a thread other than the submitting one.
	 * New executor is used the next time the monitor is activated.
	 *
	 * @param executor
	 *            executor for the background task
	 * @return {@code this} (fluent method)
	 */
	public synchronized Monitor<T> executor(Executor executor) {
		Objects.requireNonNull(executor);
		this.executor = executor;
		return this;
	}
	public synchronized Executor executor() {
		return executor;
	}
	private Output<T> value = Output.pending();
	private int refCount;
	private boolean active;
	private boolean needRefresh = true;
	private MonitorState state = MonitorState.INACTIVE;
	/*
	 * Unreleased watches that have not fired yet. All of them fire on the next publication.
	 */
	private final Set<MonitorWatch> waiting = new HashSet<>();
	public Monitor(String name, MonitorDriver<T> driver) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(driver);
		this.name = name;
		this.driver = driver;
		OwnerTrace.of(this)
			.alias("monitor")
			.tag("name", name);
	}
	public synchronized MonitorState state() {
		return state;
	}
	public synchronized int refCount() {
		return refCount;
	}
	public synchronized boolean active() {
		return active;
	}
	synchronized int waiting() {
		return waiting.size();
	}
	/**
	 * Returns cached value without creating a watch or activating the monitor.
	 *
	 * @return cached value, pending if the monitor is not active
	 */
	public synchronized Output<T> value() {
		return value;
	}
	/**
	 * Returns cached value and a watch that fires after the next read completes.
	 * Background task is started if the monitor is not active.
	 *
	 * @return cached value and a watch on this monitor
	 * @throws RejectedExecutionException
	 *             if the configured {@link #executor()} refuses to run the background task
	 */
	@Override
	public synchronized Snapshot<T> get() {
		++refCount;
		if (!active) {
			active = true;
			state = MonitorState.INSTALLING;
			try {
				executor.execute(ExceptionLogging.log(logger).runnable(this::run));
			} catch (RejectedExecutionException ex) {
				--refCount;
				active = false;
				state = MonitorState.INACTIVE;
				throw ex;
			}
			running.incrementAndGet();
		}
		MonitorWatch watch = new MonitorWatch();
		waiting.add(watch);
		return new Snapshot<>(value, watch);
	}
	/**
	 * Marks cached value as stale. This is the callback passed to {@link MonitorDriver#watch(Runnable)}.
	 * It can be called from any thread at any time. It only causes another read if the monitor is active.
	 */
	public synchronized void refresh() {
		needRefresh = true;
		notifyAll();
	}
	private void run() {
		AutoCloseable subscription = null;
		while (true) {
			switch (state()) {
				case INSTALLING:
					subscription = install();
					synchronized (this) {
						if (refCount == 0)
							state = MonitorState.UNINSTALLING;
						else if (subscription == null) {
							/*
							 * Failed subscription was already published as an error. Nothing to do until released or refreshed by hand.
							 */
							needRefresh = false;
							state = MonitorState.WAITING;
						} else
							state = MonitorState.READING;
					}
					break;
				case READING:
					read();
					break;
				case WAITING:
					if (!await()) {
						logger.warn("Monitor {} was interrupted. Deactivating it.", this);
						uninstall(subscription);
						deactivate();
						return;
					}
					break;
				case UNINSTALLING:
					uninstall(subscription);
					subscription = null;
					if (retire())
						return;
					break;
				default:
					throw new IllegalStateException();
			}
		}
	}
	private AutoCloseable install() {
		logger.debug("Subscribing to {}.", name);
		try {
			return Objects.requireNonNull(driver.watch(this::refresh), "Subscription handle must not be null.");
		} catch (Exception ex) {
			logger.warn("Failed to subscribe to {}.", name, ex);
			publish(Output.error(ex.toString()));
			return null;
		}
	}
	private void read() {
		synchronized (this) {
			needRefresh = false;
		}
		logger.debug("Reading {}.", name);
		Span span = GlobalTracer.get().buildSpan("current.monitor.read")
			.withTag("component", "current")
			.start();
		OwnerTrace.of(this).fill(span);
		Output<T> output;
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			output = Objects.requireNonNull(driver.read(), "Read must produce non-null output.");
		} catch (Exception ex) {
			logger.warn("Failed to read {}.", name, ex);
			output = Output.error(ex.toString());
		} finally {
			span.finish();
		}
		reads.increment();
		publish(output);
	}
	private void publish(Output<T> output) {
		List<MonitorWatch> fired;
		synchronized (this) {
			value = output;
			fired = drain();
			state = MonitorState.WAITING;
		}
		fire(fired);
	}
	private List<MonitorWatch> drain() {
		List<MonitorWatch> fired = new ArrayList<>(waiting);
		waiting.clear();
		return fired;
	}
	private void fire(List<MonitorWatch> fired) {
		for (MonitorWatch watch : fired)
			watch.changed.complete(null);
	}
	/*
	 * Released watches take priority over refresh requests. There is no point reading a resource nobody watches.
	 */
	private synchronized boolean await() {
		while (refCount > 0 && !needRefresh) {
			try {
				wait();
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				return false;
			}
		}
		state = refCount == 0 ? MonitorState.UNINSTALLING : MonitorState.READING;
		return true;
	}
	private void uninstall(AutoCloseable subscription) {
		if (subscription == null)
			return;
		logger.debug("Unsubscribing from {}.", name);
		try {
			subscription.close();
		} catch (Exception ex) {
			logger.warn("Failed to unsubscribe from {}.", name, ex);
		}
	}
	/*
	 * Checking for new consumers and deactivating must be atomic. Otherwise get() could see the monitor active and not start a task.
	 */
	private boolean retire() {
		synchronized (this) {
			if (refCount > 0) {
				state = MonitorState.INSTALLING;
				return false;
			}
			reset();
		}
		running.decrementAndGet();
		return true;
	}
	/*
	 * Consumers may still hold watches. They are fired, so that their next get() starts a new task.
	 */
	private void deactivate() {
		List<MonitorWatch> fired;
		synchronized (this) {
			reset();
			fired = drain();
		}
		running.decrementAndGet();
		fire(fired);
	}
	private void reset() {
		active = false;
		value = Output.pending();
		state = MonitorState.INACTIVE;
	}
	private class MonitorWatch implements Watch {
		final CompletableFuture<Void> changed = new CompletableFuture<>();
		boolean released;
		@Override
		public String describe() {
			return name;
		}
		@Override
		public CompletableFuture<Void> changed() {
			return changed.copy();
		}
		@Override
		public void release() {
			synchronized (Monitor.this) {
				if (released)
					throw new IllegalStateException("Watch of " + name + " was already released.");
				if (refCount <= 0)
					throw new IllegalStateException("Reference count of " + name + " would become negative.");
				released = true;
				waiting.remove(this);
				--refCount;
				if (refCount == 0)
					Monitor.this.notifyAll();
			}
		}
		@Override
		public String toString() {
			return "watch of " + Monitor.this;
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + value();
	}
}
