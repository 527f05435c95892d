// Part of Current
package com.machinezoo.current;

import java.util.*;
import java.util.concurrent.*;

/**
 * Change notification handle for one observation of an {@link Input}.
 * Every call to {@link Input#get()} returns fresh watches alongside the observed {@link Output}.
 * The watch fires once when the observed output might have changed.
 * A new watch must be obtained by calling {@link Input#get()} again in order to observe further changes.
 * <p>
 * Consumer of the watch must call {@link #release()} exactly once when it is no longer interested in changes.
 *
 * @see Input
 * @see Snapshot
 */
public interface Watch {
	/**
	 * Human-readable description of the watched resource.
	 *
	 * @return description of the watched resource
	 */
	String describe();
	/**
	 * Returns future that completes the first time the watched resource might have changed after this watch was created.
	 * The notification fires at most once. Repeated calls return futures bound to the same notification.
	 *
	 * @return future that completes on change
	 */
	CompletableFuture<Void> changed();
	/**
	 * Optional hook that lets scheduler abort a long wait.
	 *
	 * @return cancellation callback if the watch supports it
	 */
	default Optional<Runnable> cancel() {
		return Optional.empty();
	}
	/**
	 * Signals that the consumer is done with this watch.
	 * It must be called exactly once for every watch.
	 *
	 * @throws IllegalStateException
	 *             if the watch implementation detects that it was already released
	 */
	void release();
}
