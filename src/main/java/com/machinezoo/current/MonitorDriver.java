// Part of Current
package com.machinezoo.current;

/**
 * Access to external resource wrapped by {@link Monitor}.
 * Methods of the driver are only ever called from the monitor's background task, one at a time.
 * They may block.
 *
 * @param <T>
 *            type of the value read from the resource
 */
public interface MonitorDriver<T> {
	/**
	 * Reads current state of the resource. It is called at most once per refresh.
	 * Resource errors should be returned as {@link Output#error(String)}.
	 * Thrown exceptions are logged and converted to error output.
	 *
	 * @return current state of the resource
	 * @throws Exception
	 *             if the read fails
	 */
	Output<T> read() throws Exception;
	/**
	 * Subscribes to changes in the resource.
	 * The {@code refresh} callback may be called from any thread at any time, including while {@link #read()} is running.
	 * It never blocks.
	 *
	 * @param refresh
	 *            callback to invoke whenever the resource might have changed
	 * @return handle that unsubscribes when closed
	 * @throws Exception
	 *             if the subscription fails
	 */
	AutoCloseable watch(Runnable refresh) throws Exception;
}
