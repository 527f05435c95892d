// Part of Current
package com.machinezoo.current;

/**
 * State of {@link Monitor}'s background task.
 */
public enum MonitorState {
	/**
	 * No background task. Cached value is pending.
	 */
	INACTIVE,
	/**
	 * Subscribing to the resource via {@link MonitorDriver#watch(Runnable)}.
	 */
	INSTALLING,
	/**
	 * Reading the resource via {@link MonitorDriver#read()}.
	 */
	READING,
	/**
	 * Waiting for refresh or for the last watch to be released.
	 */
	WAITING,
	/**
	 * Closing the subscription.
	 */
	UNINSTALLING
}
