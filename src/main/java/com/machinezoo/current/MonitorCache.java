// Part of Current
package com.machinezoo.current;

import java.util.*;
import java.util.function.*;
import com.google.common.cache.*;
import com.machinezoo.current.util.*;
import com.machinezoo.stagean.*;

/*
 * Monitors are only useful if all consumers of a resource share one instance.
 * Pipelines however construct inputs on every evaluation, so monitors have to be memoized by resource key.
 * Monitors are never evicted. Inactive monitor holds nothing but its configuration.
 */
/**
 * Memoizes one {@link Monitor} per resource key.
 *
 * @param <K>
 *            type of the resource key
 * @param <T>
 *            type of the value read from the resource
 */
@StubDocs
public class MonitorCache<K, T> {
	private final LoadingCache<K, Monitor<T>> monitors;
	public MonitorCache(Function<K, Monitor<T>> factory) {
		Objects.requireNonNull(factory);
		monitors = CacheBuilder.newBuilder()
			.build(CacheLoader.from(key -> {
				Monitor<T> monitor = Objects.requireNonNull(factory.apply(key));
				OwnerTrace.of(monitor)
					.parent(this)
					.tag("key", key);
				return monitor;
			}));
		OwnerTrace.of(this).alias("monitors");
	}
	public Monitor<T> get(K key) {
		Objects.requireNonNull(key);
		return monitors.getUnchecked(key);
	}
	public long size() {
		return monitors.size();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " with " + size() + " monitors";
	}
}
