// Part of Current
package com.machinezoo.current.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Monitors and variables are usually created deep inside pipeline definitions.
 * Owner trace attaches an alias, tags, and a parent to any object, so that log lines,
 * watch descriptions, and tracing spans can name the object together with its owners.
 *
 * Trace data is kept in a map with weak identity keys, so tracing never keeps objects alive
 * and objects with custom equals() do not collide.
 */
/**
 * Trace of object ancestors for easier debugging and tracing.
 *
 * @param <T>
 *            type of the traced object
 */
@NoTests
@StubDocs
@DraftApi("should be in a separate library")
public class OwnerTrace<T> {
	private static final LoadingCache<Object, TraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<>(target, all.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final TraceData data;
	private OwnerTrace(T target, TraceData data) {
		Objects.requireNonNull(target);
		this.target = target;
		this.data = data;
	}
	/*
	 * No reference to the target is kept here. It would keep the weak key reachable from its own value.
	 */
	private static class TraceData {
		volatile String alias;
		volatile Map<String, Object> tags = Collections.emptyMap();
		volatile TraceData parent;
		TraceData(Object target) {
			alias = target instanceof Class ? ((Class<?>)target).getSimpleName() : target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Tags are rarely written and often read. Copy on write keeps readers lock-free.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			synchronized (data) {
				Map<String, Object> tags = new LinkedHashMap<>(data.tags);
				tags.put(key, value);
				data.tags = tags;
			}
		}
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		if (parent instanceof OwnerTrace)
			data.parent = ((OwnerTrace<?>)parent).data;
		else if (parent == null)
			data.parent = null;
		else
			data.parent = OwnerTrace.of(parent).data;
		return this;
	}
	/*
	 * Ancestors are listed from the root down. Repeated aliases get numeric suffix to keep tag keys unique.
	 */
	private List<Map.Entry<String, TraceData>> ancestors() {
		List<TraceData> chain = new ArrayList<>();
		for (TraceData ancestor = data; ancestor != null; ancestor = ancestor.parent)
			chain.add(ancestor);
		Collections.reverse(chain);
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>(chain.size());
		List<Map.Entry<String, TraceData>> named = new ArrayList<>(chain.size());
		for (TraceData ancestor : chain) {
			String alias = ancestor.alias;
			int number = numbering.getInt(alias);
			numbering.put(alias, number + 1);
			named.add(new AbstractMap.SimpleImmutableEntry<>(number == 0 ? alias : alias + (number + 1), ancestor));
		}
		return named;
	}
	private Map<String, Object> flatten(List<Map.Entry<String, TraceData>> ancestors) {
		Map<String, Object> sorted = new TreeMap<>();
		for (Map.Entry<String, TraceData> ancestor : ancestors)
			for (Map.Entry<String, Object> tag : ancestor.getValue().tags.entrySet())
				sorted.put(ancestor.getKey() + "." + tag.getKey(), tag.getValue());
		return sorted;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Map.Entry<String, TraceData>> ancestors = ancestors();
		span.setTag("owner", ancestors.stream().map(Map.Entry::getKey).collect(joining(".")));
		for (Map.Entry<String, Object> tag : flatten(ancestors).entrySet()) {
			Object value = tag.getValue();
			if (value instanceof String)
				span.setTag(tag.getKey(), (String)value);
			else if (value instanceof Number)
				span.setTag(tag.getKey(), (Number)value);
			else if (value instanceof Boolean)
				span.setTag(tag.getKey(), (boolean)value);
			else
				span.setTag(tag.getKey(), value.toString());
		}
		return span;
	}
	@Override
	public String toString() {
		List<Map.Entry<String, TraceData>> ancestors = ancestors();
		return ancestors.stream().map(Map.Entry::getKey).collect(joining(".")) + flatten(ancestors);
	}
}
