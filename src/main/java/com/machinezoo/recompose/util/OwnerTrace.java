// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Composition trees are deep and a span or log line that names only the immediate object is rarely enough.
 * Owner trace attaches an alias, a few tags, and a parent to any object, so that traces and toString()
 * can print the whole ownership chain from the composer down to the node that did the work.
 *
 * Trace data is kept in a side table with weak keys, so that traced classes need no extra member.
 * The side table cannot reference the target, because that would keep the weak key alive.
 * That is why OwnerTrace itself is only a short-lived builder around the target and its data.
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
	/*
	 * Guava's weak keys compare by identity, which is what we want for composables with custom equals().
	 */
	private static final LoadingCache<Object, TraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<T>(target, all.getUnchecked(target));
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
	private static class TraceData {
		volatile String alias;
		volatile Tag tags;
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
	 * Tags form an immutable linked list except for the value, which may be updated in place.
	 */
	private static class Tag {
		final String key;
		volatile Object value;
		final Tag next;
		Tag(String key, Object value, Tag next) {
			this.key = key;
			this.value = value;
			this.next = next;
		}
	}
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		/*
		 * Null values are ignored, so that callers can tag optional properties without checks.
		 */
		if (value == null)
			return this;
		Tag head = data.tags;
		for (Tag tag = head; tag != null; tag = tag.next) {
			if (tag.key.equals(key)) {
				tag.value = value;
				return this;
			}
		}
		data.tags = new Tag(key, value, head);
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
	 * Ancestors sharing an alias get numbered namespaces (node, node2, node3) so that their tags do not collide.
	 */
	private List<Map.Entry<String, TraceData>> namespaces() {
		List<TraceData> chain = new ArrayList<>();
		for (TraceData ancestor = data; ancestor != null; ancestor = ancestor.parent)
			chain.add(ancestor);
		Collections.reverse(chain);
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>(chain.size());
		List<Map.Entry<String, TraceData>> namespaces = new ArrayList<>(chain.size());
		for (TraceData ancestor : chain) {
			String alias = ancestor.alias;
			int number = numbering.getInt(alias);
			numbering.put(alias, number == 0 ? 2 : number + 1);
			namespaces.add(new AbstractMap.SimpleImmutableEntry<>(number == 0 ? alias : alias + number, ancestor));
		}
		return namespaces;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Map.Entry<String, TraceData>> namespaces = namespaces();
		span.setTag("owner", namespaces.stream().map(Map.Entry::getKey).collect(joining(".")));
		for (Map.Entry<String, TraceData> ns : namespaces) {
			for (Tag tag = ns.getValue().tags; tag != null; tag = tag.next) {
				String key = ns.getKey() + "." + tag.key;
				Object value = tag.value;
				if (value instanceof String)
					span.setTag(key, (String)value);
				else if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
		return span;
	}
	@Override
	public String toString() {
		Map<String, Object> sorted = new TreeMap<>();
		List<Map.Entry<String, TraceData>> namespaces = namespaces();
		for (Map.Entry<String, TraceData> ns : namespaces)
			for (Tag tag = ns.getValue().tags; tag != null; tag = tag.next)
				sorted.put(ns.getKey() + "." + tag.key, tag.value);
		return namespaces.stream().map(Map.Entry::getKey).collect(joining(".")) + sorted;
	}
}
