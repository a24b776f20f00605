// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Factories for combinator composables.
 */
@StubDocs
public class Composables {
	private Composables() {
	}
	public static Composable empty() {
		return Empty.INSTANCE;
	}
	/**
	 * Composes all parts side by side.
	 * Every part keeps its own state. Parts are matched by position.
	 *
	 * @param parts
	 *            children of the sequence
	 * @return container composable
	 */
	public static Composable sequence(Composable... parts) {
		return sequence(Arrays.asList(parts));
	}
	public static Composable sequence(List<? extends Composable> parts) {
		Objects.requireNonNull(parts);
		return new Sequence(List.copyOf(parts));
	}
	/*
	 * Null content is the same as absent content. Absent content tears down the mounted child.
	 */
	public static Composable optional(Composable content) {
		return new OptionalCompose(content);
	}
	public static Composable optional(Optional<? extends Composable> content) {
		Objects.requireNonNull(content);
		return new OptionalCompose(content.orElse(null));
	}
	public static Fallible fallible(Composable content) {
		return Fallible.ok(content);
	}
	public static Catch handle(Consumer<Throwable> handler, Composable content) {
		return new Catch(handler, content);
	}
	/**
	 * Hides type of the content from the parent.
	 * Content of a different type than the mounted one is mounted fresh and the old subtree is torn down.
	 *
	 * @param content
	 *            composable of any type
	 * @return container composable
	 */
	public static Composable dynamic(Composable content) {
		return new DynamicCompose(content);
	}
	/**
	 * Recomposes {@code content} only when {@code key} changes.
	 * Content still recomposes when its own state changes.
	 *
	 * @param key
	 *            dependency compared with {@link Objects#equals(Object, Object)}
	 * @param content
	 *            memoized subtree
	 * @return container composable
	 */
	public static Composable memo(Object key, Composable content) {
		return new Memo(key, content);
	}
	public static <T> Composable forEach(Iterable<T> items, Function<? super T, ? extends Composable> factory) {
		return new ForEach<>(items, factory);
	}
	public static Composable of(Function<Scope, ? extends Composable> body) {
		return new FunctionCompose(body);
	}
}
