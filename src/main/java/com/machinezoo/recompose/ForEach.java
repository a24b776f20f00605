// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.function.*;

/*
 * Elements are matched by position, not by identity of the items.
 * Removing an item from the middle therefore shifts state of all following elements by one.
 */
final class ForEach<T> implements Composable {
	private final Iterable<T> items;
	private final Function<? super T, ? extends Composable> factory;
	ForEach(Iterable<T> items, Function<? super T, ? extends Composable> factory) {
		Objects.requireNonNull(items);
		Objects.requireNonNull(factory);
		this.items = items;
		this.factory = factory;
	}
	private static class Entry {
		Object item;
		final ChildSlot slot;
		Entry(Object item, ChildSlot slot) {
			this.item = item;
			this.slot = slot;
		}
	}
	@Override
	public Composable compose(Scope scope) {
		scope.markContainer();
		List<Entry> entries = scope.useRef(ArrayList::new);
		boolean changed = scope.isParentChanged();
		int position = 0;
		for (T item : items) {
			Entry entry;
			if (position < entries.size()) {
				entry = entries.get(position);
				entry.item = item;
			} else {
				entry = new Entry(item, scope.child());
				entries.add(entry);
			}
			entry.slot.mount(factory.apply(item));
			entry.slot.drive(changed);
			++position;
		}
		/*
		 * Removed tail is torn down in positional order.
		 */
		List<Entry> removed = entries.subList(position, entries.size());
		for (Entry entry : removed)
			entry.slot.clear();
		removed.clear();
		return Empty.INSTANCE;
	}
	@Override
	public String toString() {
		return "ForEach";
	}
}
