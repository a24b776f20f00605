// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;

/*
 * Memo blocks propagation of parent changes. Content is forced to recompose only when the key changes.
 * Content is still exchanged in place every pass, so that recomposition triggered by content's own state sees current fields.
 */
final class Memo implements Composable {
	private final Object key;
	private final Composable content;
	Memo(Object key, Composable content) {
		this.key = key;
		this.content = content;
	}
	private static class Snapshot {
		boolean taken;
		Object key;
	}
	@Override
	public Composable compose(Scope scope) {
		scope.markContainer();
		Snapshot snapshot = scope.useRef(Snapshot::new);
		ChildSlot slot = scope.useRef(scope::child);
		boolean force = !snapshot.taken || !Objects.equals(snapshot.key, key);
		if (force) {
			snapshot.taken = true;
			snapshot.key = key;
		}
		slot.mount(content);
		slot.drive(force);
		return Empty.INSTANCE;
	}
	@Override
	public String toString() {
		return "Memo[" + key + "]";
	}
}
