// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;

/*
 * Dynamic composable hides the type of its content from the parent. Parent always sees the same structural id
 * while the slot below decides between in-place exchange and rebuild by the id of the actual content.
 */
final class DynamicCompose implements Composable {
	private final Composable content;
	DynamicCompose(Composable content) {
		Objects.requireNonNull(content);
		this.content = content;
	}
	@Override
	public Composable compose(Scope scope) {
		scope.markContainer();
		ChildSlot slot = scope.useRef(scope::child);
		slot.mount(content);
		slot.drive(scope.isParentChanged());
		return Empty.INSTANCE;
	}
	@Override
	public String toString() {
		return "Dynamic[" + content + "]";
	}
}
