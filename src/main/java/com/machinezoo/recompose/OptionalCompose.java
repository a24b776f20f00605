// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;

final class OptionalCompose implements Composable {
	private final Composable content;
	OptionalCompose(Composable content) {
		this.content = content;
	}
	@Override
	public Composable compose(Scope scope) {
		scope.markContainer();
		ChildSlot slot = scope.useRef(scope::child);
		if (content != null) {
			slot.mount(content);
			slot.drive(scope.isParentChanged());
		} else
			slot.clear();
		return Empty.INSTANCE;
	}
	@Override
	public String toString() {
		return "Optional[" + Objects.toString(content, "") + "]";
	}
}
