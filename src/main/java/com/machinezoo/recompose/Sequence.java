// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;

/*
 * Arity is part of the structural id. Sequences of different length never exchange in place.
 * Element types are not part of the id. Mismatched elements are rebuilt individually by their slots.
 */
final class Sequence implements Composable {
	private final List<Composable> parts;
	Sequence(List<Composable> parts) {
		this.parts = parts;
	}
	@Override
	public StructuralId structuralId() {
		return StructuralId.of(Sequence.class, parts.size());
	}
	@Override
	public Composable compose(Scope scope) {
		scope.markContainer();
		ChildSlot[] slots = scope.useRef(() -> {
			ChildSlot[] created = new ChildSlot[parts.size()];
			for (int i = 0; i < created.length; ++i)
				created[i] = scope.child();
			return created;
		});
		boolean changed = scope.isParentChanged();
		for (int i = 0; i < slots.length; ++i) {
			slots[i].mount(parts.get(i));
			slots[i].drive(changed);
		}
		return Empty.INSTANCE;
	}
	@Override
	public String toString() {
		return "Sequence" + parts;
	}
}
