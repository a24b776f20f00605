// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Java erases generic type arguments, so class alone cannot tell two sequences of different arity apart.
 * Structural id is therefore the class plus an optional shape that combinators fill with whatever makes their node layout unique.
 */
/**
 * Structural identity of a {@link Composable}.
 * Two composables with equal structural ids can replace each other in place without resetting hooks.
 */
@StubDocs
public final class StructuralId {
	private final Class<?> type;
	private final List<Object> shape;
	private StructuralId(Class<?> type, List<Object> shape) {
		this.type = type;
		this.shape = shape;
	}
	public static StructuralId of(Class<?> type) {
		Objects.requireNonNull(type);
		return new StructuralId(type, Collections.emptyList());
	}
	public static StructuralId of(Class<?> type, Object... shape) {
		Objects.requireNonNull(type);
		return new StructuralId(type, List.of(shape));
	}
	public Class<?> type() {
		return type;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof StructuralId))
			return false;
		StructuralId other = (StructuralId)obj;
		return type == other.type && shape.equals(other.shape);
	}
	@Override
	public int hashCode() {
		return Objects.hash(type, shape);
	}
	@Override
	public String toString() {
		return shape.isEmpty() ? type.getSimpleName() : type.getSimpleName() + shape;
	}
}
