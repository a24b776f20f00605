// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Mutations are never applied synchronously. They travel through the runtime's updater
 * and they are applied before the next pass, so that a drive in progress never observes a half-applied change.
 *
 * The handle is long-lived. It can be captured by tasks and callbacks and used from any thread.
 */
/**
 * Mutable hook state created by {@link Scope#useMut(Supplier)}.
 *
 * @param <T>
 *            type of the stored value
 */
@StubDocs
public final class Mut<T> implements Supplier<T> {
	private final ScopeState owner;
	private volatile T value;
	/*
	 * Incremented by every applied update() or set(), but not by with().
	 * It is a cheap memo dependency that changes exactly when dependents should recompose.
	 */
	private volatile long version;
	Mut(ScopeState owner, T value) {
		this.owner = owner;
		this.value = value;
	}
	@Override
	public T get() {
		return value;
	}
	public long version() {
		return version;
	}
	/**
	 * Queues mutation of the stored value and marks the owning node changed when the mutation is applied.
	 *
	 * @param mutation
	 *            function computing the new value from the current one
	 */
	public void update(UnaryOperator<T> mutation) {
		Objects.requireNonNull(mutation);
		owner.runtime().update(() -> {
			value = mutation.apply(value);
			++version;
			owner.setChanged();
		});
	}
	public void set(T value) {
		update(v -> value);
	}
	/**
	 * Queues mutation of the stored value without marking the owning node changed.
	 * The node will see the new value next time it recomposes for another reason.
	 *
	 * @param mutation
	 *            function computing the new value from the current one
	 */
	public void with(UnaryOperator<T> mutation) {
		Objects.requireNonNull(mutation);
		owner.runtime().update(() -> value = mutation.apply(value));
	}
	@Override
	public String toString() {
		return "Mut " + version + ": " + value;
	}
}
