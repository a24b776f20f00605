// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.recompose.ScopeState.*;
import com.machinezoo.stagean.*;

/*
 * Scope is the only transient reference handed to a composable.
 * It is created for a single call to compose() and invalidated as soon as compose() returns.
 * Code that captures it into hook storage or into a task fails loudly instead of writing into state of some later pass.
 *
 * Persistent state lives in ScopeState. Hook handles returned from here (Mut, Callback, context values) are long-lived and safe to capture.
 */
/**
 * Pass-scoped access to hooks and contexts of one node.
 * Instances are valid only during the call to {@link Composable#compose(Scope)} that received them.
 */
@DraftDocs("hook rules")
public final class Scope {
	private final ScopeState state;
	private boolean valid = true;
	Scope(ScopeState state) {
		this.state = state;
	}
	ScopeState state() {
		if (!valid)
			throw new IllegalStateException("Scope was used after compose() returned.");
		return state;
	}
	void invalidate() {
		valid = false;
	}
	public boolean valid() {
		return valid;
	}
	public Runtime runtime() {
		return state().runtime();
	}
	/**
	 * Returns value that persists for the lifetime of the node.
	 * The value is created by {@code initializer} on the first pass and returned unchanged on later passes.
	 *
	 * @param <T>
	 *            type of the stored value
	 * @param initializer
	 *            supplier of the initial value
	 * @return stored value
	 */
	public <T> T useRef(Supplier<T> initializer) {
		Objects.requireNonNull(initializer);
		return state().slot(HookKind.REF, initializer);
	}
	/**
	 * Returns handle to mutable state that triggers recomposition of this node when changed.
	 *
	 * @param <T>
	 *            type of the stored value
	 * @param initializer
	 *            supplier of the initial value
	 * @return mutable state handle with stable identity
	 */
	public <T> Mut<T> useMut(Supplier<T> initializer) {
		Objects.requireNonNull(initializer);
		ScopeState state = state();
		return state.slot(HookKind.MUT, () -> new Mut<>(state, initializer.get()));
	}
	/*
	 * Context reads are not hooks. They do not occupy a slot and they may be conditional.
	 */
	public <T> Optional<T> useContext(Class<T> type) {
		Objects.requireNonNull(type);
		return Optional.ofNullable(state().context(type));
	}
	public <T> T requireContext(Class<T> type) {
		Objects.requireNonNull(type);
		T value = state().context(type);
		if (value == null)
			throw new ContextNotFoundException(type);
		return value;
	}
	/**
	 * Provides context value to all descendants of this node.
	 * The value is created once. Descendants see it under the given type until a nearer provider shadows it.
	 *
	 * @param <T>
	 *            type of the context value
	 * @param type
	 *            context key
	 * @param initializer
	 *            supplier of the value, called on the first pass only
	 * @return provided value
	 */
	public <T> T useProvider(Class<T> type, Supplier<T> initializer) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(initializer);
		ScopeState state = state();
		T value = state.slot(HookKind.PROVIDER, () -> type.cast(Objects.requireNonNull(initializer.get())));
		state.provide(type, value);
		return value;
	}
	private static class MemoSlot {
		Object dependency;
		Object value;
	}
	/**
	 * Returns cached value that is recomputed only when {@code dependency} changes.
	 *
	 * @param <T>
	 *            type of the memoized value
	 * @param dependency
	 *            value compared with {@link Objects#equals(Object, Object)} to the one from the last computation
	 * @param supplier
	 *            computation of the value
	 * @return memoized value
	 */
	@SuppressWarnings("unchecked")
	public <T> T useMemo(Object dependency, Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		boolean[] fresh = new boolean[1];
		MemoSlot slot = state().slot(HookKind.MEMO, () -> {
			fresh[0] = true;
			return new MemoSlot();
		});
		if (fresh[0] || !Objects.equals(slot.dependency, dependency)) {
			slot.value = supplier.get();
			slot.dependency = dependency;
		}
		return (T)slot.value;
	}
	/**
	 * Registers callback that runs once when this node is torn down.
	 * The callback passed on the most recent pass is the one that runs.
	 *
	 * @param callback
	 *            teardown action
	 */
	public void useDrop(Runnable callback) {
		Objects.requireNonNull(callback);
		ScopeState state = state();
		DropSlot slot = state.slot(HookKind.DROP, () -> {
			DropSlot created = new DropSlot(callback);
			state.register(created);
			return created;
		});
		slot.callback = callback;
	}
	public <T, R> Callback<T, R> useCallback(Function<T, R> function) {
		Objects.requireNonNull(function);
		Callback<T, R> callback = state().slot(HookKind.CALLBACK, () -> new Callback<>(function));
		callback.delegate(function);
		return callback;
	}
	/**
	 * Starts local task that is polled on the composing thread before every pass in which it is ready.
	 * The task is created on the first pass and removed when it completes or when this node is torn down.
	 *
	 * @param factory
	 *            supplier of the task, called on the first pass only
	 */
	public void useLocalTask(Supplier<LocalTask> factory) {
		Objects.requireNonNull(factory);
		ScopeState state = state();
		state.slot(HookKind.LOCAL_TASK, () -> {
			Runtime runtime = state.runtime();
			int key = runtime.register(factory.get());
			state.register(new DropSlot(() -> runtime.cancel(key)));
			return key;
		});
	}
	/**
	 * Spawns task on runtime's executor once for the lifetime of this node.
	 * The task runs with the runtime entered. It is cancelled when this node is torn down.
	 *
	 * @param factory
	 *            supplier of the task, called on the first pass only
	 * @return future of the task
	 */
	public Future<?> useTask(Supplier<Runnable> factory) {
		Objects.requireNonNull(factory);
		ScopeState state = state();
		return state.slot(HookKind.TASK, () -> {
			Future<?> future = state.runtime().spawn(factory.get());
			state.register(new DropSlot(() -> future.cancel(false)));
			return future;
		});
	}
	public void setChanged() {
		state().setChanged();
	}
	public boolean isParentChanged() {
		return state().parentChanged();
	}
	/*
	 * Containers keep their element slots in hooks. Slots are parented under this node's scope.
	 */
	ChildSlot child() {
		return new ChildSlot(state());
	}
	void markContainer() {
		state().markContainer();
	}
	@Override
	public String toString() {
		return valid ? "Scope of " + state : "Scope (invalid)";
	}
}
