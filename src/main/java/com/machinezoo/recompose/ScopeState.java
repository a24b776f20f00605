// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.recompose.util.*;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Persistent state of one node position. It outlives the composables that pass through the position
 * as long as they keep the same structural id.
 *
 * Scopes live in the runtime's arena and reference their parent and children by arena key.
 * Teardown walks the arena, so there is no owning pointer from parent to child that would have to be kept in sync with hooks.
 *
 * Everything here is touched only by the composing thread except the changed flag,
 * which is written by updates that may be applied by the host on another thread under the write guard.
 */
final class ScopeState {
	private static final Logger logger = LoggerFactory.getLogger(ScopeState.class);
	enum HookKind {
		REF, MUT, PROVIDER, MEMO, DROP, CALLBACK, LOCAL_TASK, TASK
	}
	private static class Slot {
		final HookKind kind;
		final Object value;
		Slot(HookKind kind, Object value) {
			this.kind = kind;
			this.value = value;
		}
	}
	private final Runtime runtime;
	Runtime runtime() {
		return runtime;
	}
	private final int key;
	int key() {
		return key;
	}
	/*
	 * Zero for the root scope. Arena keys start at 1.
	 */
	private final int parent;
	int parent() {
		return parent;
	}
	private final IntList children = new IntArrayList();
	IntList children() {
		return children;
	}
	ScopeState(Runtime runtime, int key, int parent) {
		this.runtime = runtime;
		this.key = key;
		this.parent = parent;
		OwnerTrace.of(this)
			.alias("scope")
			.tag("key", key);
	}
	private String label = "?";
	String label() {
		return label;
	}
	void label(String label) {
		this.label = label;
		OwnerTrace.of(this).tag("composable", label);
	}
	/*
	 * Hook slots are appended during the first pass and only read afterwards.
	 * The slot list is sealed after the first successful compose. From then on, the sequence of hook kinds must repeat exactly.
	 */
	private final List<Slot> slots = new ArrayList<>();
	private int cursor;
	private boolean sealed;
	void rewind() {
		cursor = 0;
	}
	@SuppressWarnings("unchecked")
	<T> T slot(HookKind kind, Supplier<T> initializer) {
		int index = cursor++;
		if (index < slots.size()) {
			Slot slot = slots.get(index);
			if (slot.kind != kind)
				throw new HookOrderException("Hook #" + index + " in " + label + " was " + slot.kind + " on the first pass, but now it is " + kind + ".");
			return (T)slot.value;
		}
		if (sealed)
			throw new HookOrderException("Hook #" + index + " (" + kind + ") in " + label + " was not called on the first pass.");
		T value = initializer.get();
		slots.add(new Slot(kind, value));
		return value;
	}
	void seal() {
		if (sealed && cursor != slots.size())
			throw new HookOrderException(label + " called " + cursor + " hooks, but it called " + slots.size() + " hooks on the first pass.");
		sealed = true;
	}
	int hooks() {
		return slots.size();
	}
	private volatile boolean changed;
	void setChanged() {
		changed = true;
	}
	boolean takeChanged() {
		boolean result = changed;
		changed = false;
		return result;
	}
	private boolean parentChanged;
	boolean parentChanged() {
		return parentChanged;
	}
	void parentChanged(boolean parentChanged) {
		this.parentChanged = parentChanged;
	}
	private boolean container;
	boolean container() {
		return container;
	}
	void markContainer() {
		container = true;
	}
	private boolean empty;
	boolean empty() {
		return empty;
	}
	void markEmpty() {
		empty = true;
	}
	/*
	 * Contexts visible to this scope come from two maps: those inherited from ancestors and those this scope provides itself.
	 * Inherited map is immutable and often shared by siblings. Provided map is private and created lazily.
	 */
	private Map<Class<?>, Object> inherited = Collections.emptyMap();
	private Map<Class<?>, Object> provided;
	void inherit(ScopeState parent) {
		inherited = parent.childContexts();
	}
	private Map<Class<?>, Object> childContexts() {
		if (provided == null || provided.isEmpty())
			return inherited;
		Map<Class<?>, Object> merged = new HashMap<>(inherited);
		merged.putAll(provided);
		return Collections.unmodifiableMap(merged);
	}
	void provide(Class<?> type, Object value) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(value);
		if (provided == null)
			provided = new HashMap<>();
		provided.put(type, value);
	}
	<T> T context(Class<T> type) {
		Object value = null;
		if (provided != null)
			value = provided.get(type);
		if (value == null)
			value = inherited.get(type);
		return type.cast(value);
	}
	/*
	 * Drop callbacks are slot values too. Only the order of registration is kept here.
	 */
	static class DropSlot {
		Runnable callback;
		private boolean done;
		DropSlot(Runnable callback) {
			this.callback = callback;
		}
		void run() {
			if (!done) {
				done = true;
				ExceptionLogging.log(logger).run(callback);
			}
		}
	}
	private List<DropSlot> drops;
	void register(DropSlot drop) {
		if (drops == null)
			drops = new ArrayList<>();
		drops.add(drop);
	}
	private boolean torndown;
	boolean torndown() {
		return torndown;
	}
	/*
	 * Own drop callbacks run first in registration order, then children are torn down in the order they were mounted.
	 */
	void teardown() {
		if (torndown)
			return;
		torndown = true;
		if (drops != null)
			for (DropSlot drop : drops)
				drop.run();
		for (int child : children.toIntArray()) {
			ScopeState state = runtime.scope(child);
			if (state != null)
				state.teardown();
		}
		runtime.release(this);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
