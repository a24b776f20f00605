// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import org.slf4j.*;
import io.micrometer.core.instrument.*;

/*
 * Node erases the type of its composable. Everything the tree walk needs is available through the Composable interface
 * and the structural id computed when the composable was mounted.
 *
 * Decision whether to run compose() is local to the node. Skipped nodes still pass the walk down to their child,
 * because some descendant may have been changed by its own state even though nothing above it changed.
 */
final class ComposeNode {
	private static final Logger logger = LoggerFactory.getLogger(ComposeNode.class);
	private static final Counter recompositions = Metrics.counter("recompose.composer.recompositions");
	private Composable value;
	Composable value() {
		return value;
	}
	private final StructuralId id;
	StructuralId id() {
		return id;
	}
	private final ScopeState state;
	ScopeState state() {
		return state;
	}
	private final ChildSlot child;
	ComposeNode(ScopeState state, Composable value, StructuralId id) {
		this.state = state;
		this.value = value;
		this.id = id;
		child = new ChildSlot(state);
		state.label(id.toString());
	}
	/*
	 * Exchanges the composable in place. Hooks and descendants are kept.
	 */
	void reborrow(Composable value) {
		Objects.requireNonNull(value);
		StructuralId incoming = value.structuralId();
		if (!id.equals(incoming))
			throw new IllegalArgumentException("Cannot replace " + id + " with " + incoming + " in place.");
		this.value = value;
	}
	void drive() {
		if (state.empty())
			return;
		state.rewind();
		boolean changed = state.takeChanged();
		if (!child.mounted() || changed || state.parentChanged() || state.container()) {
			Composable result = compose();
			/*
			 * Empty marks its own scope during compose(). Empty node has no child and the walk ends here.
			 */
			if (state.empty())
				return;
			child.mount(result);
			child.drive(true);
		} else
			child.drive(false);
	}
	private Composable compose() {
		logger.trace("Recomposing {}.", state);
		recompositions.increment();
		Scope scope = new Scope(state);
		Composable result;
		try {
			result = value.compose(scope);
		} finally {
			scope.invalidate();
		}
		state.seal();
		return result != null ? result : Empty.INSTANCE;
	}
	@Override
	public String toString() {
		return state.toString();
	}
}
