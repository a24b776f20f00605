// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

/*
 * Position for one child node. Used by every node for its compose() result and by containers for their elements.
 * The slot decides between in-place exchange and teardown followed by fresh mount.
 */
final class ChildSlot {
	private final ScopeState parent;
	private ComposeNode node;
	ChildSlot(ScopeState parent) {
		this.parent = parent;
	}
	boolean mounted() {
		return node != null;
	}
	ComposeNode node() {
		return node;
	}
	/*
	 * Contexts are refreshed on every mount, so that the child sees providers updated during the parent's compose().
	 */
	void mount(Composable value) {
		if (value == null)
			value = Empty.INSTANCE;
		StructuralId id = value.structuralId();
		if (node != null && node.id().equals(id))
			node.reborrow(value);
		else {
			clear();
			node = new ComposeNode(parent.runtime().allocate(parent), value, id);
		}
		node.state().inherit(parent);
	}
	void drive(boolean parentChanged) {
		if (node == null)
			return;
		node.state().parentChanged(parentChanged);
		node.drive();
	}
	void clear() {
		if (node != null) {
			ComposeNode dropped = node;
			node = null;
			dropped.state().teardown();
		}
	}
}
