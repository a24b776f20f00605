// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import com.machinezoo.stagean.*;

/*
 * Composables are plain objects. Their fields are the input of the node, hooks on the scope are its persistent state.
 * Lambdas work as composables too. Every lambda expression has its own class and thus its own structural id.
 */
/**
 * Unit of behavior in the composition tree.
 * When the node holding this composable is recomposed, {@link #compose(Scope)} is called and its result becomes the node's only child.
 * <p>
 * The supplied {@link Scope} is valid only until {@link #compose(Scope)} returns.
 * Hooks must be called in the same order and the same number of times on every pass.
 *
 * @see Composer
 * @see Composables
 */
@DraftDocs("hook rules, examples")
@FunctionalInterface
public interface Composable {
	/**
	 * Computes the child of this composable.
	 *
	 * @param scope
	 *            pass-scoped handle to hooks and contexts of the node
	 * @return child composable or {@code null} if there is no child
	 */
	Composable compose(Scope scope);
	/**
	 * Returns structural id of this composable.
	 * Nodes are updated in place only when the new composable has the same structural id as the mounted one.
	 * Otherwise the old subtree is torn down and the new composable is mounted fresh.
	 * Default implementation derives the id from the class.
	 *
	 * @return structural id of this composable
	 */
	default StructuralId structuralId() {
		return StructuralId.of(getClass());
	}
}
