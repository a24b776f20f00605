// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import com.machinezoo.stagean.*;

/**
 * Terminal composable without children.
 * Returning {@code null} from {@link Composable#compose(Scope)} has the same effect.
 *
 * @see Composables#empty()
 */
@StubDocs
public final class Empty implements Composable {
	static final Empty INSTANCE = new Empty();
	private Empty() {
	}
	@Override
	public Composable compose(Scope scope) {
		scope.state().markEmpty();
		return this;
	}
	@Override
	public String toString() {
		return "Empty";
	}
}
