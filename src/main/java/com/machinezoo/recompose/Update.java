// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.stagean.*;

/**
 * Deferred mutation of composition state.
 * Updates are created by {@link Mut#update(java.util.function.UnaryOperator)} and similar methods and handed to {@link Updater}.
 * Every update is applied at most once. Repeated calls to {@link #apply()} have no effect.
 */
@StubDocs
public final class Update {
	private Runnable action;
	Update(Runnable action) {
		Objects.requireNonNull(action);
		this.action = action;
	}
	public void apply() {
		Runnable action;
		synchronized (this) {
			action = this.action;
			this.action = null;
		}
		if (action != null)
			action.run();
	}
	public synchronized boolean applied() {
		return action == null;
	}
	@Override
	public String toString() {
		return applied() ? "Update (applied)" : "Update (pending)";
	}
}
