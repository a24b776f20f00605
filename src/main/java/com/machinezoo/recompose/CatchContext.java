// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Error handler provided as context by {@link Catch}.
 * {@link Fallible} reports its failures to the nearest instance of this context.
 * Composer provides one at the root that turns uncaught errors into {@link CompositionException}.
 */
@StubDocs
public final class CatchContext {
	private volatile Consumer<Throwable> handler;
	CatchContext(Consumer<Throwable> handler) {
		Objects.requireNonNull(handler);
		this.handler = handler;
	}
	void handler(Consumer<Throwable> handler) {
		Objects.requireNonNull(handler);
		this.handler = handler;
	}
	public void report(Throwable error) {
		Objects.requireNonNull(error);
		handler.accept(error);
	}
}
