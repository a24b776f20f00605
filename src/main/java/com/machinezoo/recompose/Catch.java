// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Catch is not a container. It only provides the handler and returns its content as its child.
 * Handler object keeps its identity across passes, so descendants need not be recomposed when the handler lambda changes.
 */
/**
 * Composable that handles errors reported by {@link Fallible} descendants.
 *
 * @see Composables#handle(Consumer, Composable)
 */
@StubDocs
public final class Catch implements Composable {
	private final Consumer<Throwable> handler;
	private final Composable content;
	Catch(Consumer<Throwable> handler, Composable content) {
		Objects.requireNonNull(handler);
		this.handler = handler;
		this.content = content;
	}
	@Override
	public Composable compose(Scope scope) {
		CatchContext context = scope.useProvider(CatchContext.class, () -> new CatchContext(handler));
		context.handler(handler);
		return content;
	}
	@Override
	public String toString() {
		return "Catch";
	}
}
