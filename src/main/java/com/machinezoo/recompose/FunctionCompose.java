// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.function.*;

/*
 * Every lambda expression has its own class. Including it in the structural id keeps two different function composables apart.
 */
final class FunctionCompose implements Composable {
	private final Function<Scope, ? extends Composable> body;
	FunctionCompose(Function<Scope, ? extends Composable> body) {
		Objects.requireNonNull(body);
		this.body = body;
	}
	@Override
	public StructuralId structuralId() {
		return StructuralId.of(FunctionCompose.class, body.getClass());
	}
	@Override
	public Composable compose(Scope scope) {
		return body.apply(scope);
	}
	@Override
	public String toString() {
		return "Function";
	}
}
