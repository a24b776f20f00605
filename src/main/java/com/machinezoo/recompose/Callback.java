// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Function with stable identity whose implementation follows the latest pass.
 * Consumers can compare callbacks by identity, because {@link Scope#useCallback(Function)} returns the same instance on every pass.
 *
 * @param <T>
 *            input type
 * @param <R>
 *            output type
 */
@StubDocs
public final class Callback<T, R> implements Function<T, R> {
	private volatile Function<T, R> delegate;
	Callback(Function<T, R> delegate) {
		this.delegate = delegate;
	}
	void delegate(Function<T, R> delegate) {
		Objects.requireNonNull(delegate);
		this.delegate = delegate;
	}
	@Override
	public R apply(T input) {
		return delegate.apply(input);
	}
	@Override
	public String toString() {
		return "Callback";
	}
}
