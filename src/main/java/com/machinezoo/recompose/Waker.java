// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import com.machinezoo.stagean.*;

/**
 * Readiness signal for {@link LocalTask}.
 * Waking is safe from any thread. The task is polled once during the next {@link Composer#compose()}.
 */
@StubDocs
@FunctionalInterface
public interface Waker {
	void wake();
}
