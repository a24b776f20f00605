// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import static org.awaitility.Awaitility.*;
import org.awaitility.pollinterval.*;
import org.junit.jupiter.api.*;
import com.machinezoo.noexception.*;

public abstract class TestBase {
	@BeforeAll
	public static void awaitility() {
		setDefaultPollInterval(new FibonacciPollInterval());
	}
	public static void sleep(int millis) {
		Exceptions.sneak().run(() -> Thread.sleep(millis));
	}
	/*
	 * Runs given number of passes.
	 */
	public static void passes(Composer composer, int count) {
		for (int i = 0; i < count; ++i)
			composer.compose();
	}
}
