// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * One pass can produce several uncaught errors in unrelated subtrees.
 * They are aggregated here. The first one becomes the cause, the rest are suppressed exceptions.
 */
/**
 * Thrown by {@link Composer#compose()} when a {@link Fallible} failure reaches the root without being caught by {@link Catch}.
 */
@StubDocs
public class CompositionException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final List<Throwable> errors;
	public List<Throwable> errors() {
		return errors;
	}
	public CompositionException(List<Throwable> errors) {
		super(message(errors), errors.isEmpty() ? null : errors.get(0));
		this.errors = List.copyOf(errors);
		for (int i = 1; i < this.errors.size(); ++i)
			addSuppressed(this.errors.get(i));
	}
	private static String message(List<Throwable> errors) {
		if (errors.size() == 1)
			return "Uncaught composition error: " + errors.get(0);
		return errors.size() + " uncaught composition errors, first: " + (errors.isEmpty() ? null : errors.get(0));
	}
}
