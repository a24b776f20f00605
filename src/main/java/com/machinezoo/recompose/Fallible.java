// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.stagean.*;

/*
 * Fallible holds either content or an error. Both have the same structural id,
 * so switching between success and failure keeps the fallible node and only mounts or tears down its child.
 */
/**
 * Composable that either shows its content or reports an error to the nearest {@link Catch}.
 */
@StubDocs
public final class Fallible implements Composable {
	private final Composable content;
	private final Throwable error;
	private Fallible(Composable content, Throwable error) {
		this.content = content;
		this.error = error;
	}
	public static Fallible ok(Composable content) {
		return new Fallible(content, null);
	}
	public static Fallible error(Throwable error) {
		Objects.requireNonNull(error);
		return new Fallible(null, error);
	}
	/*
	 * Checked exceptions are reported as they are. They are not wrapped.
	 * Errors are not failures of the composable and they propagate.
	 */
	public static Fallible of(Callable<? extends Composable> supplier) {
		Objects.requireNonNull(supplier);
		try {
			return ok(supplier.call());
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			return error(ex);
		} catch (Exception ex) {
			return error(ex);
		}
	}
	public boolean failed() {
		return error != null;
	}
	public Optional<Throwable> failure() {
		return Optional.ofNullable(error);
	}
	@Override
	public Composable compose(Scope scope) {
		scope.markContainer();
		ChildSlot slot = scope.useRef(scope::child);
		if (error == null) {
			slot.mount(content);
			slot.drive(scope.isParentChanged());
		} else {
			/*
			 * Failed subtree is dropped, so that the next successful pass rebuilds it from scratch.
			 */
			slot.clear();
			Optional<CatchContext> handler = scope.useContext(CatchContext.class);
			if (handler.isPresent())
				handler.get().report(error);
			else
				throw new CompositionException(List.of(error));
		}
		return Empty.INSTANCE;
	}
	@Override
	public String toString() {
		return error == null ? "Fallible: " + content : "Fallible: " + error;
	}
}
