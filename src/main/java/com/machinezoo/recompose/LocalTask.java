// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import com.machinezoo.stagean.*;

/*
 * Local tasks are polled on the composing thread, so they can touch anything the composables can touch.
 * They must not block. Work that blocks belongs in Scope.useTask() or in any executor that wakes the local task when done.
 */
/**
 * Cooperative task polled by {@link Composer} before each pass.
 *
 * @see Scope#useLocalTask(java.util.function.Supplier)
 */
@StubDocs
@FunctionalInterface
public interface LocalTask {
	/**
	 * Makes progress on the task.
	 * If the task cannot complete now, it should keep the {@code waker} and call it when it is ready to make more progress.
	 *
	 * @param waker
	 *            signal that schedules another poll of this task
	 * @return {@code true} if the task is complete and should be removed, {@code false} otherwise
	 */
	boolean poll(Waker waker);
}
