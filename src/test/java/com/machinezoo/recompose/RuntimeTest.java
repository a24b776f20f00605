// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import static org.awaitility.Awaitility.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.closeablescope.*;

public class RuntimeTest extends TestBase {
	@Test
	public void enter() {
		Runtime outer = new Runtime();
		Runtime inner = new Runtime();
		assertNull(Runtime.current());
		try (CloseableScope o = outer.enter()) {
			assertSame(outer, Runtime.current());
			try (CloseableScope i = inner.enter()) {
				assertSame(inner, Runtime.current());
			}
			assertSame(outer, Runtime.current());
		}
		assertNull(Runtime.current());
	}
	@Test
	public void current() {
		List<Runtime> seen = new ArrayList<>();
		Composer composer = new Composer(scope -> {
			seen.add(Runtime.current());
			seen.add(scope.runtime());
			return null;
		});
		composer.compose();
		assertEquals(List.of(composer.runtime(), composer.runtime()), seen);
		assertNull(Runtime.current());
	}
	@Test
	public void applyOnce() {
		Runtime runtime = new Runtime();
		int[] count = new int[1];
		runtime.update(() -> ++count[0]);
		assertTrue(runtime.pending());
		runtime.applyUpdates();
		runtime.applyUpdates();
		assertEquals(1, count[0]);
		assertFalse(runtime.pending());
	}
	@Test
	public void deferredDuringPass() {
		/*
		 * Synchronous updater would need the write lock while the drive holds the read lock.
		 * Such updates are deferred to the start of the next pass.
		 */
		List<Integer> seen = new ArrayList<>();
		Composer composer = new Composer(scope -> {
			Mut<Integer> value = scope.useMut(() -> 0);
			seen.add(value.get());
			if (value.get() < 3)
				value.update(v -> v + 1);
			return null;
		}).updater(Update::apply);
		composer.compose();
		assertTrue(composer.pending());
		TestBase.passes(composer, 5);
		assertEquals(List.of(0, 1, 2, 3), seen);
		assertFalse(composer.pending());
	}
	@Test
	public void arena() {
		Runtime runtime = new Runtime();
		ScopeState root = runtime.allocate(null);
		ScopeState child = runtime.allocate(root);
		ScopeState grandchild = runtime.allocate(child);
		assertEquals(3, runtime.scopeCount());
		assertEquals(root.key(), child.parent());
		assertEquals(List.of(child.key()), new ArrayList<>(root.children()));
		child.teardown();
		assertEquals(1, runtime.scopeCount());
		assertTrue(grandchild.torndown());
		assertTrue(root.children().isEmpty());
	}
	@Test
	public void defaultExecutor() {
		Composer composer = new Composer(Composables.empty());
		assertSame(Runtime.common(), composer.executor());
		List<Thread> threads = Collections.synchronizedList(new ArrayList<>());
		composer.executor().execute(() -> threads.add(Thread.currentThread()));
		await().until(() -> !threads.isEmpty());
		// Pool threads do not keep the process alive.
		assertTrue(threads.get(0).isDaemon());
		assertTrue(threads.get(0).getName().startsWith("recompose-task-"));
	}
}
