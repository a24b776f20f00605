// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import static org.awaitility.Awaitility.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import org.junitpioneer.jupiter.*;
import com.machinezoo.noexception.*;

public class TasksTest extends TestBase {
	static class Loader implements Composable {
		final List<Integer> seen;
		final AtomicInteger polls;
		Loader(List<Integer> seen, AtomicInteger polls) {
			this.seen = seen;
			this.polls = polls;
		}
		@Override
		public Composable compose(Scope scope) {
			Mut<Integer> value = scope.useMut(() -> 0);
			scope.useLocalTask(() -> waker -> {
				polls.incrementAndGet();
				value.set(5);
				return true;
			});
			seen.add(value.get());
			return null;
		}
	}
	@Test
	public void localTaskUpdatesVisible() {
		List<Integer> seen = new ArrayList<>();
		AtomicInteger polls = new AtomicInteger();
		Composer composer = new Composer(new Loader(seen, polls));
		composer.compose();
		assertEquals(List.of(0), seen);
		// Newly registered task is ready for the next pass.
		assertTrue(composer.pending());
		composer.compose();
		// Update made by the task is applied before the node runs in the same pass.
		assertEquals(List.of(0, 5), seen);
		assertEquals(1, polls.get());
		assertEquals(0, composer.runtime().taskCount());
		assertFalse(composer.pending());
	}
	@Test
	public void waker() {
		AtomicReference<Waker> captured = new AtomicReference<>();
		AtomicInteger polls = new AtomicInteger();
		Composer composer = new Composer(scope -> {
			scope.useLocalTask(() -> waker -> {
				captured.set(waker);
				return polls.incrementAndGet() >= 2;
			});
			return null;
		});
		passes(composer, 3);
		// Task is polled only when it is ready.
		assertEquals(1, polls.get());
		assertFalse(composer.pending());
		captured.get().wake();
		assertTrue(composer.pending());
		composer.compose();
		assertEquals(2, polls.get());
		assertEquals(0, composer.runtime().taskCount());
	}
	@Test
	public void localTaskCancelled() {
		AtomicInteger polls = new AtomicInteger();
		AtomicReference<Waker> captured = new AtomicReference<>();
		AtomicReference<Mut<Boolean>> present = new AtomicReference<>();
		Composer composer = new Composer(new ComposablesTest.Host<>(true, present, p -> Composables.optional(p ? (Composable)scope -> {
			scope.useLocalTask(() -> waker -> {
				captured.set(waker);
				polls.incrementAndGet();
				return false;
			});
			return null;
		} : null)));
		passes(composer, 2);
		assertEquals(1, polls.get());
		assertEquals(1, composer.runtime().taskCount());
		present.get().set(false);
		composer.compose();
		// Task is removed together with its node.
		assertEquals(0, composer.runtime().taskCount());
		captured.get().wake();
		composer.compose();
		assertEquals(1, polls.get());
	}
	@RetryingTest(3)
	public void blockingTask() throws Exception {
		List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
		CountDownLatch release = new CountDownLatch(1);
		Composer composer = new Composer(scope -> {
			Mut<Integer> value = scope.useMut(() -> 0);
			scope.useTask(() -> () -> {
				value.set(1);
				Exceptions.sneak().run(() -> release.await(10, TimeUnit.SECONDS));
			});
			seen.add(value.get());
			return null;
		});
		try {
			composer.compose();
			await().until(composer::pending);
			// Task is still running, but its update is applied without waiting for it.
			assertTimeoutPreemptively(Duration.ofSeconds(2), composer::compose);
			assertEquals(List.of(0, 1), seen);
		} finally {
			release.countDown();
		}
	}
	@Test
	public void failingLocalTask() {
		AtomicInteger failures = new AtomicInteger();
		AtomicInteger polls = new AtomicInteger();
		Composer composer = new Composer(Composables.sequence(
			scope -> {
				scope.useLocalTask(() -> waker -> {
					failures.incrementAndGet();
					throw new IllegalStateException();
				});
				return null;
			},
			scope -> {
				scope.useLocalTask(() -> waker -> {
					polls.incrementAndGet();
					return false;
				});
				return null;
			}));
		composer.compose();
		assertEquals(2, composer.runtime().taskCount());
		// Failure is logged and the other ready task is still polled in the same pass.
		composer.compose();
		assertEquals(1, failures.get());
		assertEquals(1, polls.get());
		// Failed task is removed.
		assertEquals(1, composer.runtime().taskCount());
		composer.compose();
		assertEquals(1, failures.get());
	}
	@Test
	public void task() {
		List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
		AtomicReference<Runtime> runtime = new AtomicReference<>();
		Composer composer = new Composer(scope -> {
			Mut<Integer> value = scope.useMut(() -> 0);
			scope.useTask(() -> () -> {
				runtime.set(Runtime.current());
				value.set(42);
			});
			seen.add(value.get());
			return null;
		});
		composer.compose();
		await().until(composer::pending);
		composer.compose();
		assertEquals(List.of(0, 42), seen);
		// Task runs with the runtime of its composer entered.
		assertSame(composer.runtime(), runtime.get());
	}
	@Test
	public void taskCancelled() {
		List<Runnable> queue = new ArrayList<>();
		AtomicInteger runs = new AtomicInteger();
		AtomicReference<Future<?>> future = new AtomicReference<>();
		Composer composer = new Composer(scope -> {
			future.set(scope.useTask(() -> runs::incrementAndGet));
			return null;
		}).executor(queue::add);
		composer.compose();
		assertEquals(1, queue.size());
		composer.close();
		assertTrue(future.get().isCancelled());
		// Cancelled task does not run even when the executor gets to it.
		queue.get(0).run();
		assertEquals(0, runs.get());
	}
}
