// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.concurrent.locks.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Runtime is shared by all nodes of one composer. It owns everything that must outlive individual passes:
 * scope arena, local task table, ready queue, update queue, and the guard that separates drives from updates.
 *
 * Only the ready queue and the update queue are touched from other threads.
 * Everything else is accessed by the composing thread, which holds the guard in shared mode while it drives the tree.
 *
 * Updates run under the write lock, so they never interleave with a drive or with local task polling.
 * Executor tasks do not hold the guard while they run. They may block or loop for the whole lifetime of their node.
 * Task code that needs a consistent view of several hook handles takes the read lock for each short unit of work via read().
 * A thread that already holds the read lock cannot acquire the write lock. ReentrantReadWriteLock would deadlock.
 * Updates applied from such a thread are put back into the update queue and they are applied at the start of the next pass.
 */
/**
 * Shared state of one composition tree.
 * Runtime of the currently running composition is available via {@link #current()}.
 */
@DraftApi
@StubDocs
public final class Runtime {
	private static final Logger logger = LoggerFactory.getLogger(Runtime.class);
	private static final ThreadLocal<Runtime> current = new ThreadLocal<>();
	/**
	 * Returns runtime entered on the current thread.
	 *
	 * @return current runtime or {@code null} if there is none
	 */
	public static Runtime current() {
		return current.get();
	}
	/*
	 * Runtimes nest on a single stack. Every enter() remembers the outer runtime and restores it on close.
	 */
	public CloseableScope enter() {
		Runtime outer = current.get();
		current.set(this);
		return () -> {
			if (outer != null)
				current.set(outer);
			else
				current.remove();
		};
	}
	Runtime() {
		OwnerTrace.of(this).alias("runtime");
	}
	private final ReentrantReadWriteLock guard = new ReentrantReadWriteLock();
	/**
	 * Acquires the guard in shared mode. Queued updates are not applied until the returned scope is closed.
	 * The drive and local task polling hold it implicitly. Executor tasks may take it around short units of work.
	 *
	 * @return scope that releases the guard when closed
	 */
	public CloseableScope read() {
		Lock lock = guard.readLock();
		lock.lock();
		return lock::unlock;
	}
	/*
	 * Default updater queues updates for the next pass.
	 */
	private final Queue<Update> updates = new ConcurrentLinkedQueue<>();
	private volatile Updater updater = updates::add;
	Updater updater() {
		return updater;
	}
	void updater(Updater updater) {
		Objects.requireNonNull(updater);
		this.updater = updater;
	}
	/*
	 * Default executor for useTask(). Tasks commonly block on I/O or timers, so the pool grows on demand
	 * instead of being sized to core count. Threads are daemons, so that forgotten tasks do not keep the process alive.
	 */
	private static final AtomicInteger threadCounter = new AtomicInteger();
	private static final ExecutorService common = ExecutorServiceMetrics.monitor(Metrics.globalRegistry, Executors.newCachedThreadPool(runnable -> {
		Thread thread = new Thread(runnable);
		thread.setDaemon(true);
		thread.setName("recompose-task-" + threadCounter.incrementAndGet());
		return thread;
	}), "recompose.tasks");
	static Executor common() {
		return common;
	}
	private volatile Executor executor = common;
	Executor executor() {
		return executor;
	}
	void executor(Executor executor) {
		Objects.requireNonNull(executor);
		this.executor = executor;
	}
	/**
	 * Schedules action to run under the write guard before or during the next pass.
	 *
	 * @param action
	 *            mutation of composition state
	 */
	public void update(Runnable action) {
		Objects.requireNonNull(action);
		updater.update(new Update(() -> write(action)));
	}
	private void write(Runnable action) {
		if (guard.getReadHoldCount() > 0) {
			updates.add(new Update(() -> write(action)));
			return;
		}
		Lock lock = guard.writeLock();
		lock.lock();
		try {
			action.run();
		} finally {
			lock.unlock();
		}
	}
	/*
	 * Drains the update queue. Updates queued while draining, including the ones put back by write(), wait for the next pass.
	 */
	void applyUpdates() {
		int count = updates.size();
		for (int i = 0; i < count; ++i) {
			Update update = updates.poll();
			if (update == null)
				break;
			update.apply();
		}
	}
	/**
	 * Checks whether there is any work waiting for the next pass.
	 *
	 * @return {@code true} if some local task is ready or some update is queued
	 */
	public boolean pending() {
		return !ready.isEmpty() || !updates.isEmpty();
	}
	/*
	 * Scope arena. Keys start at 1, so that 0 can stand for "no parent".
	 */
	private final Int2ObjectMap<ScopeState> scopes = new Int2ObjectOpenHashMap<>();
	private int nextScope = 1;
	ScopeState allocate(ScopeState parent) {
		int key = nextScope++;
		ScopeState state = new ScopeState(this, key, parent != null ? parent.key() : 0);
		OwnerTrace.of(state).parent(parent != null ? parent : this);
		scopes.put(key, state);
		if (parent != null)
			parent.children().add(key);
		return state;
	}
	ScopeState scope(int key) {
		return scopes.get(key);
	}
	void release(ScopeState state) {
		scopes.remove(state.key());
		ScopeState parent = scopes.get(state.parent());
		if (parent != null)
			parent.children().rem(state.key());
	}
	int scopeCount() {
		return scopes.size();
	}
	/*
	 * Local tasks are polled on the composing thread. Wakers only put the task key into the ready queue.
	 */
	private final Int2ObjectMap<LocalTask> tasks = new Int2ObjectOpenHashMap<>();
	private final Queue<Integer> ready = new ConcurrentLinkedQueue<>();
	private int nextTask = 1;
	int register(LocalTask task) {
		Objects.requireNonNull(task);
		int key = nextTask++;
		tasks.put(key, task);
		ready.add(key);
		return key;
	}
	void cancel(int key) {
		tasks.remove(key);
	}
	int taskCount() {
		return tasks.size();
	}
	private Waker waker(int key) {
		return () -> {
			ready.add(key);
			/*
			 * Empty update tells the host that a pass is needed. Default updater just queues it.
			 */
			ExceptionLogging.log(logger).run(() -> updater.update(new Update(() -> {
			})));
		};
	}
	/*
	 * Every task that is ready at the start of the pass is polled once. Tasks woken during polling wait for the next pass.
	 * Failing task is logged and removed like a completed one. It does not prevent polling of the other ready tasks.
	 */
	void pollReady() {
		IntSet keys = new IntLinkedOpenHashSet();
		for (Integer key = ready.poll(); key != null; key = ready.poll())
			keys.add(key.intValue());
		for (int key : keys) {
			LocalTask task = tasks.get(key);
			if (task == null)
				continue;
			boolean done;
			try {
				done = task.poll(waker(key));
			} catch (RuntimeException ex) {
				ExceptionLogging.log(logger).handle(ex);
				done = true;
			}
			if (done) {
				tasks.remove(key);
				logger.trace("Local task {} completed.", key);
			}
		}
	}
	/*
	 * Executor tasks run with the runtime entered, but without the guard.
	 * Their updates only go through the updater, so a task that blocks never stalls the next pass.
	 */
	Future<?> spawn(Runnable runnable) {
		Objects.requireNonNull(runnable);
		FutureTask<Void> future = new FutureTask<>(() -> {
			try (CloseableScope entered = enter()) {
				ExceptionLogging.log(logger).run(runnable);
			}
		}, null);
		executor.execute(future);
		return future;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
