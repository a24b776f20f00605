// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.Span;
import io.opentracing.util.*;

/*
 * Composer does not loop on its own. The host calls compose() whenever it wants a pass,
 * typically after pending() starts returning true or after its custom updater received an update.
 * This keeps the composer usable from UI event loops, game loops, and tests alike.
 *
 * Composer is not thread-safe. All passes must be run by one thread at a time.
 * Other threads interact with the tree only through updates and wakers.
 */
/**
 * Driver of one composition tree.
 */
@StubDocs
@DraftApi("configuration after start, custom root contexts")
public class Composer implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(Composer.class);
	private static final Timer timer = Metrics.timer("recompose.composer.passes");
	private final Runtime runtime = new Runtime();
	public Runtime runtime() {
		return runtime;
	}
	private final ComposeNode root;
	/*
	 * Errors reported to the root handler during the current pass.
	 */
	private final List<Throwable> errors = new ArrayList<>();
	public Composer(Composable content) {
		Objects.requireNonNull(content);
		OwnerTrace.of(this).alias("composer");
		OwnerTrace.of(runtime).parent(this);
		ScopeState state = runtime.allocate(null);
		state.provide(CatchContext.class, new CatchContext(errors::add));
		root = new ComposeNode(state, content, content.structuralId());
	}
	private boolean started;
	private void ensureNotStarted() {
		if (started)
			throw new IllegalStateException();
	}
	public Composer updater(Updater updater) {
		Objects.requireNonNull(updater);
		ensureNotStarted();
		runtime.updater(updater);
		return this;
	}
	public Updater updater() {
		return runtime.updater();
	}
	/*
	 * Executor is used only by tasks spawned via Scope.useTask().
	 */
	public Composer executor(Executor executor) {
		Objects.requireNonNull(executor);
		ensureNotStarted();
		runtime.executor(executor);
		return this;
	}
	public Executor executor() {
		return runtime.executor();
	}
	private long passes;
	public long passes() {
		return passes;
	}
	public boolean pending() {
		return runtime.pending();
	}
	private boolean closed;
	public boolean closed() {
		return closed;
	}
	/**
	 * Runs one composition pass.
	 * Ready local tasks are polled, queued updates are applied, and the tree is walked from the root.
	 * Only nodes that changed or whose parent recomposed run their {@link Composable#compose(Scope)} method.
	 *
	 * @throws CompositionException
	 *             if some {@link Fallible} failure was not handled by any {@link Catch}
	 */
	public void compose() {
		if (closed)
			throw new IllegalStateException("Composer was already closed.");
		started = true;
		Timer.Sample sample = Timer.start();
		Span span = GlobalTracer.get().buildSpan("recompose.pass")
			.withTag("component", "recompose")
			.withTag("pass", passes)
			.start();
		OwnerTrace.of(this).fill(span);
		try (
			io.opentracing.Scope trace = GlobalTracer.get().activateSpan(span);
			CloseableScope entered = runtime.enter()) {
			try (CloseableScope locked = runtime.read()) {
				runtime.pollReady();
			}
			runtime.applyUpdates();
			errors.clear();
			try (CloseableScope locked = runtime.read()) {
				root.drive();
			}
			++passes;
			logger.debug("Completed pass {} of {}.", passes, this);
		} finally {
			span.finish();
			sample.stop(timer);
		}
		if (!errors.isEmpty()) {
			List<Throwable> uncaught = new ArrayList<>(errors);
			errors.clear();
			throw new CompositionException(uncaught);
		}
	}
	/**
	 * Tears down the whole tree. Drop callbacks of all nodes run and tasks are cancelled.
	 */
	@Override
	public void close() {
		if (closed)
			return;
		closed = true;
		try (CloseableScope entered = runtime.enter()) {
			root.state().teardown();
		}
		logger.debug("Closed {} after {} passes.", OwnerTrace.of(this), passes);
	}
	/*
	 * Tree dump lists one node per line, indented by depth. Empty nodes are left out.
	 */
	@Override
	public String toString() {
		if (closed)
			return "Composer (closed)";
		StringBuilder builder = new StringBuilder();
		dump(builder, root.state(), 0);
		return builder.toString();
	}
	private void dump(StringBuilder builder, ScopeState state, int depth) {
		if (state.empty())
			return;
		for (int i = 0; i < depth; ++i)
			builder.append("  ");
		builder.append(state.label()).append('\n');
		for (int child : state.children()) {
			ScopeState nested = runtime.scope(child);
			if (nested != null)
				dump(builder, nested, depth + 1);
		}
	}
}
