// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.junit.jupiter.api.*;

public class ScopeTest extends TestBase {
	/*
	 * Composable that recomposes on every pass and hands its scope to the test.
	 */
	static class Probe implements Composable {
		final Consumer<Scope> body;
		Probe(Consumer<Scope> body) {
			this.body = body;
		}
		@Override
		public Composable compose(Scope scope) {
			scope.setChanged();
			body.accept(scope);
			return null;
		}
	}
	@Test
	public void useRef() {
		List<Object> refs = new ArrayList<>();
		AtomicInteger inits = new AtomicInteger();
		Composer composer = new Composer(new Probe(s -> refs.add(s.useRef(() -> {
			inits.incrementAndGet();
			return new Object();
		}))));
		passes(composer, 3);
		assertEquals(1, inits.get());
		assertEquals(3, refs.size());
		assertSame(refs.get(0), refs.get(2));
	}
	@Test
	public void useMut() {
		List<Integer> seen = new ArrayList<>();
		AtomicReference<Mut<Integer>> handle = new AtomicReference<>();
		Composer composer = new Composer(scope -> {
			Mut<Integer> value = scope.useMut(() -> 0);
			handle.set(value);
			seen.add(value.get());
			return null;
		});
		composer.compose();
		handle.get().update(v -> v + 1);
		handle.get().update(v -> v + 1);
		// Mutations are deferred until the next pass.
		assertEquals(0, (int)handle.get().get());
		composer.compose();
		assertEquals(List.of(0, 2), seen);
		assertEquals(2, handle.get().version());
		// Without changes, the node is skipped.
		composer.compose();
		assertEquals(List.of(0, 2), seen);
	}
	@Test
	public void useMutWith() {
		List<Integer> seen = new ArrayList<>();
		AtomicReference<Mut<Integer>> handle = new AtomicReference<>();
		Composer composer = new Composer(scope -> {
			Mut<Integer> value = scope.useMut(() -> 0);
			handle.set(value);
			seen.add(value.get());
			return null;
		});
		composer.compose();
		handle.get().with(v -> 10);
		composer.compose();
		// Value was changed, but the node was not marked changed.
		assertEquals(List.of(0), seen);
		assertEquals(10, (int)handle.get().get());
		assertEquals(0, handle.get().version());
		handle.get().set(11);
		composer.compose();
		assertEquals(List.of(0, 11), seen);
	}
	@Test
	public void useMemo() {
		AtomicInteger dependency = new AtomicInteger();
		AtomicInteger computations = new AtomicInteger();
		List<String> results = new ArrayList<>();
		Composer composer = new Composer(new Probe(s -> results.add(s.useMemo(dependency.get(), () -> "v" + computations.incrementAndGet()))));
		passes(composer, 2);
		assertEquals(List.of("v1", "v1"), results);
		dependency.set(1);
		passes(composer, 2);
		assertEquals(List.of("v1", "v1", "v2", "v2"), results);
		assertEquals(2, computations.get());
	}
	@Test
	public void useMemoNull() {
		AtomicInteger computations = new AtomicInteger();
		Composer composer = new Composer(new Probe(s -> s.useMemo(null, computations::incrementAndGet)));
		passes(composer, 3);
		// First pass computes even though null equals the initial snapshot.
		assertEquals(1, computations.get());
	}
	@Test
	public void useDrop() {
		List<String> drops = new ArrayList<>();
		AtomicInteger pass = new AtomicInteger();
		Composer composer = new Composer(new Probe(s -> {
			String label = "pass" + pass.incrementAndGet();
			s.useDrop(() -> drops.add(label));
		}));
		passes(composer, 3);
		assertEquals(List.of(), drops);
		composer.close();
		// Only the latest callback runs and it runs once.
		assertEquals(List.of("pass3"), drops);
	}
	@Test
	public void dropFailure() {
		AtomicInteger drops = new AtomicInteger();
		Composer composer = new Composer(new Probe(s -> {
			s.useDrop(() -> {
				throw new IllegalStateException();
			});
			s.useDrop(drops::incrementAndGet);
		}));
		composer.compose();
		// Failing callback is logged and the remaining callbacks still run.
		composer.close();
		assertEquals(1, drops.get());
	}
	@Test
	public void useCallback() {
		List<Callback<Integer, Integer>> callbacks = new ArrayList<>();
		AtomicInteger offset = new AtomicInteger();
		Composer composer = new Composer(new Probe(s -> {
			int current = offset.incrementAndGet();
			callbacks.add(s.useCallback(n -> n + current));
		}));
		passes(composer, 3);
		assertSame(callbacks.get(0), callbacks.get(2));
		// Callback delegates to the function from the latest pass.
		assertEquals(13, (int)callbacks.get(0).apply(10));
	}
	@Test
	public void invalidated() {
		AtomicReference<Scope> captured = new AtomicReference<>();
		Composer composer = new Composer(new Probe(captured::set));
		composer.compose();
		assertFalse(captured.get().valid());
		assertThrows(IllegalStateException.class, () -> captured.get().useRef(Object::new));
		assertThrows(IllegalStateException.class, () -> captured.get().setChanged());
	}
	@Test
	public void extraHook() {
		AtomicBoolean extra = new AtomicBoolean();
		Composer composer = new Composer(new Probe(s -> {
			s.useRef(() -> 1);
			if (extra.get())
				s.useRef(() -> 2);
		}));
		composer.compose();
		extra.set(true);
		assertThrows(HookOrderException.class, composer::compose);
	}
	@Test
	public void missingHook() {
		AtomicBoolean skip = new AtomicBoolean();
		Composer composer = new Composer(new Probe(s -> {
			if (!skip.get())
				s.useRef(() -> 1);
		}));
		composer.compose();
		skip.set(true);
		assertThrows(HookOrderException.class, composer::compose);
	}
	@Test
	public void swappedHook() {
		AtomicBoolean swap = new AtomicBoolean();
		Composer composer = new Composer(new Probe(s -> {
			if (swap.get())
				s.useMut(() -> 1);
			else
				s.useRef(() -> 1);
		}));
		composer.compose();
		swap.set(true);
		HookOrderException ex = assertThrows(HookOrderException.class, composer::compose);
		assertThat(ex.getMessage(), containsString("MUT"));
	}
	static class Provider implements Composable {
		final String value;
		final Composable content;
		Provider(String value, Composable content) {
			this.value = value;
			this.content = content;
		}
		@Override
		public Composable compose(Scope scope) {
			scope.useProvider(String.class, () -> value);
			return content;
		}
	}
	static class Reader implements Composable {
		final List<Optional<String>> seen;
		Reader(List<Optional<String>> seen) {
			this.seen = seen;
		}
		@Override
		public Composable compose(Scope scope) {
			seen.add(scope.useContext(String.class));
			return null;
		}
	}
	@Test
	public void contexts() {
		List<Optional<String>> outer = new ArrayList<>();
		List<Optional<String>> inner = new ArrayList<>();
		List<Optional<String>> none = new ArrayList<>();
		Composer composer = new Composer(Composables.sequence(
			new Reader(none),
			new Provider("outer", Composables.sequence(
				new Reader(outer),
				new Provider("inner", new Reader(inner))))));
		composer.compose();
		assertEquals(List.of(Optional.empty()), none);
		assertEquals(List.of(Optional.of("outer")), outer);
		// Nearer provider shadows the outer one.
		assertEquals(List.of(Optional.of("inner")), inner);
	}
	@Test
	public void requireContext() {
		Composer composer = new Composer(scope -> {
			scope.requireContext(Integer.class);
			return null;
		});
		ContextNotFoundException ex = assertThrows(ContextNotFoundException.class, composer::compose);
		assertEquals(Integer.class, ex.type());
	}
	@Test
	public void providerSeesItself() {
		List<String> seen = new ArrayList<>();
		Composer composer = new Composer(scope -> {
			scope.useProvider(String.class, () -> "own");
			seen.add(scope.requireContext(String.class));
			return null;
		});
		composer.compose();
		assertEquals(List.of("own"), seen);
	}
}
