// Part of Recompose: https://recompose.machinezoo.com
/**
 * Recompose is an incremental composition runtime for Java.
 * A tree of composables is re-evaluated in passes, recomposing only subtrees whose own or ancestor state changed.
 * <p>
 * The main package {@link com.machinezoo.recompose} contains the composer, hooks, and combinators.
 * Package {@link com.machinezoo.recompose.util} holds tracing helpers.
 */
module com.machinezoo.recompose {
	exports com.machinezoo.recompose;
	exports com.machinezoo.recompose.util;
	requires com.machinezoo.stagean;
	requires transitive com.machinezoo.closeablescope;
	requires com.machinezoo.noexception;
	requires com.machinezoo.noexception.slf4j;
	requires org.slf4j;
	requires com.google.common;
	requires io.opentracing.api;
	requires io.opentracing.util;
	requires it.unimi.dsi.fastutil;
	requires micrometer.core;
}
