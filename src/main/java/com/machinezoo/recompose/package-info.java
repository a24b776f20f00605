// Part of Recompose: https://recompose.machinezoo.com
/*
 * Conventions shared by all classes in this package:
 * - Null check is performed on method parameters where appropriate.
 * - Tree state is touched only by the composing thread. Only the ready queue and the update queue are concurrent.
 * - Exceptions from drop callbacks and host wakeups are logged. Everything else propagates to the caller.
 * - Metrics are exposed by the composer and the executor only.
 * - Object's OwnerTrace has at least an alias. Child objects have their OwnerTrace parent set.
 * - Method toString() is defined. It uses OwnerTrace.toString() where there is nothing better to show.
 */
/**
 * Composer, hooks, and combinators of the incremental composition runtime.
 */
package com.machinezoo.recompose;
