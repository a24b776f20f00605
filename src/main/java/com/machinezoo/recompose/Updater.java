// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import com.machinezoo.stagean.*;

/*
 * This is the only coupling between the composer and a host event loop.
 * Host can post the update to its own loop and call compose() afterwards, or it can just queue it.
 */
/**
 * Receiver of pending {@link Update}s.
 * Implementations must guarantee that every accepted update is applied before or during the next {@link Composer#compose()}.
 * Updates already acquire the composer's write guard when applied, so they are safe to apply from any thread.
 *
 * @see Composer#updater(Updater)
 */
@StubDocs
@FunctionalInterface
public interface Updater {
	void update(Update update);
}
