// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import com.machinezoo.stagean.*;

/**
 * Thrown when a composable calls a different sequence of hooks than it did on its first pass.
 * Hooks are addressed by position, so conditional hook calls would silently hand one hook's state to another.
 */
@StubDocs
public class HookOrderException extends IllegalStateException {
	private static final long serialVersionUID = 1L;
	public HookOrderException(String message) {
		super(message);
	}
}
