// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.stagean.*;

/**
 * Thrown by {@link Scope#requireContext(Class)} when no ancestor provides context of the requested type.
 * Callers that can fall back to a default should use {@link Scope#useContext(Class)} instead.
 */
@StubDocs
public class ContextNotFoundException extends NoSuchElementException {
	private static final long serialVersionUID = 1L;
	private final Class<?> type;
	public Class<?> type() {
		return type;
	}
	public ContextNotFoundException(Class<?> type) {
		super("Context value not found for type: " + type.getName());
		this.type = type;
	}
}
