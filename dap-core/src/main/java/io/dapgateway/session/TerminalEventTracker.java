/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.session;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Set of terminal event types still expected before the conversation with the client is
 * over. The set only shrinks.
 */
final class TerminalEventTracker {

	private final Set<String> expected;

	TerminalEventTracker(String... expectedEvents) {
		this.expected = new HashSet<>(Arrays.asList(expectedEvents));
	}

	/**
	 * Stops expecting the given event type.
	 * @return {@code true} if nothing is expected any more
	 */
	synchronized boolean observe(String eventType) {
		this.expected.remove(eventType);
		return this.expected.isEmpty();
	}

	synchronized boolean isDrained() {
		return this.expected.isEmpty();
	}

	synchronized Set<String> remaining() {
		return new HashSet<>(this.expected);
	}

}
