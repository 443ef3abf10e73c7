/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import io.dapgateway.util.Assert;

/**
 * Recognizes a severe debugger log message that is expected while a session shuts down
 * and should be demoted to debug level.
 * <p>
 * The literals are phrased after the debugger library's own messages, so they are kept
 * configurable rather than baked into the adapter.
 */
public final class NoiseMatcher {

	/** Logged by the debugger when the client socket goes away after the debuggee ended. */
	public static final String SOCKET_CLOSED = "java.net.SocketException: Socket closed";

	/** Logged by the debugger when an event arrives after the VM has disconnected. */
	public static final String RECORDING_WHEN_VM_DISCONNECTED = "Exception on recording event: com.sun.jdi.VMDisconnectedException";

	private enum Position {

		PREFIX, SUFFIX

	}

	private final Position position;

	private final String literal;

	private final boolean onlyAfterDebuggeeFinished;

	private NoiseMatcher(Position position, String literal, boolean onlyAfterDebuggeeFinished) {
		Assert.hasText(literal, "literal must not be empty");
		this.position = position;
		this.literal = literal;
		this.onlyAfterDebuggeeFinished = onlyAfterDebuggeeFinished;
	}

	public static NoiseMatcher prefix(String literal) {
		return new NoiseMatcher(Position.PREFIX, literal, false);
	}

	public static NoiseMatcher suffix(String literal) {
		return new NoiseMatcher(Position.SUFFIX, literal, false);
	}

	/**
	 * Returns a copy of this matcher that only applies once the debuggee has finished.
	 */
	public NoiseMatcher onlyAfterDebuggeeFinished() {
		return new NoiseMatcher(this.position, this.literal, true);
	}

	public static NoiseMatcher socketClosed() {
		return suffix(SOCKET_CLOSED).onlyAfterDebuggeeFinished();
	}

	public static NoiseMatcher recordingWhenVmDisconnected() {
		return prefix(RECORDING_WHEN_VM_DISCONNECTED);
	}

	public boolean matches(String message, boolean debuggeeFinished) {
		if (message == null || (this.onlyAfterDebuggeeFinished && !debuggeeFinished)) {
			return false;
		}
		return this.position == Position.PREFIX ? message.startsWith(this.literal) : message.endsWith(this.literal);
	}

	@Override
	public String toString() {
		return "NoiseMatcher{" + position + " '" + literal + "'"
				+ (onlyAfterDebuggeeFinished ? ", after debuggee finished" : "") + "}";
	}

}
