/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.spec;

/**
 * The protocol engine that reads requests off a {@link DebugTransport}, executes the
 * built-in debugging commands and writes responses and events back to the wire.
 * <p>
 * The engine is expected to emit everything it produces through the
 * {@link DebugMessageSender} it was created with, so that a session wrapping the engine
 * can observe and rewrite outbound traffic. Its own {@link #sendResponse} and
 * {@link #sendEvent} write straight to the wire.
 */
public interface DebugProtocolServer extends DebugMessageSender {

	/**
	 * Runs the read loop, blocking the calling thread until the input stream ends.
	 */
	void run();

	/**
	 * Executes a request as if it had been read from the wire.
	 * @param request the request to execute
	 */
	void dispatchRequest(DapSchema.Request request);

}
