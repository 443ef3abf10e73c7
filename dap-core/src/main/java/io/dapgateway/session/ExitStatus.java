/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.session;

/**
 * Final outcome of a debug session, reported once to the owner of the session.
 */
public enum ExitStatus {

	/** Communication stopped without the client ever asking for a restart. */
	TERMINATED,

	/** The client disconnected asking for the session to be restarted. */
	RESTARTED

}
