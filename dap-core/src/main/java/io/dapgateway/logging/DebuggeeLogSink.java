/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import java.util.logging.Level;

/**
 * Receives the leveled log records produced by the debugger library.
 */
@FunctionalInterface
public interface DebuggeeLogSink {

	void publish(Level level, String message);

}
