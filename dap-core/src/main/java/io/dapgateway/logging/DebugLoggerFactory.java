/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import java.util.function.Function;
import java.util.logging.Handler;
import java.util.logging.Logger;

import io.dapgateway.util.Assert;

/**
 * Logging factory handed to the debugger library. Every logger it returns is detached
 * from its parent handlers; the debugger's own logger is routed to a
 * {@link DebuggeeLogSink}.
 */
public final class DebugLoggerFactory implements Function<String, Logger> {

	public static final String DEFAULT_DEBUGGER_LOGGER_NAME = "java-debug";

	private final String debuggerLoggerName;

	private final JulHandlerBridge bridge;

	public DebugLoggerFactory(DebuggeeLogSink sink) {
		this(DEFAULT_DEBUGGER_LOGGER_NAME, sink);
	}

	public DebugLoggerFactory(String debuggerLoggerName, DebuggeeLogSink sink) {
		Assert.hasText(debuggerLoggerName, "debuggerLoggerName must not be empty");
		this.debuggerLoggerName = debuggerLoggerName;
		this.bridge = new JulHandlerBridge(sink);
	}

	@Override
	public Logger apply(String name) {
		Logger logger = Logger.getLogger(name);
		for (Handler handler : logger.getHandlers()) {
			logger.removeHandler(handler);
		}
		logger.setUseParentHandlers(false);
		if (this.debuggerLoggerName.equals(name)) {
			logger.addHandler(this.bridge);
		}
		return logger;
	}

	public String getDebuggerLoggerName() {
		return this.debuggerLoggerName;
	}

}
