/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

import io.dapgateway.util.Assert;

/**
 * {@code java.util.logging} handler forwarding formatted records to a
 * {@link DebuggeeLogSink}.
 */
public final class JulHandlerBridge extends Handler {

	private final DebuggeeLogSink sink;

	public JulHandlerBridge(DebuggeeLogSink sink) {
		Assert.notNull(sink, "sink must not be null");
		this.sink = sink;
		setFormatter(new SimpleFormatter());
	}

	@Override
	public void publish(LogRecord record) {
		if (record == null || !isLoggable(record)) {
			return;
		}
		this.sink.publish(record.getLevel(), getFormatter().formatMessage(record));
	}

	@Override
	public void flush() {
	}

	@Override
	public void close() {
	}

}
