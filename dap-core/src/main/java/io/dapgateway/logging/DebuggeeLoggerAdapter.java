/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

import io.dapgateway.util.Assert;
import org.slf4j.Logger;

/**
 * Maps debugger log records onto an SLF4J logger.
 * <p>
 * {@code INFO} and {@code CONFIG} become info, {@code WARNING} becomes warn and
 * {@code SEVERE} becomes error, unless the message is known shutdown noise, in which
 * case it is logged at debug. Anything else is logged at debug.
 */
public class DebuggeeLoggerAdapter implements DebuggeeLogSink {

	private final Logger logger;

	private final List<NoiseMatcher> noiseMatchers;

	// The debugger reports closed sockets as severe once the gateway tears the session
	// down; this flag tells those apart from real failures.
	private final AtomicBoolean debuggeeFinished = new AtomicBoolean(false);

	public DebuggeeLoggerAdapter(Logger logger) {
		this(logger, defaultNoiseMatchers());
	}

	public DebuggeeLoggerAdapter(Logger logger, List<NoiseMatcher> noiseMatchers) {
		Assert.notNull(logger, "logger must not be null");
		Assert.notNull(noiseMatchers, "noiseMatchers must not be null");
		this.logger = logger;
		this.noiseMatchers = Collections.unmodifiableList(noiseMatchers);
	}

	public static List<NoiseMatcher> defaultNoiseMatchers() {
		return Arrays.asList(NoiseMatcher.socketClosed(), NoiseMatcher.recordingWhenVmDisconnected());
	}

	@Override
	public void publish(Level level, String message) {
		if (Level.INFO.equals(level) || Level.CONFIG.equals(level)) {
			logger.info(message);
		}
		else if (Level.WARNING.equals(level)) {
			logger.warn(message);
		}
		else if (Level.SEVERE.equals(level)) {
			if (isShutdownNoise(message)) {
				logger.debug(message);
			}
			else {
				logger.error(message);
			}
		}
		else {
			logger.debug(message);
		}
	}

	private boolean isShutdownNoise(String message) {
		boolean finished = this.debuggeeFinished.get();
		for (NoiseMatcher matcher : this.noiseMatchers) {
			if (matcher.matches(message, finished)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Marks the debuggee as finished. Idempotent.
	 */
	public void onDebuggeeFinished() {
		if (this.debuggeeFinished.compareAndSet(false, true)) {
			logger.debug("Debuggee finished, demoting socket-closed errors");
		}
	}

	public boolean isDebuggeeFinished() {
		return this.debuggeeFinished.get();
	}

}
