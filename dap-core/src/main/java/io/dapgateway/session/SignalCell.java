/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.session;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Settle-once signal observable by any number of subscribers. The first settlement wins;
 * later attempts are ignored.
 *
 * @param <T> value type, {@link Void} for pure signals
 */
public final class SignalCell<T> {

	private static final Logger logger = LoggerFactory.getLogger(SignalCell.class);

	private final String name;

	private final Sinks.One<T> sink = Sinks.one();

	private final AtomicBoolean settled = new AtomicBoolean(false);

	public SignalCell(String name) {
		this.name = name;
	}

	/**
	 * Settles the signal with the given value, or without value if {@code null}.
	 * @return {@code true} if this call settled the signal
	 */
	public boolean trySettle(T value) {
		if (!this.settled.compareAndSet(false, true)) {
			return false;
		}
		// Only the CAS winner emits, so the sink never sees concurrent emissions.
		Sinks.EmitResult result = value == null ? this.sink.tryEmitEmpty() : this.sink.tryEmitValue(value);
		if (result.isFailure()) {
			logger.warn("Signal {} could not be settled: {}", this.name, result);
		}
		return true;
	}

	public boolean isSettled() {
		return this.settled.get();
	}

	/**
	 * Completes with the settled value, or empty for a value-less settlement.
	 */
	public Mono<T> asMono() {
		return this.sink.asMono();
	}

	@Override
	public String toString() {
		return "SignalCell{" + this.name + (isSettled() ? ", settled" : "") + "}";
	}

}
