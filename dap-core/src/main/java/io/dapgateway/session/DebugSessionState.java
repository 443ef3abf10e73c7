/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.session;

import io.dapgateway.spec.DebuggeeRunner;
import io.dapgateway.util.Assert;
import reactor.core.Disposable;

/**
 * Phase of a {@link DebugSession}. Phases only move forward:
 * {@code IDLE -> STARTED -> CANCELLED} or {@code IDLE -> CANCELLED}.
 */
public abstract class DebugSessionState {

	public enum Phase {

		IDLE, STARTED, CANCELLED

	}

	private DebugSessionState() {
	}

	public abstract Phase phase();

	public static Idle idle(DebuggeeRunner runner) {
		return new Idle(runner);
	}

	public static Started started(Disposable debuggee) {
		return new Started(debuggee);
	}

	public static Cancelled cancelled() {
		return Cancelled.INSTANCE;
	}

	/** Not started yet; holds the function that will start the debuggee. */
	public static final class Idle extends DebugSessionState {

		private final DebuggeeRunner runner;

		private Idle(DebuggeeRunner runner) {
			Assert.notNull(runner, "runner must not be null");
			this.runner = runner;
		}

		public DebuggeeRunner runner() {
			return runner;
		}

		@Override
		public Phase phase() {
			return Phase.IDLE;
		}

	}

	/** Debuggee running; holds the handle that stops it. */
	public static final class Started extends DebugSessionState {

		private final Disposable debuggee;

		private Started(Disposable debuggee) {
			Assert.notNull(debuggee, "debuggee must not be null");
			this.debuggee = debuggee;
		}

		public Disposable debuggee() {
			return debuggee;
		}

		@Override
		public Phase phase() {
			return Phase.STARTED;
		}

	}

	public static final class Cancelled extends DebugSessionState {

		private static final Cancelled INSTANCE = new Cancelled();

		private Cancelled() {
		}

		@Override
		public Phase phase() {
			return Phase.CANCELLED;
		}

	}

	@Override
	public String toString() {
		return phase().name();
	}

}
