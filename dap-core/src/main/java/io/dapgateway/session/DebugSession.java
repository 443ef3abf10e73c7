/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.session;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import io.dapgateway.json.DapJsonMapper;
import io.dapgateway.json.TypeRef;
import io.dapgateway.logging.DapLogging;
import io.dapgateway.logging.DebugLoggerFactory;
import io.dapgateway.logging.DebuggeeLogger;
import io.dapgateway.logging.DebuggeeLoggerAdapter;
import io.dapgateway.spec.DapSchema;
import io.dapgateway.spec.DebugMessageSender;
import io.dapgateway.spec.DebugProtocolServer;
import io.dapgateway.spec.DebugProtocolServerFactory;
import io.dapgateway.spec.DebugTransport;
import io.dapgateway.spec.DebuggeeRunner;
import io.dapgateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Debug session that keeps the lifecycle of the debuggee separate from the protocol
 * conversation. The debuggee is started together with the session and stopped when the
 * session is cancelled or the client disconnects.
 * <p>
 * Since the debuggee is started by the session rather than by the debugger, a client
 * {@code launch} is carried out as an {@code attach} to the address the debuggee
 * announces through its {@link DebuggeeLogger}. The client only ever sees responses to
 * its {@code launch}.
 * <p>
 * Requests coming from the client pass through {@link #dispatchRequest}; responses and
 * events going to the client pass through {@link #sendResponse} and {@link #sendEvent}.
 * Everything else is handled by the wrapped {@link DebugProtocolServer}.
 */
public class DebugSession implements DebugMessageSender, Runnable, Disposable {

	private static final Logger logger = LoggerFactory.getLogger(DebugSession.class);

	public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(5);

	public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

	public static final String DEBUGGEE_START_FAILURE = "Could not start debuggee";

	static final String FROZEN_CLIENT_WARNING = "Communication with DAP client is frozen, closing client forcefully...";

	private static final TypeRef<Map<String, Object>> ARGUMENTS_TYPE_REF = new TypeRef<Map<String, Object>>() {
	};

	private final String id;

	private final DebugTransport transport;

	private final DebugProtocolServer server;

	private final Scheduler scheduler;

	private final Duration handshakeTimeout;

	private final Duration shutdownTimeout;

	private final DebuggeeLoggerAdapter loggerAdapter;

	private final Logger debuggeeOutputLogger;

	private final DapJsonMapper jsonMapper;

	/** Launch requests waiting for their attach response to be relabelled. */
	private final Set<Integer> launchedRequests = ConcurrentHashMap.newKeySet();

	/** Both this session and the server answer a disconnect; only one answer goes out. */
	private final AtomicBoolean disconnectSent = new AtomicBoolean(false);

	private final SignalCell<InetSocketAddress> debugAddress = new SignalCell<>("debugAddress");

	private final SignalCell<Void> endOfConnection = new SignalCell<>("endOfConnection");

	private final SignalCell<ExitStatus> exitStatus = new SignalCell<>("exitStatus");

	/*
	 * The conversation is over once every terminal event has been sent to the client.
	 * Event types are removed as they go out.
	 */
	private final TerminalEventTracker terminalEvents = new TerminalEventTracker(DapSchema.Events.TERMINATED,
			DapSchema.Events.EXITED);

	private final StateCell<DebugSessionState> state;

	private DebugSession(Builder builder) {
		this.id = builder.sessionId;
		this.transport = builder.transport;
		this.scheduler = builder.scheduler;
		this.handshakeTimeout = builder.handshakeTimeout;
		this.shutdownTimeout = builder.shutdownTimeout;
		this.loggerAdapter = builder.loggerAdapter;
		this.debuggeeOutputLogger = builder.debuggeeOutputLogger;
		this.jsonMapper = builder.jsonMapper;
		this.state = new StateCell<DebugSessionState>(DebugSessionState.idle(builder.runner));
		DebugLoggerFactory loggerFactory = new DebugLoggerFactory(builder.debuggerLoggerName, this.loggerAdapter);
		this.server = builder.serverFactory.create(this.transport, this, loggerFactory);
		Assert.notNull(this.server, "serverFactory must not return null");
	}

	public static Builder builder(DebugTransport transport, DebugProtocolServerFactory serverFactory,
			DebuggeeRunner runner) {
		return new Builder(transport, serverFactory, runner);
	}

	public String getId() {
		return this.id;
	}

	/**
	 * Redirects to {@link #start()}, so the server is never run without the debuggee.
	 */
	@Override
	public void run() {
		start();
	}

	/**
	 * Starts the debuggee and the protocol read loop in the background. Has no effect
	 * unless the session is idle.
	 */
	public void start() {
		this.state.transform(current -> {
			if (!(current instanceof DebugSessionState.Idle)) {
				return current;
			}
			DebuggeeRunner runner = ((DebugSessionState.Idle) current).runner();

			Mono.fromRunnable(this::runServer).subscribeOn(this.scheduler).subscribe();

			DebuggeeLogger debuggeeLogger = new DebuggeeLogger(this, this.debugAddress::trySettle,
					this.debuggeeOutputLogger);

			// all output events are sent before the debuggee computation finishes
			Disposable debuggee = Mono.defer(() -> runner.run(debuggeeLogger))
				.doOnError(error -> logger.error("[{}] Debuggee failed: {}", this.id, error.getMessage(), error))
				.onErrorResume(error -> Mono.empty())
				.subscribeOn(this.scheduler)
				// after subscribeOn, so the hook also sees a cancellation that beats the
				// worker subscription
				.doFinally(signal -> terminateGracefully())
				.subscribe();

			DapLogging.logEvent(logger, this.jsonMapper, "S_SESSION_STARTED", this.id, null, null);
			return DebugSessionState.started(debuggee);
		});
	}

	private void runServer() {
		inSessionContext(() -> {
			try {
				this.server.run();
				logger.debug("[{}] Protocol read loop finished", this.id);
			}
			catch (RuntimeException e) {
				logger.error("[{}] Protocol read loop failed: {}", this.id, e.getMessage(), e);
			}
		});
	}

	private void inSessionContext(Runnable action) {
		DapLogging.withMdc(DapLogging.MDC_SESSION_ID, this.id, action);
	}

	/**
	 * Once the debuggee is gone, waits for the client conversation to wind down before
	 * reporting the session as terminated and closing the connection.
	 */
	private void terminateGracefully() {
		this.endOfConnection.asMono().then(Mono.fromRunnable(() -> inSessionContext(() -> {
			if (this.exitStatus.trySettle(ExitStatus.TERMINATED)) {
				DapLogging.logEvent(logger, this.jsonMapper, "S_EXIT_STATUS", this.id, null,
						DapLogging.outcome(ExitStatus.TERMINATED.name(), null));
			}
			this.transport.close();
		}))).subscribe();
	}

	/**
	 * Intercepts a request coming from the client before the server executes it.
	 */
	public void dispatchRequest(DapSchema.Request request) {
		inSessionContext(() -> {
			switch (request.command()) {
				case DapSchema.Commands.LAUNCH:
					launch(request);
					break;
				case DapSchema.Commands.DISCONNECT:
					disconnect(request);
					break;
				default:
					this.server.dispatchRequest(request);
			}
		});
	}

	private void launch(DapSchema.Request request) {
		this.launchedRequests.add(request.seq());
		this.debugAddress.asMono()
			.timeout(this.handshakeTimeout, this.scheduler)
			.publishOn(this.scheduler)
			.subscribe(address -> inSessionContext(() -> attach(request, address)),
					error -> inSessionContext(() -> launchFailed(request, error)));
	}

	private void attach(DapSchema.Request launch, InetSocketAddress address) {
		DapLogging.logEvent(logger, this.jsonMapper, "S_LAUNCH_TRANSLATED", this.id,
				DapLogging.request(launch.command(), launch.seq()),
				DapLogging.outcome("ATTACH", address.getHostString() + ":" + address.getPort()));
		try {
			this.server.dispatchRequest(toAttachRequest(launch.seq(), address));
		}
		catch (RuntimeException e) {
			logger.error("[{}] Attach for launch seq={} failed: {}", this.id, launch.seq(), e.getMessage(), e);
		}
	}

	private void launchFailed(DapSchema.Request launch, Throwable error) {
		this.launchedRequests.remove(launch.seq());
		if (error instanceof TimeoutException) {
			logger.warn("[{}] Debuggee address not known after {}ms, failing launch seq={}", this.id,
					this.handshakeTimeout.toMillis(), launch.seq());
		}
		else {
			logger.error("[{}] Launch seq={} failed: {}", this.id, launch.seq(), error.getMessage(), error);
		}
		DapLogging.logEvent(logger, this.jsonMapper, "S_LAUNCH_TIMEOUT", this.id,
				DapLogging.request(launch.command(), launch.seq()),
				DapLogging.outcome("ERROR", error.getClass().getSimpleName()));
		sendResponse(DapSchema.Response.failure(launch, DEBUGGEE_START_FAILURE));
	}

	private void disconnect(DapSchema.Request request) {
		try {
			boolean restart = shouldRestart(request);
			if (restart && this.exitStatus.trySettle(ExitStatus.RESTARTED)) {
				DapLogging.logEvent(logger, this.jsonMapper, "S_EXIT_STATUS", this.id,
						DapLogging.request(request.command(), request.seq()),
						DapLogging.outcome(ExitStatus.RESTARTED.name(), null));
			}
			DapLogging.logEvent(logger, this.jsonMapper, "S_DISCONNECT", this.id,
					DapLogging.request(request.command(), request.seq()),
					DapLogging.outcome(restart ? "RESTART" : "DISCONNECT", null));
			sendResponse(DapSchema.Response.acknowledge(request));
		}
		finally {
			// no exited event is coming once the debugger has disconnected from the VM
			if (this.terminalEvents.observe(DapSchema.Events.EXITED)) {
				settleEndOfConnection();
			}

			this.state.transform(current -> {
				if (current instanceof DebugSessionState.Started) {
					cancelDebuggee(((DebugSessionState.Started) current).debuggee());
					this.server.dispatchRequest(request);
					return DebugSessionState.cancelled();
				}
				return current;
			});
		}
	}

	/**
	 * Intercepts a response going to the client.
	 */
	@Override
	public void sendResponse(DapSchema.Response response) {
		inSessionContext(() -> forwardResponse(response));
	}

	private void forwardResponse(DapSchema.Response response) {
		String command = response.command();
		if (DapSchema.Commands.ATTACH.equals(command) && this.launchedRequests.remove(response.requestSeq())) {
			// the client asked for a launch, so it expects a launch response
			this.server.sendResponse(response.withCommand(DapSchema.Commands.LAUNCH));
		}
		else if (DapSchema.Commands.DISCONNECT.equals(command)) {
			// the session has already acknowledged the disconnect; the server's own answer
			// is dropped
			if (this.disconnectSent.compareAndSet(false, true)) {
				this.server.sendResponse(response);
			}
			else {
				logger.debug("[{}] Dropping duplicate disconnect response for seq={}", this.id,
						response.requestSeq());
			}
		}
		else {
			this.server.sendResponse(response);
		}
	}

	/**
	 * Forwards an event to the client and tracks terminal events.
	 */
	@Override
	public void sendEvent(DapSchema.Event event) {
		inSessionContext(() -> forwardEvent(event));
	}

	private void forwardEvent(DapSchema.Event event) {
		try {
			this.server.sendEvent(event);

			if (DapSchema.Events.EXITED.equals(event.event())) {
				this.loggerAdapter.onDebuggeeFinished();
			}
		}
		finally {
			if (this.terminalEvents.observe(event.event())) {
				// the transport is not closed here, it closes once both sides are done
				settleEndOfConnection();
			}
		}
	}

	private void settleEndOfConnection() {
		if (this.endOfConnection.trySettle(null)) {
			DapLogging.logEvent(logger, this.jsonMapper, "S_END_OF_CONNECTION", this.id, null, null);
		}
	}

	/**
	 * Completes once with {@link ExitStatus#TERMINATED} when the conversation ends without
	 * a restart request, or with {@link ExitStatus#RESTARTED} as soon as the client asks
	 * for a restart. A restarted session still sends its terminal events to the client.
	 */
	public Mono<ExitStatus> exitStatus() {
		return this.exitStatus.asMono();
	}

	/**
	 * Completes once every terminal event has been sent to the client, or when a
	 * cancelled session gave up waiting for them.
	 */
	public Mono<Void> endOfConnection() {
		return this.endOfConnection.asMono();
	}

	public DebugSessionState currentState() {
		return this.state.get();
	}

	/**
	 * Stops the debuggee and the protocol server. An idle session closes the connection
	 * right away; a started one waits for the terminal events for a bounded time. Safe to
	 * call any number of times.
	 */
	public void cancel() {
		this.state.transform(current -> {
			if (current instanceof DebugSessionState.Idle) {
				this.transport.close();
				DapLogging.logEvent(logger, this.jsonMapper, "S_SESSION_CANCELLED", this.id, null,
						DapLogging.outcome(DebugSessionState.Phase.IDLE.name(), null));
				return DebugSessionState.cancelled();
			}
			if (current instanceof DebugSessionState.Started) {
				cancelDebuggee(((DebugSessionState.Started) current).debuggee());
				scheduleForcedEndOfConnection();
				DapLogging.logEvent(logger, this.jsonMapper, "S_SESSION_CANCELLED", this.id, null,
						DapLogging.outcome(DebugSessionState.Phase.STARTED.name(), null));
				return DebugSessionState.cancelled();
			}
			return current;
		});
	}

	@Override
	public void dispose() {
		cancel();
	}

	@Override
	public boolean isDisposed() {
		return this.state.get() instanceof DebugSessionState.Cancelled;
	}

	/*
	 * A client that never sends its terminal events would keep the session open forever.
	 */
	private void scheduleForcedEndOfConnection() {
		this.endOfConnection.asMono()
			.timeout(this.shutdownTimeout, Mono.fromRunnable(() -> inSessionContext(() -> {
				logger.warn("[{}] {}", this.id, FROZEN_CLIENT_WARNING);
				DapLogging.logEvent(logger, this.jsonMapper, "S_FORCED_END_OF_CONNECTION", this.id, null,
						DapLogging.outcome("TIMEOUT", "remaining=" + this.terminalEvents.remaining()));
			})), this.scheduler)
			.doFinally(signal -> this.endOfConnection.trySettle(null))
			.subscribe();
	}

	private void cancelDebuggee(Disposable debuggee) {
		this.loggerAdapter.onDebuggeeFinished();
		debuggee.dispose();
	}

	DapSchema.Request toAttachRequest(int seq, InetSocketAddress address) {
		DapSchema.AttachArguments arguments = new DapSchema.AttachArguments(address.getHostString(),
				address.getPort());
		Map<String, Object> json = this.jsonMapper.convertValue(arguments, ARGUMENTS_TYPE_REF);
		return new DapSchema.Request(seq, DapSchema.Commands.ATTACH, json);
	}

	boolean shouldRestart(DapSchema.Request disconnectRequest) {
		if (disconnectRequest.arguments() == null) {
			return false;
		}
		try {
			DapSchema.DisconnectArguments arguments = this.jsonMapper.convertValue(disconnectRequest.arguments(),
					DapSchema.DisconnectArguments.class);
			return arguments != null && Boolean.TRUE.equals(arguments.restart());
		}
		catch (IllegalArgumentException e) {
			logger.debug("[{}] Unreadable disconnect arguments, assuming no restart: {}", this.id, e.getMessage());
			return false;
		}
	}

	/**
	 * Builder for {@link DebugSession}.
	 */
	public static class Builder {

		private final DebugTransport transport;

		private final DebugProtocolServerFactory serverFactory;

		private final DebuggeeRunner runner;

		private Scheduler scheduler = Schedulers.boundedElastic();

		private Duration handshakeTimeout = DEFAULT_HANDSHAKE_TIMEOUT;

		private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

		private String sessionId = UUID.randomUUID().toString().substring(0, 8);

		private DebuggeeLoggerAdapter loggerAdapter;

		private Logger debuggeeOutputLogger = LoggerFactory.getLogger(DebuggeeLogger.class);

		private String debuggerLoggerName = DebugLoggerFactory.DEFAULT_DEBUGGER_LOGGER_NAME;

		private DapJsonMapper jsonMapper;

		private Builder(DebugTransport transport, DebugProtocolServerFactory serverFactory, DebuggeeRunner runner) {
			Assert.notNull(transport, "transport must not be null");
			Assert.notNull(serverFactory, "serverFactory must not be null");
			Assert.notNull(runner, "runner must not be null");
			this.transport = transport;
			this.serverFactory = serverFactory;
			this.runner = runner;
		}

		public Builder scheduler(Scheduler scheduler) {
			Assert.notNull(scheduler, "scheduler must not be null");
			this.scheduler = scheduler;
			return this;
		}

		public Builder handshakeTimeout(Duration handshakeTimeout) {
			Assert.notNull(handshakeTimeout, "handshakeTimeout must not be null");
			Assert.isTrue(!handshakeTimeout.isNegative() && !handshakeTimeout.isZero(),
					"handshakeTimeout must be positive");
			this.handshakeTimeout = handshakeTimeout;
			return this;
		}

		public Builder shutdownTimeout(Duration shutdownTimeout) {
			Assert.notNull(shutdownTimeout, "shutdownTimeout must not be null");
			Assert.isTrue(!shutdownTimeout.isNegative() && !shutdownTimeout.isZero(),
					"shutdownTimeout must be positive");
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		public Builder sessionId(String sessionId) {
			Assert.hasText(sessionId, "sessionId must not be empty");
			this.sessionId = sessionId;
			return this;
		}

		public Builder loggerAdapter(DebuggeeLoggerAdapter loggerAdapter) {
			this.loggerAdapter = loggerAdapter;
			return this;
		}

		public Builder debuggeeOutputLogger(Logger debuggeeOutputLogger) {
			Assert.notNull(debuggeeOutputLogger, "debuggeeOutputLogger must not be null");
			this.debuggeeOutputLogger = debuggeeOutputLogger;
			return this;
		}

		public Builder debuggerLoggerName(String debuggerLoggerName) {
			Assert.hasText(debuggerLoggerName, "debuggerLoggerName must not be empty");
			this.debuggerLoggerName = debuggerLoggerName;
			return this;
		}

		public Builder jsonMapper(DapJsonMapper jsonMapper) {
			this.jsonMapper = jsonMapper;
			return this;
		}

		public DebugSession build() {
			if (this.loggerAdapter == null) {
				this.loggerAdapter = new DebuggeeLoggerAdapter(LoggerFactory.getLogger(DebuggeeLoggerAdapter.class));
			}
			if (this.jsonMapper == null) {
				this.jsonMapper = DapJsonMapper.getDefault();
			}
			return new DebugSession(this);
		}

	}

}
