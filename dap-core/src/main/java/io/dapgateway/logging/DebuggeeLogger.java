/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.dapgateway.spec.DapSchema;
import io.dapgateway.spec.DebugMessageSender;
import io.dapgateway.util.Assert;
import org.slf4j.Logger;

/**
 * Logger handed to the debuggee runner. Debuggee output is forwarded to the client as
 * {@code output} events, and the JDWP listening line announces the debuggee address.
 */
public class DebuggeeLogger {

	public static final String JDWP_LISTENING_PREFIX = "Listening for transport dt_socket at address: ";

	private static final Pattern JDWP_LISTENING = Pattern
		.compile(Pattern.quote(JDWP_LISTENING_PREFIX) + "(?:([\\w.\\-*]+):)?(\\d{1,5})\\b");

	private static final String LOOPBACK = "127.0.0.1";

	private static final int MAX_PORT = 65535;

	private final DebugMessageSender outbound;

	private final Consumer<InetSocketAddress> addressListener;

	private final Logger logger;

	private final AtomicBoolean addressResolved = new AtomicBoolean(false);

	public DebuggeeLogger(DebugMessageSender outbound, Consumer<InetSocketAddress> addressListener, Logger logger) {
		Assert.notNull(outbound, "outbound must not be null");
		Assert.notNull(addressListener, "addressListener must not be null");
		Assert.notNull(logger, "logger must not be null");
		this.outbound = outbound;
		this.addressListener = addressListener;
		this.logger = logger;
	}

	/** Standard output of the debuggee. */
	public void out(String line) {
		logger.debug(line);
		scanForAddress(line);
		sendOutput(DapSchema.OutputCategories.STDOUT, line);
	}

	/** Standard error of the debuggee. */
	public void err(String line) {
		logger.debug(line);
		sendOutput(DapSchema.OutputCategories.STDERR, line);
	}

	public void info(String message) {
		logger.info(message);
		scanForAddress(message);
	}

	public void warn(String message) {
		logger.warn(message);
	}

	public void error(String message) {
		logger.error(message);
	}

	public void debug(String message) {
		logger.debug(message);
	}

	/**
	 * Resolves the debuggee address directly. Only the first resolution is delivered.
	 */
	public void resolveAddress(InetSocketAddress address) {
		Assert.notNull(address, "address must not be null");
		if (this.addressResolved.compareAndSet(false, true)) {
			logger.debug("Debuggee listening at {}:{}", address.getHostString(), address.getPort());
			this.addressListener.accept(address);
		}
	}

	private void scanForAddress(String line) {
		if (line == null || this.addressResolved.get()) {
			return;
		}
		Matcher matcher = JDWP_LISTENING.matcher(line);
		if (matcher.find()) {
			String host = matcher.group(1);
			int port = Integer.parseInt(matcher.group(2));
			if (port < 1 || port > MAX_PORT) {
				logger.debug("Ignoring JDWP listening line with invalid port {}", port);
				return;
			}
			String resolvedHost = (host == null || "*".equals(host) || "0.0.0.0".equals(host)) ? LOOPBACK : host;
			resolveAddress(InetSocketAddress.createUnresolved(resolvedHost, port));
		}
	}

	private void sendOutput(String category, String line) {
		String output = line.endsWith(System.lineSeparator()) || line.endsWith("\n") ? line : line + "\n";
		this.outbound.sendEvent(
				new DapSchema.Event(DapSchema.Events.OUTPUT, new DapSchema.OutputEventBody(category, output)));
	}

}
