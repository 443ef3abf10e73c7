/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DebugLoggerFactoryTests {

	private final List<String> published = new CopyOnWriteArrayList<>();

	private DebugLoggerFactory factory;

	@BeforeEach
	void setUp() {
		this.factory = new DebugLoggerFactory("dap-gateway-tests-debugger",
				(level, message) -> this.published.add(level.getName() + " " + message));
	}

	@Test
	void debuggerLoggerIsRoutedToSink() {
		Logger logger = this.factory.apply("dap-gateway-tests-debugger");

		logger.log(Level.SEVERE, "Failed to attach to {0}", "127.0.0.1:5005");

		assertThat(logger.getUseParentHandlers()).isFalse();
		assertThat(logger.getHandlers()).hasSize(1).hasOnlyElementsOfType(JulHandlerBridge.class);
		assertThat(this.published).containsExactly("SEVERE Failed to attach to 127.0.0.1:5005");
	}

	@Test
	void otherLoggersAreSilenced() {
		Logger other = Logger.getLogger("dap-gateway-tests-other");
		other.addHandler(new ConsoleHandler());

		Logger logger = this.factory.apply("dap-gateway-tests-other");
		logger.severe("should go nowhere");

		assertThat(logger.getUseParentHandlers()).isFalse();
		assertThat(logger.getHandlers()).isEmpty();
		assertThat(this.published).isEmpty();
	}

	@Test
	void repeatedLookupsDoNotStackHandlers() {
		this.factory.apply("dap-gateway-tests-debugger");
		Logger logger = this.factory.apply("dap-gateway-tests-debugger");

		logger.info("once");

		Handler[] handlers = logger.getHandlers();
		assertThat(handlers).hasSize(1);
		assertThat(this.published).containsExactly("INFO once");
	}

	@Test
	void defaultsToJavaDebugLogger() {
		assertThat(new DebugLoggerFactory((level, message) -> {
		}).getDebuggerLoggerName()).isEqualTo("java-debug");
	}

}
