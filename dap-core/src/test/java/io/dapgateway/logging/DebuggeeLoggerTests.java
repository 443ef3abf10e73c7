/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.dapgateway.spec.DapSchema;
import io.dapgateway.spec.DebugMessageSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DebuggeeLoggerTests {

	@Mock
	private DebugMessageSender outbound;

	@Mock
	private Logger slf4jLogger;

	private final List<InetSocketAddress> addresses = new CopyOnWriteArrayList<>();

	private DebuggeeLogger logger;

	@BeforeEach
	void setUp() {
		this.logger = new DebuggeeLogger(this.outbound, this.addresses::add, this.slf4jLogger);
	}

	@Test
	void stdoutBecomesOutputEvent() {
		this.logger.out("Hello, world");

		ArgumentCaptor<DapSchema.Event> captor = ArgumentCaptor.forClass(DapSchema.Event.class);
		verify(this.outbound).sendEvent(captor.capture());
		DapSchema.Event event = captor.getValue();
		assertThat(event.event()).isEqualTo(DapSchema.Events.OUTPUT);
		DapSchema.OutputEventBody body = (DapSchema.OutputEventBody) event.body();
		assertThat(body.category()).isEqualTo(DapSchema.OutputCategories.STDOUT);
		assertThat(body.output()).isEqualTo("Hello, world\n");
		verify(this.slf4jLogger).debug("Hello, world");
	}

	@Test
	void stderrBecomesOutputEvent() {
		this.logger.err("Exception in thread \"main\"\n");

		ArgumentCaptor<DapSchema.Event> captor = ArgumentCaptor.forClass(DapSchema.Event.class);
		verify(this.outbound).sendEvent(captor.capture());
		DapSchema.OutputEventBody body = (DapSchema.OutputEventBody) captor.getValue().body();
		assertThat(body.category()).isEqualTo(DapSchema.OutputCategories.STDERR);
		assertThat(body.output()).isEqualTo("Exception in thread \"main\"\n");
	}

	@ParameterizedTest
	@CsvSource({ "'Listening for transport dt_socket at address: 5005', 127.0.0.1, 5005",
			"'Listening for transport dt_socket at address: *:40123', 127.0.0.1, 40123",
			"'Listening for transport dt_socket at address: 0.0.0.0:8000', 127.0.0.1, 8000",
			"'Listening for transport dt_socket at address: debuggee.local:9009', debuggee.local, 9009" })
	void jdwpListeningLineResolvesAddress(String line, String host, int port) {
		this.logger.out(line);

		assertThat(this.addresses).hasSize(1);
		assertThat(this.addresses.get(0).getHostString()).isEqualTo(host);
		assertThat(this.addresses.get(0).getPort()).isEqualTo(port);
	}

	@Test
	void onlyFirstAddressIsDelivered() {
		this.logger.info(DebuggeeLogger.JDWP_LISTENING_PREFIX + "5005");
		this.logger.out(DebuggeeLogger.JDWP_LISTENING_PREFIX + "6006");
		this.logger.resolveAddress(new InetSocketAddress("127.0.0.1", 7007));

		assertThat(this.addresses).hasSize(1);
		assertThat(this.addresses.get(0).getPort()).isEqualTo(5005);
	}

	@ParameterizedTest
	@CsvSource({ "99999", "0", "99999999999", "70000" })
	void invalidPortIsIgnoredAndOutputStillSent(String port) {
		String line = DebuggeeLogger.JDWP_LISTENING_PREFIX + port;

		assertThatCode(() -> this.logger.out(line)).doesNotThrowAnyException();

		assertThat(this.addresses).isEmpty();
		ArgumentCaptor<DapSchema.Event> captor = ArgumentCaptor.forClass(DapSchema.Event.class);
		verify(this.outbound).sendEvent(captor.capture());
		assertThat(((DapSchema.OutputEventBody) captor.getValue().body()).output()).isEqualTo(line + "\n");
	}

	@Test
	void validAddressAfterInvalidOneIsStillResolved() {
		this.logger.out(DebuggeeLogger.JDWP_LISTENING_PREFIX + "99999");
		this.logger.out(DebuggeeLogger.JDWP_LISTENING_PREFIX + "5005");

		assertThat(this.addresses).hasSize(1);
		assertThat(this.addresses.get(0).getPort()).isEqualTo(5005);
	}

	@Test
	void stderrDoesNotResolveAddress() {
		this.logger.err(DebuggeeLogger.JDWP_LISTENING_PREFIX + "5005");

		assertThat(this.addresses).isEmpty();
	}

	@Test
	void diagnosticsAreOnlyLogged() {
		this.logger.warn("slow start");
		this.logger.error("no main class");
		this.logger.debug("classpath resolved");

		verify(this.slf4jLogger).warn("slow start");
		verify(this.slf4jLogger).error("no main class");
		verify(this.slf4jLogger).debug("classpath resolved");
		verify(this.outbound, never()).sendEvent(org.mockito.ArgumentMatchers.any());
	}

}
