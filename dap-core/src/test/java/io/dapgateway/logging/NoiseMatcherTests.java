/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NoiseMatcherTests {

	@Test
	void socketClosedOnlyMatchesAfterDebuggeeFinished() {
		NoiseMatcher matcher = NoiseMatcher.socketClosed();
		String message = "Read loop failed: java.net.SocketException: Socket closed";

		assertThat(matcher.matches(message, false)).isFalse();
		assertThat(matcher.matches(message, true)).isTrue();
		assertThat(matcher.matches("java.net.SocketException: Socket closed by peer", true)).isFalse();
	}

	@Test
	void recordingWhenVmDisconnectedMatchesPrefixAnyTime() {
		NoiseMatcher matcher = NoiseMatcher.recordingWhenVmDisconnected();

		assertThat(matcher.matches(NoiseMatcher.RECORDING_WHEN_VM_DISCONNECTED + " at Foo.bar", false)).isTrue();
		assertThat(matcher.matches("Unexpected " + NoiseMatcher.RECORDING_WHEN_VM_DISCONNECTED, true)).isFalse();
	}

	@Test
	void nullMessageNeverMatches() {
		assertThat(NoiseMatcher.prefix("x").matches(null, true)).isFalse();
	}

	@Test
	void literalMustHaveText() {
		assertThatThrownBy(() -> NoiseMatcher.suffix(" ")).isInstanceOf(IllegalArgumentException.class);
	}

}
