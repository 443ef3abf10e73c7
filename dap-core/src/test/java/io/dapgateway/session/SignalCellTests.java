/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.session;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class SignalCellTests {

	@Test
	void firstSettlementWins() {
		SignalCell<ExitStatus> cell = new SignalCell<>("exitStatus");

		assertThat(cell.trySettle(ExitStatus.RESTARTED)).isTrue();
		assertThat(cell.trySettle(ExitStatus.TERMINATED)).isFalse();

		assertThat(cell.isSettled()).isTrue();
		StepVerifier.create(cell.asMono()).expectNext(ExitStatus.RESTARTED).verifyComplete();
	}

	@Test
	void nullSettlesWithoutValue() {
		SignalCell<Void> cell = new SignalCell<>("endOfConnection");

		assertThat(cell.trySettle(null)).isTrue();

		StepVerifier.create(cell.asMono()).verifyComplete();
		assertThat(cell.toString()).isEqualTo("SignalCell{endOfConnection, settled}");
	}

	@Test
	void subscribersBeforeSettlementAreCompleted() {
		SignalCell<String> cell = new SignalCell<>("address");

		StepVerifier.create(cell.asMono())
			.expectSubscription()
			.then(() -> cell.trySettle("127.0.0.1:5005"))
			.expectNext("127.0.0.1:5005")
			.expectComplete()
			.verify(Duration.ofSeconds(1));
	}

	@Test
	void concurrentSettlementsHaveSingleWinner() throws InterruptedException {
		SignalCell<Integer> cell = new SignalCell<>("race");
		List<Integer> winners = new CopyOnWriteArrayList<>();
		CountDownLatch gate = new CountDownLatch(1);
		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			for (int i = 0; i < 8; i++) {
				int value = i;
				executor.execute(() -> {
					try {
						gate.await();
						if (cell.trySettle(value)) {
							winners.add(value);
						}
					}
					catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
				});
			}
			gate.countDown();
		}
		finally {
			executor.shutdown();
			assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
		}

		assertThat(winners).hasSize(1);
		assertThat(cell.asMono().block(Duration.ofSeconds(1))).isEqualTo(winners.get(0));
	}

}
