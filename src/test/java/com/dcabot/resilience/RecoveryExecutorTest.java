package com.dcabot.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.dcabot.exchange.VenueApiException;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class RecoveryExecutorTest {

	private final AtomicInteger invocations = new AtomicInteger();

	@Test
	void fatalErrorStopsAfterSingleAttempt() {
		RecoveryExecutor executor = executor(ResilienceProperties.Recovery.defaults().withoutDelays());

		StepVerifier.create(executor.executeWithRecovery("venue", "placeOrder",
				() -> failWith(new VenueApiException(10003, 200, "invalid api key"))))
				.expectErrorSatisfies(error -> {
					assertThat(error).isInstanceOf(BotException.class);
					assertThat(((BotException) error).category()).isEqualTo(ErrorCategory.CREDENTIALS);
				})
				.verify();
		assertThat(invocations).hasValue(1);
	}

	@Test
	void timeoutBudgetAllowsThreeRetries() {
		RecoveryExecutor executor = executor(ResilienceProperties.Recovery.defaults().withoutDelays());

		StepVerifier.create(executor.executeWithRecovery("venue", "getPositions",
				() -> failWith(new TimeoutException("read timed out"))))
				.expectError(BotException.class)
				.verify();
		assertThat(invocations).hasValue(4);
	}

	@Test
	void transientFailuresRecover() {
		RecoveryExecutor executor = executor(ResilienceProperties.Recovery.defaults().withoutDelays());

		Mono<String> result = executor.executeWithRecovery("venue", "getPrice", () -> {
			if (invocations.incrementAndGet() < 3) {
				return Mono.error(new ConnectException("connection refused"));
			}
			return Mono.just("42000");
		});

		StepVerifier.create(result).expectNext("42000").verifyComplete();
		assertThat(invocations).hasValue(3);
	}

	@Test
	void validationErrorIsNotRetried() {
		RecoveryExecutor executor = executor(ResilienceProperties.Recovery.defaults().withoutDelays());

		StepVerifier.create(executor.executeWithRecovery("entry", "placeOrder",
				() -> failWith(new IllegalArgumentException("invalid quantity"))))
				.expectErrorSatisfies(error -> assertThat(((BotException) error).category())
						.isEqualTo(ErrorCategory.VALIDATION))
				.verify();
		assertThat(invocations).hasValue(1);
	}

	@Test
	void hotLoopProtectionStopsOnTenRecentErrorsOfSameCategory() {
		RecoveryExecutor executor = executor(ResilienceProperties.Recovery.defaults().withoutDelays());
		for (int i = 0; i < 9; i++) {
			executor.errorStats().record(ErrorCategory.NETWORK);
		}

		RecoveryDecision decision = executor.handleError(new ConnectException("connection reset"), "venue",
				"getPositions", 0);

		assertThat(decision.stop()).isTrue();
		assertThat(decision.reason()).contains("too many recent");
	}

	@Test
	void highCredentialRateStopsOtherwiseRetryableErrors() {
		RecoveryExecutor executor = executor(ResilienceProperties.Recovery.defaults().withoutDelays());
		for (int i = 0; i < 6; i++) {
			executor.errorStats().record(ErrorCategory.CREDENTIALS);
		}

		RecoveryDecision decision = executor.handleError(new IllegalStateException("something odd"), "venue",
				"getPositions", 0);

		assertThat(decision.error().category()).isEqualTo(ErrorCategory.TEMPORARY);
		assertThat(decision.stop()).isTrue();
		assertThat(decision.reason()).contains("credential");
	}

	@Test
	void highOrderRateStopsOnlyWithLargeWindow() {
		RecoveryExecutor executor = executor(ResilienceProperties.Recovery.defaults().withoutDelays());
		recordTimes(executor, ErrorCategory.ORDER, 8);
		executor.errorStats().record(ErrorCategory.NETWORK);

		RecoveryDecision small = executor.handleError(new ConnectException("connection reset"), "venue", "op", 0);
		assertThat(small.stop()).isFalse();

		recordTimes(executor, ErrorCategory.ORDER, 8);
		RecoveryDecision flooded = executor.handleError(new TimeoutException("timed out"), "venue", "op", 0);

		assertThat(flooded.stop()).isTrue();
		assertThat(flooded.reason()).contains("order error rate");
	}

	@Test
	void rateLimitDelayUsesThirtySecondBase() {
		RecoveryExecutor executor = executor(noJitter(BackoffStrategy.FIXED));

		assertThat(executor.calculateDelay(ErrorCategory.RATE_LIMIT, 0)).isEqualTo(Duration.ofSeconds(30));
		assertThat(executor.calculateDelay(ErrorCategory.NETWORK, 0)).isEqualTo(Duration.ofSeconds(1));
	}

	@Test
	void exponentialAndLinearDelaysAreCapped() {
		RecoveryExecutor exponential = executor(noJitter(BackoffStrategy.EXPONENTIAL));
		RecoveryExecutor linear = executor(noJitter(BackoffStrategy.LINEAR));

		assertThat(exponential.calculateDelay(ErrorCategory.NETWORK, 2)).isEqualTo(Duration.ofMillis(2_250));
		assertThat(exponential.calculateDelay(ErrorCategory.NETWORK, 20)).isEqualTo(Duration.ofSeconds(30));
		assertThat(linear.calculateDelay(ErrorCategory.TIMEOUT, 2)).isEqualTo(Duration.ofSeconds(3));
	}

	@Test
	void jitterAddsAtMostTenPercent() {
		RecoveryExecutor executor = executor(ResilienceProperties.Recovery.defaults());

		Duration delay = executor.calculateDelay(ErrorCategory.RATE_LIMIT, 0);

		assertThat(delay).isBetween(Duration.ofSeconds(30), Duration.ofSeconds(33));
	}

	private static void recordTimes(RecoveryExecutor executor, ErrorCategory category, int times) {
		for (int i = 0; i < times; i++) {
			executor.errorStats().record(category);
		}
	}

	private Mono<String> failWith(Throwable error) {
		invocations.incrementAndGet();
		return Mono.error(error);
	}

	private static ResilienceProperties.Recovery noJitter(BackoffStrategy strategy) {
		return new ResilienceProperties.Recovery(10, null, null, null, null, strategy, 1.5, false, 50, 10, null);
	}

	private static RecoveryExecutor executor(ResilienceProperties.Recovery recovery) {
		return new RecoveryExecutor(new ResilienceProperties(null, null, null, null, recovery, null, null));
	}
}
