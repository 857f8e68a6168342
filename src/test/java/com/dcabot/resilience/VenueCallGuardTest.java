package com.dcabot.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class VenueCallGuardTest {

	private final ResilienceProperties properties = ResilienceProperties.defaults();
	private final CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(properties);
	private final VenueCallGuard guard = new VenueCallGuard(breakers, new RateLimiterRegistry(), properties);

	@Test
	void slowCallFailsWithTimeout() {
		StepVerifier.withVirtualTime(() -> guard.execute(OperationClass.MARKET_DATA, "getLatestPrice",
				Duration.ofSeconds(5), () -> Mono.never()))
				.thenAwait(Duration.ofSeconds(6))
				.expectError(TimeoutException.class)
				.verify();
	}

	@Test
	void fluxCallsAreCollected() {
		StepVerifier.create(guard.executeMany(OperationClass.ACCOUNT_DATA, "getPositions",
				() -> Flux.just("a", "b")))
				.expectNextMatches(list -> list.size() == 2)
				.verifyComplete();
	}

	@Test
	void repeatedFailuresOpenTheClassBreaker() {
		for (int i = 0; i < 5; i++) {
			StepVerifier.create(guard.execute(OperationClass.TRADING, "placeOrder",
					() -> Mono.error(new IllegalStateException("rejected"))))
					.expectError(IllegalStateException.class)
					.verify();
		}

		assertThat(breakers.hasOpenCircuits()).isTrue();
		assertThat(breakers.openCircuits()).containsExactly("trading");
		StepVerifier.create(guard.execute(OperationClass.TRADING, "placeOrder", () -> Mono.just("never")))
				.expectError(CircuitBreakerOpenException.class)
				.verify();
	}
}
