package com.dcabot.resilience;

import java.time.Duration;

/**
 * Thresholds of a {@link CircuitBreaker}. {@code maxFailures} is the secondary counter that reopens the
 * breaker with a doubled timeout once failures keep piling up across half-open probes.
 */
public record CircuitBreakerConfig(
		int failureThreshold,
		int successThreshold,
		Duration timeout,
		int maxFailures,
		Duration resetTimeout) {

	public CircuitBreakerConfig {
		if (failureThreshold <= 0) {
			failureThreshold = 5;
		}
		if (successThreshold <= 0) {
			successThreshold = 3;
		}
		if (timeout == null || timeout.isZero() || timeout.isNegative()) {
			timeout = Duration.ofSeconds(30);
		}
		if (maxFailures <= 0) {
			maxFailures = 10;
		}
		if (resetTimeout == null || resetTimeout.isZero() || resetTimeout.isNegative()) {
			resetTimeout = Duration.ofMinutes(5);
		}
	}

	public static CircuitBreakerConfig defaults() {
		return new CircuitBreakerConfig(5, 3, Duration.ofSeconds(30), 10, Duration.ofMinutes(5));
	}
}
