package com.dcabot.resilience;

public record CircuitBreakerStats(
		String name,
		CircuitState state,
		int failures,
		int successes,
		long lastFailureMillis,
		long nextAttemptMillis) {
}
