package com.dcabot.resilience;

/**
 * Rejection by an open breaker. The cause, when present, is the last failure recorded before the
 * rejection.
 */
public class CircuitBreakerOpenException extends RuntimeException {

	private final String breakerName;

	public CircuitBreakerOpenException(String breakerName) {
		this(breakerName, null);
	}

	public CircuitBreakerOpenException(String breakerName, Throwable lastFailure) {
		super("circuit breaker " + breakerName + " is open", lastFailure);
		this.breakerName = breakerName;
	}

	public String breakerName() {
		return breakerName;
	}
}
