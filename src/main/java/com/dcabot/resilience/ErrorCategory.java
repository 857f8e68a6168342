package com.dcabot.resilience;

public enum ErrorCategory {

	NETWORK(true),
	TIMEOUT(true),
	TEMPORARY(true),
	RATE_LIMIT(true),
	ORDER(true),
	POSITION(true),
	STRATEGY(true),
	VALIDATION(false),
	CREDENTIALS(false),
	FATAL(false);

	private final boolean retryable;

	ErrorCategory(boolean retryable) {
		this.retryable = retryable;
	}

	public boolean retryable() {
		return retryable;
	}

	public boolean fatal() {
		return this == FATAL || this == CREDENTIALS;
	}
}
