package com.dcabot.resilience;

public record RateLimiterStats(
		String name,
		int capacity,
		int tokens,
		int refillRate,
		long lastRefillMillis) {
}
