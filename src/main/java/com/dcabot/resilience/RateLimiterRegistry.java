package com.dcabot.resilience;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

@Component
public class RateLimiterRegistry {

	private final Map<String, TokenBucketRateLimiter> limiters = new LinkedHashMap<>();

	public synchronized TokenBucketRateLimiter getOrCreate(String name, int capacity, int refillRate) {
		return limiters.computeIfAbsent(name, key -> new TokenBucketRateLimiter(key, capacity, refillRate));
	}

	public synchronized TokenBucketRateLimiter get(String name) {
		return limiters.get(name);
	}

	public synchronized List<RateLimiterStats> stats() {
		return limiters.values().stream().map(TokenBucketRateLimiter::stats).toList();
	}
}
