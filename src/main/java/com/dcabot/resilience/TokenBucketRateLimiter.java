package com.dcabot.resilience;

import java.time.Duration;
import java.util.function.LongSupplier;

import reactor.core.publisher.Mono;

/**
 * Token bucket that refills in whole seconds only: an elapsed time under one second adds nothing and
 * leaves the refill timestamp where it was.
 */
public class TokenBucketRateLimiter {

	private static final long WAIT_BUFFER_MS = 100L;

	private final String name;
	private final int capacity;
	private final int refillRate;
	private final LongSupplier clock;

	private int tokens;
	private long lastRefillMillis;

	public TokenBucketRateLimiter(String name, int capacity, int refillRate) {
		this(name, capacity, refillRate, System::currentTimeMillis);
	}

	public TokenBucketRateLimiter(String name, int capacity, int refillRate, LongSupplier clock) {
		if (capacity <= 0 || refillRate <= 0) {
			throw new IllegalArgumentException("capacity and refillRate must be positive");
		}
		this.name = name;
		this.capacity = capacity;
		this.refillRate = refillRate;
		this.clock = clock;
		this.tokens = capacity;
		this.lastRefillMillis = clock.getAsLong();
	}

	public boolean allow() {
		return allowN(1);
	}

	public synchronized boolean allowN(int n) {
		refill();
		if (tokens >= n) {
			tokens -= n;
			return true;
		}
		return false;
	}

	public Mono<Void> waitFor() {
		return waitN(1);
	}

	/**
	 * Completes once {@code n} tokens were taken. Cancelling the subscription abandons the wait.
	 */
	public Mono<Void> waitN(int n) {
		if (n > capacity) {
			return Mono.error(new IllegalArgumentException(
					"requested " + n + " tokens from limiter " + name + " with capacity " + capacity));
		}
		return Mono.defer(() -> {
			if (allowN(n)) {
				return Mono.<Void>empty();
			}
			return Mono.delay(waitTime(n)).then(waitN(n));
		});
	}

	synchronized Duration waitTime(int n) {
		refill();
		if (tokens >= n) {
			return Duration.ZERO;
		}
		double seconds = (double) (n - tokens) / refillRate;
		return Duration.ofMillis((long) (seconds * 1000) + WAIT_BUFFER_MS);
	}

	public synchronized RateLimiterStats stats() {
		refill();
		return new RateLimiterStats(name, capacity, tokens, refillRate, lastRefillMillis);
	}

	public String name() {
		return name;
	}

	private void refill() {
		long now = clock.getAsLong();
		long elapsedSeconds = (now - lastRefillMillis) / 1000L;
		if (elapsedSeconds < 1) {
			return;
		}
		long added = elapsedSeconds * refillRate;
		tokens = (int) Math.min(capacity, tokens + added);
		lastRefillMillis = now;
	}
}
