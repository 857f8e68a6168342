package com.dcabot.resilience;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Wraps a venue call in the rate limiter and circuit breaker of its operation class and bounds it by an
 * explicit timeout.
 */
@Component
public class VenueCallGuard {

	private static final Logger LOGGER = LoggerFactory.getLogger(VenueCallGuard.class);

	private final CircuitBreakerRegistry breakers;
	private final RateLimiterRegistry limiters;
	private final ResilienceProperties properties;

	public VenueCallGuard(CircuitBreakerRegistry breakers, RateLimiterRegistry limiters,
			ResilienceProperties properties) {
		this.breakers = breakers;
		this.limiters = limiters;
		this.properties = properties;
	}

	public <T> Mono<T> execute(OperationClass operationClass, String label, Supplier<Mono<T>> call) {
		return execute(operationClass, label, properties.callTimeout(), call);
	}

	public <T> Mono<T> execute(OperationClass operationClass, String label, Duration timeout,
			Supplier<Mono<T>> call) {
		CircuitBreaker breaker = breakers.getOrCreate(operationClass.key());
		TokenBucketRateLimiter limiter = limiter(operationClass);
		return limiter.waitFor()
				.then(breaker.call(() -> call.get().timeout(timeout)))
				.doOnError(error -> LOGGER.warn("EVENT=VENUE_CALL_FAIL class={} call={} reason={}",
						operationClass, label, error.toString()));
	}

	public <T> Mono<List<T>> executeMany(OperationClass operationClass, String label, Supplier<Flux<T>> call) {
		return execute(operationClass, label, () -> call.get().collectList());
	}

	public CircuitBreaker breaker(OperationClass operationClass) {
		return breakers.getOrCreate(operationClass.key());
	}

	private TokenBucketRateLimiter limiter(OperationClass operationClass) {
		ResilienceProperties.Limits limits = properties.limitsFor(operationClass);
		return limiters.getOrCreate(operationClass.key(), limits.capacity(), limits.refillRate());
	}
}
