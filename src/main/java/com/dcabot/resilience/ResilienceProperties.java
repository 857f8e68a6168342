package com.dcabot.resilience;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bot.resilience")
public record ResilienceProperties(
		Breaker circuitBreaker,
		Limits trading,
		Limits marketData,
		Limits accountData,
		Recovery recovery,
		Duration callTimeout,
		Duration batchTimeout) {

	public ResilienceProperties {
		circuitBreaker = circuitBreaker == null ? Breaker.defaults() : circuitBreaker;
		trading = trading == null ? new Limits(10, 5) : trading;
		marketData = marketData == null ? new Limits(20, 10) : marketData;
		accountData = accountData == null ? new Limits(10, 5) : accountData;
		recovery = recovery == null ? Recovery.defaults() : recovery;
		callTimeout = callTimeout == null ? Duration.ofSeconds(30) : callTimeout;
		batchTimeout = batchTimeout == null ? Duration.ofSeconds(90) : batchTimeout;
	}

	public static ResilienceProperties defaults() {
		return new ResilienceProperties(null, null, null, null, null, null, null);
	}

	public Limits limitsFor(OperationClass operationClass) {
		return switch (operationClass) {
			case TRADING -> trading;
			case MARKET_DATA -> marketData;
			case ACCOUNT_DATA -> accountData;
		};
	}

	public record Breaker(
			int failureThreshold,
			int successThreshold,
			Duration timeout,
			int maxFailures,
			Duration resetTimeout) {

		public static Breaker defaults() {
			return new Breaker(5, 3, Duration.ofSeconds(30), 10, Duration.ofMinutes(5));
		}

		public CircuitBreakerConfig toConfig() {
			return new CircuitBreakerConfig(failureThreshold, successThreshold, timeout, maxFailures, resetTimeout);
		}
	}

	public record Limits(int capacity, int refillRate) {
	}

	public record Recovery(
			int maxAttempts,
			Duration baseDelay,
			Duration maxDelay,
			Duration maxBackoff,
			Duration rateLimitDelay,
			BackoffStrategy strategy,
			double multiplier,
			boolean jitter,
			int windowSize,
			int hotLoopThreshold,
			Map<ErrorCategory, Integer> maxRetries) {

		public Recovery {
			maxAttempts = maxAttempts <= 0 ? 10 : maxAttempts;
			baseDelay = baseDelay == null ? Duration.ofSeconds(1) : baseDelay;
			maxDelay = maxDelay == null ? Duration.ofSeconds(30) : maxDelay;
			maxBackoff = maxBackoff == null ? Duration.ofMinutes(5) : maxBackoff;
			rateLimitDelay = rateLimitDelay == null ? Duration.ofSeconds(30) : rateLimitDelay;
			strategy = strategy == null ? BackoffStrategy.EXPONENTIAL : strategy;
			multiplier = multiplier <= 0 ? 1.5 : multiplier;
			windowSize = windowSize <= 0 ? 50 : windowSize;
			hotLoopThreshold = hotLoopThreshold <= 0 ? 10 : hotLoopThreshold;
			Map<ErrorCategory, Integer> merged = defaultRetries();
			if (maxRetries != null) {
				merged.putAll(maxRetries);
			}
			maxRetries = Map.copyOf(merged);
		}

		public static Recovery defaults() {
			return new Recovery(10, null, null, null, null, BackoffStrategy.EXPONENTIAL, 1.5, true, 50, 10, null);
		}

		public Recovery withoutDelays() {
			return new Recovery(maxAttempts, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, strategy,
					multiplier, false, windowSize, hotLoopThreshold, maxRetries);
		}

		private static Map<ErrorCategory, Integer> defaultRetries() {
			Map<ErrorCategory, Integer> retries = new EnumMap<>(ErrorCategory.class);
			retries.put(ErrorCategory.NETWORK, 5);
			retries.put(ErrorCategory.TIMEOUT, 3);
			retries.put(ErrorCategory.TEMPORARY, 3);
			retries.put(ErrorCategory.RATE_LIMIT, 10);
			retries.put(ErrorCategory.ORDER, 2);
			retries.put(ErrorCategory.POSITION, 3);
			retries.put(ErrorCategory.STRATEGY, 1);
			return retries;
		}
	}
}
