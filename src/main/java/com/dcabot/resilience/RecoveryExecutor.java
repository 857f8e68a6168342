package com.dcabot.resilience;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Runs a reactive operation, categorizes each failure and either schedules another attempt after a
 * backoff delay or gives up with the categorized {@link BotException}.
 *
 * <p>A category budget of {@code n} allows {@code n} retries after the first failure. Independently of
 * the budget an invocation never runs more than {@code maxAttempts} times.
 */
@Component
public class RecoveryExecutor {

	private static final Logger LOGGER = LoggerFactory.getLogger(RecoveryExecutor.class);
	private static final double JITTER_FRACTION = 0.1;
	private static final double CREDENTIAL_RATE_LIMIT = 0.5;
	private static final double ORDER_RATE_LIMIT = 0.8;
	private static final int ORDER_RATE_MIN_WINDOW = 10;

	private final ResilienceProperties.Recovery config;
	private final ErrorStats errorStats;

	public RecoveryExecutor(ResilienceProperties properties) {
		this.config = properties.recovery();
		this.errorStats = new ErrorStats(config.windowSize());
	}

	public <T> Mono<T> executeWithRecovery(String component, String operation, Supplier<Mono<T>> call) {
		return Mono.defer(call)
				.retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
					RecoveryDecision decision = handleError(signal.failure(), component, operation,
							(int) signal.totalRetries());
					if (decision.stop()) {
						LOGGER.error("EVENT=RECOVERY_STOP component={} operation={} category={} reason={}",
								component, operation, decision.error().category(), decision.reason());
						return Mono.error(decision.error());
					}
					LOGGER.warn("EVENT=RECOVERY_RETRY component={} operation={} category={} attempt={} delayMs={} reason={}",
							component, operation, decision.error().category(), signal.totalRetries() + 1,
							decision.delay().toMillis(), decision.error().getMessage());
					return Mono.delay(decision.delay());
				})));
	}

	/**
	 * Records the failure and decides what happens next. {@code attempt} is the zero-based index of the
	 * execution that just failed.
	 */
	public RecoveryDecision handleError(Throwable error, String component, String operation, int attempt) {
		BotException categorized = ErrorClassifier.categorize(error, component, operation)
				.withContext("attempt", attempt);
		errorStats.record(categorized.category());
		String stopReason = stopReason(categorized, attempt);
		if (stopReason != null) {
			return RecoveryDecision.stop(categorized, stopReason);
		}
		return RecoveryDecision.retryAfter(calculateDelay(categorized.category(), attempt), categorized);
	}

	String stopReason(BotException error, int attempt) {
		ErrorCategory category = error.category();
		if (error.fatal()) {
			return "fatal " + category + " error";
		}
		if (!error.retryable()) {
			return "non-retryable " + category + " error";
		}
		if (attempt + 1 >= config.maxAttempts()) {
			return "attempt cap " + config.maxAttempts() + " reached";
		}
		Integer budget = config.maxRetries().get(category);
		if (budget != null && attempt >= budget) {
			return "retry budget " + budget + " exhausted for " + category;
		}
		if (errorStats.recentCount(category) >= config.hotLoopThreshold()) {
			return "too many recent " + category + " errors";
		}
		if (errorStats.windowRate(ErrorCategory.CREDENTIALS) > CREDENTIAL_RATE_LIMIT) {
			return "credential error rate above " + CREDENTIAL_RATE_LIMIT;
		}
		if (errorStats.windowSize() > ORDER_RATE_MIN_WINDOW
				&& errorStats.windowRate(ErrorCategory.ORDER) > ORDER_RATE_LIMIT) {
			return "order error rate above " + ORDER_RATE_LIMIT;
		}
		return null;
	}

	public Duration calculateDelay(ErrorCategory category, int attempt) {
		long baseMillis = category == ErrorCategory.RATE_LIMIT
				? config.rateLimitDelay().toMillis()
				: config.baseDelay().toMillis();
		double delayMillis = switch (config.strategy()) {
			case EXPONENTIAL -> baseMillis * Math.pow(config.multiplier(), attempt);
			case LINEAR -> baseMillis * (double) (attempt + 1);
			case FIXED -> baseMillis;
		};
		long capped = (long) Math.min(delayMillis, config.maxDelay().toMillis());
		capped = Math.min(capped, config.maxBackoff().toMillis());
		if (config.jitter() && capped > 0) {
			long jitterBound = (long) (capped * JITTER_FRACTION);
			if (jitterBound > 0) {
				capped += ThreadLocalRandom.current().nextLong(jitterBound);
			}
		}
		return Duration.ofMillis(capped);
	}

	public ErrorStats errorStats() {
		return errorStats;
	}
}
