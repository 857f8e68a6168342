package com.dcabot.resilience;

import java.util.function.LongSupplier;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Closed/open/half-open gate around a reactive call.
 *
 * <p>All counters and the state live behind the instance monitor. State-change listeners run on the
 * notification scheduler, never on the calling thread, so a slow listener cannot stall admission.
 */
public class CircuitBreaker {

	private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreaker.class);

	private final String name;
	private final CircuitBreakerConfig config;
	private final LongSupplier clock;
	private final Scheduler notificationScheduler;

	private CircuitState state = CircuitState.CLOSED;
	private int failures;
	private int successes;
	private long lastFailureMillis;
	private long nextAttemptMillis;
	private Throwable lastFailure;
	private volatile CircuitStateListener listener;

	public CircuitBreaker(String name, CircuitBreakerConfig config) {
		this(name, config, System::currentTimeMillis, Schedulers.boundedElastic());
	}

	public CircuitBreaker(String name, CircuitBreakerConfig config, LongSupplier clock,
			Scheduler notificationScheduler) {
		this.name = name;
		this.config = config;
		this.clock = clock;
		this.notificationScheduler = notificationScheduler;
	}

	public void setListener(CircuitStateListener listener) {
		this.listener = listener;
	}

	public <T> Mono<T> call(Supplier<Mono<T>> operation) {
		return Mono.defer(() -> {
			if (!tryAcquire()) {
				return Mono.error(new CircuitBreakerOpenException(name, lastFailure()));
			}
			return Mono.defer(operation)
					.doOnSuccess(ignored -> recordSuccess())
					.doOnError(this::recordFailure);
		});
	}

	synchronized boolean tryAcquire() {
		switch (state) {
			case CLOSED:
			case HALF_OPEN:
				return true;
			case OPEN:
				if (clock.getAsLong() >= nextAttemptMillis) {
					transition(CircuitState.HALF_OPEN);
					successes = 0;
					return true;
				}
				return false;
			default:
				return false;
		}
	}

	synchronized void recordSuccess() {
		failures = 0;
		if (state == CircuitState.HALF_OPEN) {
			successes++;
			if (successes >= config.successThreshold()) {
				toClosed();
			}
		} else if (state == CircuitState.OPEN) {
			toClosed();
		}
	}

	synchronized void recordFailure(Throwable error) {
		long now = clock.getAsLong();
		failures++;
		lastFailure = error;
		lastFailureMillis = now;
		switch (state) {
			case CLOSED:
				if (failures >= config.failureThreshold()) {
					toOpen(now);
				}
				break;
			case HALF_OPEN:
				toOpen(now);
				break;
			case OPEN:
				nextAttemptMillis = now + config.timeout().toMillis();
				break;
			default:
				break;
		}
		if (failures >= config.maxFailures()) {
			toOpen(now);
			nextAttemptMillis = now + config.timeout().toMillis() * 2;
		}
	}

	public synchronized void reset() {
		toClosed();
	}

	public synchronized void forceOpen() {
		toOpen(clock.getAsLong());
	}

	public synchronized CircuitState state() {
		return state;
	}

	public synchronized CircuitBreakerStats stats() {
		return new CircuitBreakerStats(name, state, failures, successes, lastFailureMillis, nextAttemptMillis);
	}

	public String name() {
		return name;
	}

	synchronized Throwable lastFailure() {
		return lastFailure;
	}

	private void toClosed() {
		transition(CircuitState.CLOSED);
		failures = 0;
		successes = 0;
		lastFailure = null;
	}

	private void toOpen(long now) {
		transition(CircuitState.OPEN);
		nextAttemptMillis = now + config.timeout().toMillis();
		successes = 0;
	}

	private void transition(CircuitState next) {
		CircuitState previous = state;
		state = next;
		if (previous == next) {
			return;
		}
		LOGGER.info("EVENT=CIRCUIT_STATE breaker={} from={} to={} failures={}", name, previous, next, failures);
		CircuitStateListener current = listener;
		if (current != null) {
			notificationScheduler.schedule(() -> notifyListener(current, previous, next));
		}
	}

	private void notifyListener(CircuitStateListener current, CircuitState from, CircuitState to) {
		try {
			current.onStateChange(name, from, to);
		} catch (RuntimeException ex) {
			LOGGER.warn("EVENT=CIRCUIT_LISTENER_FAIL breaker={} reason={}", name, ex.getMessage());
		}
	}
}
