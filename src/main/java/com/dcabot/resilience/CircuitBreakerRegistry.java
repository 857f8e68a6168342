package com.dcabot.resilience;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CircuitBreakerRegistry {

	private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

	private final CircuitBreakerConfig defaultConfig;
	private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();

	public CircuitBreakerRegistry(ResilienceProperties properties) {
		this.defaultConfig = properties.circuitBreaker().toConfig();
	}

	public synchronized CircuitBreaker getOrCreate(String name) {
		return breakers.computeIfAbsent(name, key -> {
			CircuitBreaker breaker = new CircuitBreaker(key, defaultConfig);
			breaker.setListener((breakerName, from, to) -> LOGGER.info(
					"EVENT=CIRCUIT_TRANSITION_NOTIFIED breaker={} from={} to={}", breakerName, from, to));
			return breaker;
		});
	}

	public synchronized CircuitBreaker register(CircuitBreaker breaker) {
		breakers.put(breaker.name(), breaker);
		return breaker;
	}

	public synchronized boolean hasOpenCircuits() {
		return breakers.values().stream().anyMatch(breaker -> breaker.state() == CircuitState.OPEN);
	}

	public synchronized List<String> openCircuits() {
		List<String> open = new ArrayList<>();
		breakers.forEach((name, breaker) -> {
			if (breaker.state() == CircuitState.OPEN) {
				open.add(name);
			}
		});
		return open;
	}

	public synchronized List<CircuitBreakerStats> stats() {
		return breakers.values().stream().map(CircuitBreaker::stats).toList();
	}

	public synchronized void resetAll() {
		breakers.values().forEach(CircuitBreaker::reset);
	}
}
