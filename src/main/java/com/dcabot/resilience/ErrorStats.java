package com.dcabot.resilience;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rolling window of the most recent categorized errors, shared by every recovery invocation.
 */
public class ErrorStats {

	private final int capacity;
	private final Deque<ErrorCategory> recent = new ArrayDeque<>();
	private final Map<ErrorCategory, Long> totalsByCategory = new EnumMap<>(ErrorCategory.class);
	private long totalErrors;

	public ErrorStats(int capacity) {
		this.capacity = capacity <= 0 ? 50 : capacity;
	}

	public synchronized void record(ErrorCategory category) {
		totalErrors++;
		totalsByCategory.merge(category, 1L, Long::sum);
		recent.addLast(category);
		while (recent.size() > capacity) {
			recent.removeFirst();
		}
	}

	public synchronized int recentCount(ErrorCategory category) {
		int count = 0;
		for (ErrorCategory entry : recent) {
			if (entry == category) {
				count++;
			}
		}
		return count;
	}

	public synchronized int windowSize() {
		return recent.size();
	}

	public synchronized double windowRate(ErrorCategory category) {
		if (recent.isEmpty()) {
			return 0.0;
		}
		return (double) recentCount(category) / recent.size();
	}

	public synchronized long totalErrors() {
		return totalErrors;
	}

	public synchronized long total(ErrorCategory category) {
		return totalsByCategory.getOrDefault(category, 0L);
	}

	public synchronized void clear() {
		recent.clear();
		totalsByCategory.clear();
		totalErrors = 0;
	}
}
