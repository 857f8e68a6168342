package com.dcabot.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Candle interval parsing and UTC wall-clock boundary alignment.
 */
public final class IntervalAlignment {

	private static final Logger LOGGER = LoggerFactory.getLogger(IntervalAlignment.class);
	private static final Duration FALLBACK = Duration.ofMinutes(5);

	private IntervalAlignment() {
	}

	/**
	 * Accepts {@code Nm}, {@code Nh}, {@code Nd} and bare minute counts. Anything else falls back to five
	 * minutes.
	 */
	public static Duration parse(String interval) {
		String normalized = interval == null ? "" : interval.trim().toLowerCase(Locale.ROOT);
		try {
			if (normalized.equals("d")) {
				return Duration.ofDays(1);
			}
			if (normalized.endsWith("m")) {
				return positive(Duration.ofMinutes(Long.parseLong(strip(normalized))));
			}
			if (normalized.endsWith("h")) {
				return positive(Duration.ofHours(Long.parseLong(strip(normalized))));
			}
			if (normalized.endsWith("d")) {
				return positive(Duration.ofDays(Long.parseLong(strip(normalized))));
			}
			return positive(Duration.ofMinutes(Long.parseLong(normalized)));
		} catch (IllegalArgumentException ex) {
			LOGGER.warn("EVENT=INTERVAL_UNKNOWN interval='{}' fallback={}", interval, FALLBACK);
			return FALLBACK;
		}
	}

	private static String strip(String value) {
		return value.substring(0, value.length() - 1);
	}

	private static Duration positive(Duration duration) {
		if (duration.isZero() || duration.isNegative()) {
			throw new IllegalArgumentException("interval must be positive");
		}
		return duration;
	}

	/**
	 * First boundary strictly after {@code now}, counted from the UTC epoch.
	 */
	public static Instant nextBoundary(Instant now, Duration interval) {
		long step = interval.toMillis();
		long current = now.toEpochMilli();
		return Instant.ofEpochMilli(Math.floorDiv(current, step) * step + step);
	}

	public static Duration untilNextBoundary(Instant now, Duration interval) {
		return Duration.between(now, nextBoundary(now, interval));
	}
}
