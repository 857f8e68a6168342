package com.dcabot.exchange;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Parses the string-encoded decimals the venue returns. Placeholders such as {@code ""}, {@code "null"},
 * {@code "undefined"} and {@code "NaN"} are rejected instead of being read as zero.
 */
public final class NumericParser {

	private static final Set<String> PLACEHOLDERS = Set.of("null", "undefined", "nan");

	private NumericParser() {
	}

	public static BigDecimal parse(String raw, String field) {
		if (raw == null) {
			throw new NumberFormatException("missing numeric field " + field);
		}
		String trimmed = raw.trim();
		if (trimmed.isEmpty() || PLACEHOLDERS.contains(trimmed.toLowerCase(Locale.ROOT))) {
			throw new NumberFormatException("invalid numeric field " + field + ": '" + raw + "'");
		}
		try {
			return new BigDecimal(trimmed);
		} catch (NumberFormatException ex) {
			throw new NumberFormatException("invalid numeric field " + field + ": '" + raw + "'");
		}
	}

	public static BigDecimal parseOrNull(String raw) {
		try {
			return parse(raw, "value");
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	public static BigDecimal parseOrZero(String raw) {
		BigDecimal value = parseOrNull(raw);
		return value == null ? BigDecimal.ZERO : value;
	}
}
