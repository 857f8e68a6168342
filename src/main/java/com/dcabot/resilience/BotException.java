package com.dcabot.resilience;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Categorized failure of a bot operation. Carries enough context for the recovery executor to
 * decide between retrying, waiting and giving up.
 */
public class BotException extends RuntimeException {

	private final ErrorCategory category;
	private final String component;
	private final String operation;
	private final String detail;
	private final boolean retryable;
	private final Map<String, Object> context;

	public BotException(ErrorCategory category, String component, String operation, String detail) {
		this(category, component, operation, detail, null, category.retryable(), Map.of());
	}

	public BotException(ErrorCategory category, String component, String operation, String detail,
			Throwable cause) {
		this(category, component, operation, detail, cause, category.retryable(), Map.of());
	}

	private BotException(ErrorCategory category, String component, String operation, String detail,
			Throwable cause, boolean retryable, Map<String, Object> context) {
		super(format(category, component, operation, detail, cause), cause);
		this.category = category;
		this.component = component;
		this.operation = operation;
		this.detail = detail;
		this.retryable = retryable;
		this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
	}

	public static BotException wrap(Throwable cause, ErrorCategory category, String component, String operation) {
		return new BotException(category, component, operation, "operation failed", cause);
	}

	public BotException withRetryable(boolean value) {
		return new BotException(category, component, operation, detail, getCause(), value, context);
	}

	public BotException withContext(String key, Object value) {
		Map<String, Object> merged = new LinkedHashMap<>(context);
		merged.put(key, value);
		return new BotException(category, component, operation, detail, getCause(), retryable, merged);
	}

	public ErrorCategory category() {
		return category;
	}

	public String component() {
		return component;
	}

	public String operation() {
		return operation;
	}

	public String detail() {
		return detail;
	}

	public boolean retryable() {
		return retryable;
	}

	public boolean fatal() {
		return category.fatal();
	}

	public Map<String, Object> context() {
		return context;
	}

	private static String format(ErrorCategory category, String component, String operation, String detail,
			Throwable cause) {
		String base = "[" + category + ":" + component + "] " + operation + ": " + detail;
		if (cause == null) {
			return base;
		}
		return base + " (" + cause.getMessage() + ")";
	}
}
