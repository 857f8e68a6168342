package com.dcabot.resilience;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.dcabot.exchange.VenueApiException;

/**
 * Maps arbitrary failures onto an {@link ErrorCategory}. Typed causes are checked before the
 * message heuristics.
 */
public final class ErrorClassifier {

	private static final int RATE_LIMIT_HTTP = 429;

	private ErrorClassifier() {
	}

	public static BotException categorize(Throwable error, String component, String operation) {
		if (error instanceof BotException botException) {
			return botException;
		}
		ErrorCategory typed = categorizeByType(error);
		if (typed != null) {
			BotException wrapped = BotException.wrap(error, typed, component, operation);
			if (error instanceof VenueApiException venueError && isInsufficientBalance(venueError.code())) {
				return wrapped.withRetryable(false);
			}
			return wrapped;
		}
		return categorizeByMessage(error, component, operation);
	}

	private static ErrorCategory categorizeByType(Throwable error) {
		if (error instanceof CircuitBreakerOpenException) {
			return rejectedCredentials(error.getCause()) ? ErrorCategory.CREDENTIALS : ErrorCategory.TEMPORARY;
		}
		if (error instanceof TimeoutException) {
			return ErrorCategory.TIMEOUT;
		}
		if (error instanceof ConnectException || error instanceof UnknownHostException
				|| error instanceof WebClientRequestException) {
			return ErrorCategory.NETWORK;
		}
		if (error instanceof WebClientResponseException responseError) {
			return categorizeHttpStatus(responseError.getStatusCode().value());
		}
		if (error instanceof VenueApiException venueError) {
			ErrorCategory byCode = categorizeVenueCode(venueError.code());
			if (byCode != null) {
				return byCode;
			}
			return categorizeHttpStatus(venueError.httpStatus());
		}
		return null;
	}

	// A breaker tripped by rejected credentials keeps that category.
	private static boolean rejectedCredentials(Throwable lastFailure) {
		if (lastFailure == null || lastFailure instanceof CircuitBreakerOpenException) {
			return false;
		}
		return categorize(lastFailure, "CircuitBreaker", "call").category() == ErrorCategory.CREDENTIALS;
	}

	static ErrorCategory categorizeHttpStatus(int status) {
		if (status == RATE_LIMIT_HTTP) {
			return ErrorCategory.RATE_LIMIT;
		}
		if (status == 401 || status == 403) {
			return ErrorCategory.CREDENTIALS;
		}
		if (status >= 500) {
			return ErrorCategory.TEMPORARY;
		}
		if (status == 408) {
			return ErrorCategory.TIMEOUT;
		}
		return null;
	}

	// Bybit V5 return codes.
	static ErrorCategory categorizeVenueCode(Integer code) {
		if (code == null) {
			return null;
		}
		return switch (code) {
			case 10006, 10018 -> ErrorCategory.RATE_LIMIT;
			case 10003, 10004, 10005, 10007, 10009, 10010 -> ErrorCategory.CREDENTIALS;
			case 10000 -> ErrorCategory.TIMEOUT;
			case 10002, 10016 -> ErrorCategory.TEMPORARY;
			case 10001, 110009, 110020, 110021 -> ErrorCategory.VALIDATION;
			case 110007, 110001, 110003, 110004, 110012 -> ErrorCategory.ORDER;
			case 110017, 110025 -> ErrorCategory.POSITION;
			default -> null;
		};
	}

	private static boolean isInsufficientBalance(Integer code) {
		return code != null && (code == 110007 || code == 110004 || code == 110012);
	}

	private static BotException categorizeByMessage(Throwable error, String component, String operation) {
		String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
		if (message.contains("timeout") || message.contains("timed out") || message.contains("deadline exceeded")) {
			return BotException.wrap(error, ErrorCategory.TIMEOUT, component, operation);
		}
		if (message.contains("connection") || message.contains("network") || message.contains("dns")
				|| message.contains("dial")) {
			return BotException.wrap(error, ErrorCategory.NETWORK, component, operation);
		}
		if (message.contains("api key") || message.contains("api secret") || message.contains("authentication")
				|| message.contains("unauthorized")) {
			return BotException.wrap(error, ErrorCategory.CREDENTIALS, component, operation);
		}
		if (message.contains("rate limit") || message.contains("too many requests")) {
			return BotException.wrap(error, ErrorCategory.RATE_LIMIT, component, operation);
		}
		if (message.contains("insufficient") || message.contains("balance")) {
			return BotException.wrap(error, ErrorCategory.ORDER, component, operation).withRetryable(false);
		}
		if (message.contains("invalid") || message.contains("constraint") || message.contains("minimum")
				|| message.contains("maximum")) {
			return BotException.wrap(error, ErrorCategory.VALIDATION, component, operation);
		}
		return BotException.wrap(error, ErrorCategory.TEMPORARY, component, operation);
	}
}
