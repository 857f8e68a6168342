package com.dcabot.exchange;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unwraps the {@code {retCode, retMsg, result}} envelope every Bybit V5 endpoint answers with.
 */
public final class BybitEnvelope {

	public static final int TIMESTAMP_OUT_OF_WINDOW = 10002;

	private static final Pattern RET_CODE_PATTERN = Pattern.compile("\"retCode\"\\s*:\\s*(-?\\d+)");

	private BybitEnvelope() {
	}

	public static JsonNode result(JsonNode body, String operation) {
		if (body == null || body.isMissingNode() || body.isNull()) {
			throw new VenueApiException(null, 200, operation + " returned an empty body");
		}
		int retCode = body.path("retCode").asInt(-1);
		if (retCode != 0) {
			throw new VenueApiException(retCode, 200,
					operation + " failed retCode=" + retCode + " retMsg=" + body.path("retMsg").asText(""));
		}
		return body.path("result");
	}

	public static VenueApiException httpError(String operation, int status, String body) {
		return new VenueApiException(extractRetCode(body), status,
				operation + " failed with status=" + status + ", body=" + body);
	}

	public static boolean isTimestampError(Throwable error) {
		return error instanceof VenueApiException exception
				&& exception.code() != null
				&& exception.code() == TIMESTAMP_OUT_OF_WINDOW;
	}

	public static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return null;
		}
		return value.asText();
	}

	static Integer extractRetCode(String body) {
		if (body == null) {
			return null;
		}
		Matcher matcher = RET_CODE_PATTERN.matcher(body);
		if (!matcher.find()) {
			return null;
		}
		try {
			return Integer.parseInt(matcher.group(1));
		} catch (NumberFormatException ignored) {
			return null;
		}
	}
}
