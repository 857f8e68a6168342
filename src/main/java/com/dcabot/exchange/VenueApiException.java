package com.dcabot.exchange;

public class VenueApiException extends RuntimeException {

	private final Integer code;
	private final int httpStatus;

	public VenueApiException(Integer code, int httpStatus, String message) {
		super(message);
		this.code = code;
		this.httpStatus = httpStatus;
	}

	public Integer code() {
		return code;
	}

	public int httpStatus() {
		return httpStatus;
	}
}
