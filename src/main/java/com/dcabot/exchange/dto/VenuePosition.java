package com.dcabot.exchange.dto;

/**
 * Position record as reported by the venue. Numeric fields stay raw strings; the venue sends empty
 * strings for flat positions and the synchronizer decides what is acceptable.
 */
public record VenuePosition(
		String symbol,
		String side,
		String size,
		String positionValue,
		String avgPrice) {
}
