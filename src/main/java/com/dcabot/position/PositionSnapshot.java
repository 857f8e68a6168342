package com.dcabot.position;

import java.math.BigDecimal;

/**
 * Immutable view of the replicated position. Long only.
 */
public record PositionSnapshot(
		String symbol,
		String side,
		BigDecimal quantity,
		BigDecimal notional,
		BigDecimal averagePrice,
		int dcaLevel) {

	public static PositionSnapshot flat(String symbol) {
		return new PositionSnapshot(symbol, "Buy", BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0);
	}

	public boolean isOpen() {
		return quantity.signum() > 0 || notional.signum() > 0;
	}
}
