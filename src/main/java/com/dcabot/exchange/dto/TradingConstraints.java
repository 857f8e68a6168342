package com.dcabot.exchange.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Order size and price rules of one instrument.
 */
public record TradingConstraints(
		String symbol,
		BigDecimal minOrderQty,
		BigDecimal maxOrderQty,
		BigDecimal qtyStep,
		BigDecimal minOrderValue,
		BigDecimal tickSize,
		BigDecimal maxLeverage) {

	public BigDecimal floorToStep(BigDecimal quantity) {
		return floorTo(quantity, qtyStep);
	}

	public BigDecimal roundToTick(BigDecimal price) {
		if (price == null || tickSize == null || tickSize.signum() <= 0) {
			return price;
		}
		return price.divide(tickSize, 0, RoundingMode.HALF_UP).multiply(tickSize).stripTrailingZeros();
	}

	public static BigDecimal floorTo(BigDecimal value, BigDecimal step) {
		if (value == null || step == null || step.signum() <= 0) {
			return value;
		}
		return value.divide(step, 0, RoundingMode.FLOOR).multiply(step).stripTrailingZeros();
	}
}
