package com.dcabot.takeprofit;

import java.math.BigDecimal;

/**
 * One resting take-profit sell. {@code level} runs from 1 to the configured number of legs.
 */
public record TakeProfitLeg(
		int level,
		BigDecimal targetPrice,
		BigDecimal quantity,
		String orderId,
		LegStatus status) {

	public TakeProfitLeg filled() {
		return new TakeProfitLeg(level, targetPrice, quantity, orderId, LegStatus.FILLED);
	}
}
