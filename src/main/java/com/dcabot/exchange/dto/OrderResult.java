package com.dcabot.exchange.dto;

import java.math.BigDecimal;

public record OrderResult(
		String orderId,
		String orderLinkId,
		String orderStatus,
		BigDecimal executedQty,
		BigDecimal avgPrice) {

	public boolean hasExecution() {
		return executedQty != null && executedQty.signum() > 0;
	}
}
