package com.dcabot.exchange.dto;

import java.math.BigDecimal;

public record OpenOrder(
		String orderId,
		String orderLinkId,
		String symbol,
		OrderSide side,
		OrderType orderType,
		BigDecimal price,
		BigDecimal qty,
		boolean reduceOnly,
		String orderStatus) {
}
