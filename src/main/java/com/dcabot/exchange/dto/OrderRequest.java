package com.dcabot.exchange.dto;

import java.math.BigDecimal;

public record OrderRequest(
		String category,
		String symbol,
		OrderSide side,
		OrderType orderType,
		BigDecimal qty,
		BigDecimal price,
		boolean reduceOnly,
		String orderLinkId) {

	public static OrderRequest market(String category, String symbol, OrderSide side, BigDecimal qty,
			boolean reduceOnly) {
		return new OrderRequest(category, symbol, side, OrderType.MARKET, qty, null, reduceOnly, null);
	}

	public static OrderRequest limit(String category, String symbol, OrderSide side, BigDecimal qty,
			BigDecimal price, boolean reduceOnly, String orderLinkId) {
		return new OrderRequest(category, symbol, side, OrderType.LIMIT, qty, price, reduceOnly, orderLinkId);
	}
}
