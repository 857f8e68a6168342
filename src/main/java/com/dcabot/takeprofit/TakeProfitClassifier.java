package com.dcabot.takeprofit;

import java.math.BigDecimal;
import java.util.Set;

import com.dcabot.exchange.dto.OpenOrder;
import com.dcabot.exchange.dto.OrderSide;
import com.dcabot.exchange.dto.OrderType;

/**
 * Recognizes take-profit legs among venue open orders, including ones this process did not place.
 */
public class TakeProfitClassifier {

	private final String symbol;
	private final BigDecimal minPriceOffset;
	private final BigDecimal maxPriceOffset;
	private final BigDecimal maxQuantityRatio;

	public TakeProfitClassifier(String symbol, TakeProfitProperties properties) {
		this.symbol = symbol;
		this.minPriceOffset = BigDecimal.valueOf(properties.minPriceOffset());
		this.maxPriceOffset = BigDecimal.valueOf(properties.maxPriceOffset());
		this.maxQuantityRatio = BigDecimal.valueOf(properties.maxQuantityRatio());
	}

	/**
	 * A tracked order id is always a leg. Otherwise the order must be a sell limit on the tracked symbol,
	 * priced 0.1% to 15% above the average entry, for at most 70% of the position. With no known average
	 * only tracked ids qualify.
	 */
	public boolean isTakeProfitOrder(OpenOrder order, BigDecimal averagePrice, BigDecimal positionQuantity,
			Set<String> trackedIds) {
		if (order == null) {
			return false;
		}
		if (order.orderId() != null && trackedIds.contains(order.orderId())) {
			return true;
		}
		if (order.side() != OrderSide.SELL || order.orderType() != OrderType.LIMIT) {
			return false;
		}
		if (!symbol.equalsIgnoreCase(order.symbol())) {
			return false;
		}
		if (averagePrice == null || averagePrice.signum() <= 0 || order.price() == null) {
			return false;
		}
		BigDecimal lower = averagePrice.multiply(BigDecimal.ONE.add(minPriceOffset));
		BigDecimal upper = averagePrice.multiply(BigDecimal.ONE.add(maxPriceOffset));
		if (order.price().compareTo(lower) < 0 || order.price().compareTo(upper) > 0) {
			return false;
		}
		if (positionQuantity == null || positionQuantity.signum() <= 0 || order.qty() == null) {
			return false;
		}
		return order.qty().compareTo(positionQuantity.multiply(maxQuantityRatio)) <= 0;
	}
}
