package com.dcabot.takeprofit;

import java.math.BigDecimal;
import java.util.List;

import com.dcabot.market.KlineIndicators;
import com.dcabot.market.dto.Kline;

/**
 * Widens the target with ATR relative to price: {@code base + multiplier * atr / price}, clamped to the
 * configured band. Falls back to the base percent when ATR is not available yet.
 */
public class VolatilityTakeProfitPercent implements TakeProfitPercentSource {

	private final double basePercent;
	private final TakeProfitProperties.Volatility config;

	public VolatilityTakeProfitPercent(double basePercent, TakeProfitProperties.Volatility config) {
		this.basePercent = basePercent;
		this.config = config;
	}

	@Override
	public double percent(List<Kline> history, BigDecimal referencePrice) {
		if (referencePrice == null || referencePrice.signum() <= 0) {
			return basePercent;
		}
		double atr = KlineIndicators.latestAtr(history, config.atrPeriod());
		if (Double.isNaN(atr) || atr <= 0) {
			return basePercent;
		}
		double raw = basePercent + config.multiplier() * atr / referencePrice.doubleValue();
		return Math.max(config.minPercent(), Math.min(config.maxPercent(), raw));
	}

	@Override
	public String name() {
		return "volatility";
	}
}
