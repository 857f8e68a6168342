package com.dcabot.takeprofit;

import java.math.BigDecimal;
import java.util.List;

import com.dcabot.market.dto.Kline;

public class FixedTakeProfitPercent implements TakeProfitPercentSource {

	private final double percent;

	public FixedTakeProfitPercent(double percent) {
		this.percent = percent;
	}

	@Override
	public double percent(List<Kline> history, BigDecimal referencePrice) {
		return percent;
	}

	@Override
	public String name() {
		return "fixed";
	}
}
