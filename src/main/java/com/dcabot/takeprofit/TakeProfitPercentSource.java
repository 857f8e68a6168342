package com.dcabot.takeprofit;

import java.math.BigDecimal;
import java.util.List;

import com.dcabot.market.dto.Kline;

/**
 * Supplies the take-profit percentage of the deepest leg. Shallower legs use a proportional share.
 */
public interface TakeProfitPercentSource {

	double percent(List<Kline> history, BigDecimal referencePrice);

	String name();
}
