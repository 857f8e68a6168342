package com.dcabot.strategy;

import java.math.BigDecimal;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dcabot.market.KlineIndicators;
import com.dcabot.market.dto.Kline;
import com.dcabot.position.PositionSnapshot;
import com.dcabot.position.ResyncListener;

/**
 * Blocks a new entry until price has fallen far enough below the average entry. The gate overrides any
 * buy signal.
 */
public class EntryGate implements ResyncListener {

	private static final Logger LOGGER = LoggerFactory.getLogger(EntryGate.class);

	private final DcaSpacingStrategy spacing;

	public EntryGate(DcaSpacingStrategy spacing) {
		this.spacing = spacing;
	}

	public EntryDecision evaluate(int level, BigDecimal averagePrice, BigDecimal currentPrice,
			List<Kline> priceHistory) {
		if (averagePrice == null || averagePrice.signum() <= 0) {
			return new EntryDecision(true, 0.0, 0.0, "no open position");
		}
		if (currentPrice == null || currentPrice.signum() <= 0) {
			return new EntryDecision(false, 0.0, 0.0, "no current price");
		}
		double average = averagePrice.doubleValue();
		double price = currentPrice.doubleValue();
		double atr = spacing.atrPeriod() > 0 ? KlineIndicators.latestAtr(priceHistory, spacing.atrPeriod()) : Double.NaN;
		double threshold = spacing.calculateThreshold(level, new SpacingContext(price, average, atr));
		double priceChange = (average - price) / average;
		if (priceChange < threshold) {
			return new EntryDecision(false, threshold, priceChange,
					String.format("drop %.4f below required %.4f at level %d", priceChange, threshold, level));
		}
		return new EntryDecision(true, threshold, priceChange,
				String.format("drop %.4f meets required %.4f at level %d", priceChange, threshold, level));
	}

	@Override
	public void onPositionClosedExternally(PositionSnapshot previous) {
		spacing.reset();
		LOGGER.info("EVENT=SPACING_RESET strategy={} previousLevel={}", spacing.name(), previous.dcaLevel());
	}

	public DcaSpacingStrategy spacing() {
		return spacing;
	}
}
