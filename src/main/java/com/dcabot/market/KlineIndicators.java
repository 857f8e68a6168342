package com.dcabot.market;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.DoubleNum;

import com.dcabot.market.dto.Kline;

/**
 * Builds ta4j series from venue klines and reads the latest value of the indicators the bot uses.
 * Values are {@code NaN} while the history is shorter than the indicator needs.
 */
public final class KlineIndicators {

	private KlineIndicators() {
	}

	public static BarSeries toSeries(String name, List<Kline> klines) {
		BarSeries series = new BaseBarSeriesBuilder().withName(name)
				.withNumTypeOf(DoubleNum::valueOf)
				.build();
		Duration period = barPeriod(klines);
		long lastEnd = Long.MIN_VALUE;
		for (Kline kline : klines) {
			long end = kline.startTime() + period.toMillis();
			if (end <= lastEnd) {
				continue;
			}
			lastEnd = end;
			series.addBar(period,
					Instant.ofEpochMilli(end).atZone(ZoneOffset.UTC),
					kline.open(),
					kline.high(),
					kline.low(),
					kline.close(),
					kline.volume());
		}
		return series;
	}

	public static double latestAtr(List<Kline> klines, int period) {
		if (klines == null || klines.size() < period + 1) {
			return Double.NaN;
		}
		BarSeries series = toSeries("atr", klines);
		ATRIndicator atr = new ATRIndicator(series, period);
		return atr.getValue(series.getEndIndex()).doubleValue();
	}

	public static double latestRsi(List<Kline> klines, int period) {
		if (klines == null || klines.size() < period + 1) {
			return Double.NaN;
		}
		BarSeries series = toSeries("rsi", klines);
		RSIIndicator rsi = new RSIIndicator(new ClosePriceIndicator(series), period);
		return rsi.getValue(series.getEndIndex()).doubleValue();
	}

	private static Duration barPeriod(List<Kline> klines) {
		if (klines.size() >= 2) {
			long step = klines.get(1).startTime() - klines.get(0).startTime();
			if (step > 0) {
				return Duration.ofMillis(step);
			}
		}
		return Duration.ofMinutes(1);
	}
}
