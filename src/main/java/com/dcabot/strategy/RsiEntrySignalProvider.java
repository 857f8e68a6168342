package com.dcabot.strategy;

import java.util.List;

import com.dcabot.market.KlineIndicators;
import com.dcabot.market.dto.Kline;

public class RsiEntrySignalProvider implements EntrySignalProvider {

	private final int period;
	private final double oversold;

	public RsiEntrySignalProvider(int period, double oversold) {
		this.period = period;
		this.oversold = oversold;
	}

	@Override
	public EntrySignal evaluate(List<Kline> klines) {
		if (klines == null || klines.size() < period + 1) {
			return EntrySignal.none("need " + (period + 1) + " klines, have " + (klines == null ? 0 : klines.size()));
		}
		double rsi = KlineIndicators.latestRsi(klines, period);
		if (Double.isNaN(rsi)) {
			return EntrySignal.none("rsi unavailable");
		}
		if (rsi < oversold) {
			return new EntrySignal(true, rsi, String.format("rsi %.2f below %.2f", rsi, oversold));
		}
		return new EntrySignal(false, rsi, String.format("rsi %.2f not below %.2f", rsi, oversold));
	}

	@Override
	public String name() {
		return "rsi";
	}
}
