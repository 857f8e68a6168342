package com.dcabot.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.ta4j.core.BarSeries;

import com.dcabot.market.dto.Kline;

class KlineIndicatorsTest {

	private static List<Kline> flatRange(int count) {
		List<Kline> klines = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			klines.add(new Kline(i * 60_000L, 100, 101, 99, 100, 5));
		}
		return klines;
	}

	@Test
	void seriesKeepsOneBarPerKline() {
		BarSeries series = KlineIndicators.toSeries("test", flatRange(20));

		assertThat(series.getBarCount()).isEqualTo(20);
		assertThat(series.getLastBar().getClosePrice().doubleValue()).isEqualTo(100.0);
	}

	@Test
	void constantRangeGivesAtrOfThatRange() {
		assertThat(KlineIndicators.latestAtr(flatRange(30), 14)).isCloseTo(2.0, within(1e-9));
	}

	@Test
	void shortHistoryHasNoAtr() {
		assertThat(KlineIndicators.latestAtr(flatRange(10), 14)).isNaN();
	}
}
