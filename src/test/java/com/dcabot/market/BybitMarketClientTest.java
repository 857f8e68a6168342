package com.dcabot.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.dcabot.exchange.VenueApiException;
import com.dcabot.exchange.dto.TradingConstraints;
import com.dcabot.market.dto.Kline;
import com.fasterxml.jackson.databind.ObjectMapper;

class BybitMarketClientTest {

	private final ObjectMapper mapper = new ObjectMapper();

	@Test
	void klinesAreReturnedOldestFirst() throws Exception {
		List<Kline> klines = BybitMarketClient.parseKlines(mapper.readTree("""
				{"list":[["1700000300000","101","102","100","101.5","12"],
				["1700000000000","100","101","99","100.5","10"],["bad"]]}
				"""));

		assertThat(klines).extracting(Kline::startTime).containsExactly(1_700_000_000_000L, 1_700_000_300_000L);
		assertThat(klines.get(1).close()).isEqualTo(101.5);
	}

	@Test
	void instrumentInfoBecomesConstraints() throws Exception {
		TradingConstraints constraints = BybitMarketClient.parseTradingConstraints(mapper.readTree("""
				{"list":[{"symbol":"BTCUSDT","lotSizeFilter":{"minOrderQty":"0.001","maxOrderQty":"100",
				"qtyStep":"0.001","minNotionalValue":"5"},"priceFilter":{"tickSize":"0.10"},
				"leverageFilter":{"maxLeverage":"100.00"}}]}
				"""), "BTCUSDT");

		assertThat(constraints.minOrderQty()).isEqualByComparingTo("0.001");
		assertThat(constraints.minOrderValue()).isEqualByComparingTo("5");
		assertThat(constraints.tickSize()).isEqualByComparingTo("0.1");
		assertThat(constraints.maxLeverage()).isEqualByComparingTo("100");
	}

	@Test
	void unknownInstrumentIsRejected() {
		assertThatThrownBy(() -> BybitMarketClient.parseTradingConstraints(mapper.readTree("{\"list\":[]}"),
				"XYZUSDT"))
				.isInstanceOf(VenueApiException.class);
	}

	@Test
	void lastPriceForSymbol() throws Exception {
		assertThat(BybitMarketClient.parseLastPrice(mapper.readTree("""
				{"list":[{"symbol":"BTCUSDT","lastPrice":"60123.4"}]}
				"""), "BTCUSDT")).isEqualByComparingTo("60123.4");
	}
}
