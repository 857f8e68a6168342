package com.dcabot.takeprofit;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.dcabot.exchange.dto.OpenOrder;
import com.dcabot.exchange.dto.OrderSide;
import com.dcabot.exchange.dto.OrderType;

class TakeProfitClassifierTest {

	private static final BigDecimal AVERAGE = new BigDecimal("100");
	private static final BigDecimal POSITION = new BigDecimal("1.0");

	private final TakeProfitClassifier classifier = new TakeProfitClassifier("BTCUSDT",
			TakeProfitProperties.defaults());

	private static OpenOrder order(String id, OrderSide side, OrderType type, String price, String qty) {
		return new OpenOrder(id, null, "BTCUSDT", side, type, new BigDecimal(price), new BigDecimal(qty), true,
				"New");
	}

	@Test
	void sellLimitFivePercentAboveIsATakeProfit() {
		assertThat(classifier.isTakeProfitOrder(order("a", OrderSide.SELL, OrderType.LIMIT, "105", "0.3"), AVERAGE,
				POSITION, Set.of())).isTrue();
	}

	@Test
	void sellLimitTwentyPercentAboveIsNot() {
		assertThat(classifier.isTakeProfitOrder(order("a", OrderSide.SELL, OrderType.LIMIT, "120", "0.3"), AVERAGE,
				POSITION, Set.of())).isFalse();
	}

	@Test
	void buyOrderIsNot() {
		assertThat(classifier.isTakeProfitOrder(order("a", OrderSide.BUY, OrderType.LIMIT, "105", "0.3"), AVERAGE,
				POSITION, Set.of())).isFalse();
	}

	@Test
	void oversizedSellIsNot() {
		assertThat(classifier.isTakeProfitOrder(order("a", OrderSide.SELL, OrderType.LIMIT, "105", "0.8"), AVERAGE,
				POSITION, Set.of())).isFalse();
	}

	@Test
	void unknownAverageTrustsOnlyTrackedIds() {
		OpenOrder tracked = order("tracked", OrderSide.SELL, OrderType.LIMIT, "105", "0.3");
		OpenOrder foreign = order("foreign", OrderSide.SELL, OrderType.LIMIT, "105", "0.3");

		assertThat(classifier.isTakeProfitOrder(tracked, BigDecimal.ZERO, BigDecimal.ZERO, Set.of("tracked")))
				.isTrue();
		assertThat(classifier.isTakeProfitOrder(foreign, BigDecimal.ZERO, BigDecimal.ZERO, Set.of("tracked")))
				.isFalse();
	}

	@Test
	void otherSymbolIsNot() {
		OpenOrder eth = new OpenOrder("e", null, "ETHUSDT", OrderSide.SELL, OrderType.LIMIT, new BigDecimal("105"),
				new BigDecimal("0.3"), true, "New");

		assertThat(classifier.isTakeProfitOrder(eth, AVERAGE, POSITION, Set.of())).isFalse();
	}
}
