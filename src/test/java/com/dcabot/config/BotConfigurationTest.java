package com.dcabot.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.dcabot.strategy.DcaSpacingStrategy;
import com.dcabot.strategy.SpacingProperties;
import com.dcabot.takeprofit.TakeProfitPercentSource;
import com.dcabot.takeprofit.TakeProfitProperties;

class BotConfigurationTest {

	private final BotConfiguration configuration = new BotConfiguration();

	private static BotProperties bot(BotProperties.Signal signal) {
		return new BotProperties("btcusdt", null, null, "5m", new BigDecimal("40"), 0, 0, true, true, null, 0, 0, 0,
				signal);
	}

	@Test
	void defaultsSelectFixedSpacingRsiAndFixedPercent() {
		DcaSpacingStrategy spacing = configuration.dcaSpacingStrategy(SpacingProperties.defaults());
		TakeProfitPercentSource source = configuration.takeProfitPercentSource(TakeProfitProperties.defaults());

		assertThat(spacing.name()).isEqualTo("fixed_progressive");
		assertThat(configuration.entrySignalProvider(bot(null)).name()).isEqualTo("rsi");
		assertThat(source.name()).isEqualTo("fixed");
		assertThat(source.percent(List.of(), new BigDecimal("100"))).isEqualTo(0.02);
	}

	@Test
	void volatilityPercentSourceIsSelectable() {
		TakeProfitProperties properties = new TakeProfitProperties(0, 0, 0, "Volatility", null, null, false, 0, 0, 0,
				0, null);

		assertThat(properties.autoEnabled()).isTrue();

		assertThat(configuration.takeProfitPercentSource(properties).name()).isEqualTo("volatility");
	}

	@Test
	void unknownSignalTypeIsRejected() {
		BotProperties properties = bot(new BotProperties.Signal("macd", 0, 0));

		assertThatThrownBy(() -> configuration.entrySignalProvider(properties))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("macd");
	}
}
