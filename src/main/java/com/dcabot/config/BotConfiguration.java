package com.dcabot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.dcabot.position.PositionSynchronizer;
import com.dcabot.resilience.ResilienceProperties;
import com.dcabot.strategy.DcaSpacingStrategy;
import com.dcabot.strategy.EntryGate;
import com.dcabot.strategy.EntrySignalProvider;
import com.dcabot.strategy.RsiEntrySignalProvider;
import com.dcabot.strategy.SpacingProperties;
import com.dcabot.strategy.SpacingStrategyFactory;
import com.dcabot.takeprofit.FixedTakeProfitPercent;
import com.dcabot.takeprofit.TakeProfitPercentSource;
import com.dcabot.takeprofit.TakeProfitProperties;
import com.dcabot.takeprofit.VolatilityTakeProfitPercent;

@Configuration
@EnableScheduling
@EnableConfigurationProperties({BybitProperties.class, BotProperties.class, ResilienceProperties.class,
		TakeProfitProperties.class, SpacingProperties.class})
public class BotConfiguration {

	private static final Logger LOGGER = LoggerFactory.getLogger(BotConfiguration.class);

	@Bean
	public DcaSpacingStrategy dcaSpacingStrategy(SpacingProperties properties) {
		DcaSpacingStrategy strategy = SpacingStrategyFactory.create(properties);
		LOGGER.info("EVENT=SPACING_STRATEGY name={} parameters={}", strategy.name(), strategy.parameters());
		return strategy;
	}

	@Bean
	public EntryGate entryGate(DcaSpacingStrategy spacing, PositionSynchronizer synchronizer) {
		EntryGate gate = new EntryGate(spacing);
		synchronizer.addResyncListener(gate);
		return gate;
	}

	@Bean
	public EntrySignalProvider entrySignalProvider(BotProperties properties) {
		BotProperties.Signal signal = properties.signal();
		if (!"rsi".equals(signal.type())) {
			throw new IllegalArgumentException("unknown entry signal type: " + signal.type());
		}
		return new RsiEntrySignalProvider(signal.rsiPeriod(), signal.oversold());
	}

	@Bean
	public TakeProfitPercentSource takeProfitPercentSource(TakeProfitProperties properties) {
		return switch (properties.source()) {
			case "fixed" -> new FixedTakeProfitPercent(properties.percent());
			case "volatility", "atr" -> new VolatilityTakeProfitPercent(properties.percent(), properties.volatility());
			default -> throw new IllegalArgumentException("unknown take-profit source: " + properties.source());
		};
	}
}
