package com.dcabot.strategy;

public final class SpacingStrategyFactory {

	private SpacingStrategyFactory() {
	}

	public static DcaSpacingStrategy create(SpacingProperties properties) {
		DcaSpacingStrategy strategy = switch (properties.strategy()) {
			case "", "fixed", "fixed_progressive" -> {
				SpacingProperties.Fixed fixed = properties.fixed();
				yield new FixedProgressiveSpacing(fixed.baseThreshold(), fixed.multiplier(), fixed.maxThreshold(),
						fixed.minThreshold());
			}
			case "volatility_adaptive", "atr" -> {
				SpacingProperties.Volatility volatility = properties.volatility();
				yield new VolatilityAdaptiveSpacing(volatility.baseThreshold(), volatility.sensitivity(),
						volatility.atrPeriod(), volatility.maxThreshold(), volatility.minThreshold(),
						volatility.levelMultiplier());
			}
			default -> throw new IllegalArgumentException("unknown spacing strategy: " + properties.strategy()
					+ " (supported: fixed, volatility_adaptive)");
		};
		strategy.validate();
		return strategy;
	}
}
