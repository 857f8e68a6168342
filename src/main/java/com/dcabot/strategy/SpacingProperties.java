package com.dcabot.strategy;

import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bot.spacing")
public record SpacingProperties(String strategy, Fixed fixed, Volatility volatility) {

	public SpacingProperties {
		strategy = strategy == null ? "" : strategy.trim().toLowerCase(Locale.ROOT);
		fixed = fixed == null ? Fixed.defaults() : fixed;
		volatility = volatility == null ? Volatility.defaults() : volatility;
	}

	public static SpacingProperties defaults() {
		return new SpacingProperties(null, null, null);
	}

	public record Fixed(double baseThreshold, double multiplier, double maxThreshold, double minThreshold) {

		public Fixed {
			baseThreshold = baseThreshold <= 0 ? 0.01 : baseThreshold;
			multiplier = multiplier <= 0 ? 1.15 : multiplier;
			maxThreshold = maxThreshold <= 0 ? 0.20 : maxThreshold;
			minThreshold = minThreshold <= 0 ? 0.001 : minThreshold;
		}

		public static Fixed defaults() {
			return new Fixed(0, 0, 0, 0);
		}
	}

	public record Volatility(double baseThreshold, double sensitivity, int atrPeriod, double maxThreshold,
			double minThreshold, double levelMultiplier) {

		public Volatility {
			baseThreshold = baseThreshold <= 0 ? 0.01 : baseThreshold;
			sensitivity = sensitivity <= 0 ? 2.0 : sensitivity;
			atrPeriod = atrPeriod <= 0 ? 14 : atrPeriod;
			maxThreshold = maxThreshold <= 0 ? 0.05 : maxThreshold;
			minThreshold = minThreshold <= 0 ? 0.003 : minThreshold;
			levelMultiplier = levelMultiplier <= 0 ? 1.1 : levelMultiplier;
		}

		public static Volatility defaults() {
			return new Volatility(0, 0, 0, 0, 0, 0);
		}
	}
}
