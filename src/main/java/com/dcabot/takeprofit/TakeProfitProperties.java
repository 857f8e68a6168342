package com.dcabot.takeprofit;

import java.time.Duration;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "bot.take-profit")
public record TakeProfitProperties(
		@Max(20) int levels,
		@PositiveOrZero double quantityFraction,
		@PositiveOrZero double percent,
		String source,
		Volatility volatility,
		Duration safetyMargin,
		boolean cancelOrphanedOrdersOnStartup,
		double minPriceOffset,
		double maxPriceOffset,
		double maxQuantityRatio,
		double averageTolerance,
		Boolean autoEnabled) {

	public TakeProfitProperties {
		levels = levels <= 0 ? 5 : levels;
		quantityFraction = quantityFraction <= 0 ? 1.0 / levels : quantityFraction;
		percent = percent <= 0 ? 0.02 : percent;
		source = source == null || source.isBlank() ? "fixed" : source.toLowerCase(Locale.ROOT);
		volatility = volatility == null ? Volatility.defaults() : volatility;
		safetyMargin = safetyMargin == null ? Duration.ofSeconds(5) : safetyMargin;
		minPriceOffset = minPriceOffset <= 0 ? 0.001 : minPriceOffset;
		maxPriceOffset = maxPriceOffset <= 0 ? 0.15 : maxPriceOffset;
		maxQuantityRatio = maxQuantityRatio <= 0 ? 0.7 : maxQuantityRatio;
		averageTolerance = averageTolerance <= 0 ? 1e-4 : averageTolerance;
		autoEnabled = autoEnabled == null ? Boolean.TRUE : autoEnabled;
	}

	/**
	 * Same settings with automatic ladder placement switched on or off.
	 */
	public TakeProfitProperties withAutoEnabled(boolean enabled) {
		return new TakeProfitProperties(levels, quantityFraction, percent, source, volatility, safetyMargin,
				cancelOrphanedOrdersOnStartup, minPriceOffset, maxPriceOffset, maxQuantityRatio, averageTolerance,
				enabled);
	}

	public static TakeProfitProperties defaults() {
		return new TakeProfitProperties(0, 0, 0, null, null, null, false, 0, 0, 0, 0, null);
	}

	public record Volatility(double multiplier, double minPercent, double maxPercent, int atrPeriod) {

		public Volatility {
			multiplier = multiplier <= 0 ? 0.5 : multiplier;
			minPercent = minPercent <= 0 ? 0.01 : minPercent;
			maxPercent = maxPercent <= 0 ? 0.05 : maxPercent;
			atrPeriod = atrPeriod <= 0 ? 14 : atrPeriod;
		}

		public static Volatility defaults() {
			return new Volatility(0.5, 0.01, 0.05, 14);
		}
	}
}
