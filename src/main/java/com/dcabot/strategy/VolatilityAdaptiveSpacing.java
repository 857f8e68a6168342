package com.dcabot.strategy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scales the spacing with ATR relative to price. Levels up to 3 grow geometrically, deeper levels add
 * 15% of the level-3 threshold each.
 */
public class VolatilityAdaptiveSpacing implements DcaSpacingStrategy {

	private static final double ADAPTIVE_CEILING = 0.06;
	private static final int GEOMETRIC_LEVELS = 3;
	private static final double LINEAR_STEP = 0.15;

	private final double baseThreshold;
	private final double sensitivity;
	private final int atrPeriod;
	private final double maxThreshold;
	private final double minThreshold;
	private final double levelMultiplier;

	public VolatilityAdaptiveSpacing(double baseThreshold, double sensitivity, int atrPeriod, double maxThreshold,
			double minThreshold, double levelMultiplier) {
		this.baseThreshold = baseThreshold;
		this.sensitivity = sensitivity;
		this.atrPeriod = atrPeriod;
		this.maxThreshold = maxThreshold;
		this.minThreshold = minThreshold;
		this.levelMultiplier = levelMultiplier;
	}

	@Override
	public double calculateThreshold(int level, SpacingContext context) {
		double atr = context.atr();
		if (Double.isNaN(atr) || atr <= 0 || context.currentPrice() <= 0) {
			return geometric(baseThreshold, level);
		}
		double normalizedVolatility = atr / context.currentPrice();
		double adaptiveBase = baseThreshold * (0.5 + normalizedVolatility * sensitivity);
		double threshold = levelAdjusted(adaptiveBase, level);
		double ceiling = Math.min(maxThreshold, ADAPTIVE_CEILING);
		return Math.min(Math.max(threshold, minThreshold), ceiling);
	}

	private double geometric(double base, int level) {
		if (levelMultiplier <= 1.0 || level == 0) {
			return base;
		}
		return base * Math.pow(levelMultiplier, level);
	}

	private double levelAdjusted(double base, int level) {
		if (levelMultiplier <= 1.0 || level == 0) {
			return base;
		}
		if (level <= GEOMETRIC_LEVELS) {
			return base * Math.pow(levelMultiplier, level);
		}
		double levelThree = base * Math.pow(levelMultiplier, GEOMETRIC_LEVELS);
		return levelThree + (level - GEOMETRIC_LEVELS) * levelThree * LINEAR_STEP;
	}

	@Override
	public String name() {
		return "volatility_adaptive";
	}

	@Override
	public Map<String, Object> parameters() {
		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("baseThreshold", baseThreshold);
		parameters.put("sensitivity", sensitivity);
		parameters.put("atrPeriod", atrPeriod);
		parameters.put("maxThreshold", maxThreshold);
		parameters.put("minThreshold", minThreshold);
		parameters.put("levelMultiplier", levelMultiplier);
		return parameters;
	}

	@Override
	public void validate() {
		if (baseThreshold <= 0 || baseThreshold >= 1.0) {
			throw new IllegalArgumentException("baseThreshold must be in (0, 1), got " + baseThreshold);
		}
		if (sensitivity < 0 || sensitivity > 10) {
			throw new IllegalArgumentException("sensitivity must be in [0, 10], got " + sensitivity);
		}
		if (atrPeriod < 1 || atrPeriod > 100) {
			throw new IllegalArgumentException("atrPeriod must be in [1, 100], got " + atrPeriod);
		}
		if (maxThreshold <= minThreshold) {
			throw new IllegalArgumentException(
					"maxThreshold " + maxThreshold + " must exceed minThreshold " + minThreshold);
		}
		if (minThreshold <= 0 || maxThreshold >= 1.0) {
			throw new IllegalArgumentException("thresholds must be in (0, 1)");
		}
		if (levelMultiplier < 1.0 || levelMultiplier > 2.0) {
			throw new IllegalArgumentException("levelMultiplier must be in [1, 2], got " + levelMultiplier);
		}
	}

	@Override
	public void reset() {
		// ATR is recomputed from the kline history on every call
	}

	@Override
	public int atrPeriod() {
		return atrPeriod;
	}
}
