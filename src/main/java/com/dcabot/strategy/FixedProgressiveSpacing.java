package com.dcabot.strategy;

import java.util.LinkedHashMap;
import java.util.Map;

public class FixedProgressiveSpacing implements DcaSpacingStrategy {

	private final double baseThreshold;
	private final double multiplier;
	private final double maxThreshold;
	private final double minThreshold;

	public FixedProgressiveSpacing(double baseThreshold, double multiplier, double maxThreshold,
			double minThreshold) {
		this.baseThreshold = baseThreshold;
		this.multiplier = multiplier;
		this.maxThreshold = maxThreshold;
		this.minThreshold = minThreshold;
	}

	@Override
	public double calculateThreshold(int level, SpacingContext context) {
		double threshold = baseThreshold;
		if (multiplier > 1.0 && level > 0) {
			threshold = baseThreshold * Math.pow(multiplier, level);
		}
		return Math.min(Math.max(threshold, minThreshold), maxThreshold);
	}

	@Override
	public String name() {
		return "fixed_progressive";
	}

	@Override
	public Map<String, Object> parameters() {
		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("baseThreshold", baseThreshold);
		parameters.put("multiplier", multiplier);
		parameters.put("maxThreshold", maxThreshold);
		parameters.put("minThreshold", minThreshold);
		return parameters;
	}

	@Override
	public void validate() {
		if (baseThreshold <= 0 || baseThreshold >= 1.0) {
			throw new IllegalArgumentException("baseThreshold must be in (0, 1), got " + baseThreshold);
		}
		if (multiplier < 1.0 || multiplier > 5.0) {
			throw new IllegalArgumentException("multiplier must be in [1, 5], got " + multiplier);
		}
		if (maxThreshold <= minThreshold) {
			throw new IllegalArgumentException(
					"maxThreshold " + maxThreshold + " must exceed minThreshold " + minThreshold);
		}
		if (minThreshold <= 0 || maxThreshold >= 1.0) {
			throw new IllegalArgumentException("thresholds must be in (0, 1)");
		}
	}

	@Override
	public void reset() {
		// stateless
	}
}
