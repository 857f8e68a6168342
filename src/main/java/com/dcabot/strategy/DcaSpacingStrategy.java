package com.dcabot.strategy;

import java.util.Map;

/**
 * Price-drop threshold below the average entry that a new DCA entry at {@code level} needs.
 */
public interface DcaSpacingStrategy {

	double calculateThreshold(int level, SpacingContext context);

	String name();

	Map<String, Object> parameters();

	/**
	 * @throws IllegalArgumentException when the configured parameters are out of range
	 */
	void validate();

	/**
	 * Clears per-position state. Called when the position is closed.
	 */
	void reset();

	default int atrPeriod() {
		return 0;
	}
}
