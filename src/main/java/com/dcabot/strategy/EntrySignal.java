package com.dcabot.strategy;

public record EntrySignal(boolean buy, double value, String reason) {

	public static EntrySignal none(String reason) {
		return new EntrySignal(false, Double.NaN, reason);
	}
}
