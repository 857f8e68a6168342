package com.dcabot.strategy;

public record EntryDecision(boolean allowed, double requiredThreshold, double priceChange, String reason) {
}
