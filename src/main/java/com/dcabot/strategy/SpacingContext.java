package com.dcabot.strategy;

/**
 * Market inputs of a spacing calculation. {@code atr} is {@code NaN} when not enough history exists.
 */
public record SpacingContext(double currentPrice, double averagePrice, double atr) {
}
