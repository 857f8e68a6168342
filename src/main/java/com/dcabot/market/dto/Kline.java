package com.dcabot.market.dto;

public record Kline(
		long startTime,
		double open,
		double high,
		double low,
		double close,
		double volume) {
}
