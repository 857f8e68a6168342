package com.dcabot.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Validated
@ConfigurationProperties(prefix = "bot")
public record BotProperties(
		@NotBlank String symbol,
		String category,
		String quoteCoin,
		@NotBlank String interval,
		@NotNull @Positive BigDecimal baseAmount,
		double maxMultiplier,
		int leverage,
		boolean ordersEnabled,
		boolean closePositionOnShutdown,
		Duration shutdownTimeout,
		int klineLimit,
		int credentialFailureLimit,
		int errorQueueCapacity,
		Signal signal) {

	public BotProperties {
		symbol = symbol == null ? null : symbol.toUpperCase(Locale.ROOT);
		category = category == null || category.isBlank() ? "linear" : category;
		quoteCoin = quoteCoin == null || quoteCoin.isBlank() ? "USDT" : quoteCoin;
		maxMultiplier = maxMultiplier <= 0 ? 3.0 : maxMultiplier;
		leverage = leverage <= 0 ? 1 : leverage;
		shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(30) : shutdownTimeout;
		klineLimit = klineLimit <= 0 ? 100 : klineLimit;
		credentialFailureLimit = credentialFailureLimit <= 0 ? 3 : credentialFailureLimit;
		errorQueueCapacity = errorQueueCapacity <= 0 ? 100 : errorQueueCapacity;
		signal = signal == null ? Signal.defaults() : signal;
	}

	public record Signal(String type, int rsiPeriod, double oversold) {

		public Signal {
			type = type == null || type.isBlank() ? "rsi" : type.toLowerCase(Locale.ROOT);
			rsiPeriod = rsiPeriod <= 0 ? 14 : rsiPeriod;
			oversold = oversold <= 0 ? 30.0 : oversold;
		}

		public static Signal defaults() {
			return new Signal("rsi", 14, 30.0);
		}
	}
}
