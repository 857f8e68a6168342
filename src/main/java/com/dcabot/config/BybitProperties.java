package com.dcabot.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

@Validated
@ConfigurationProperties(prefix = "bybit")
public record BybitProperties(
		@NotBlank String baseUrl,
		@NotBlank String testnetBaseUrl,
		boolean useTestnet,
		String apiKey,
		String secretKey,
		long recvWindowMillis,
		int connectTimeoutMs,
		long responseTimeoutMs,
		long handshakeTimeoutMs) {

	public boolean hasCredentials() {
		return apiKey != null && !apiKey.isBlank() && secretKey != null && !secretKey.isBlank();
	}

	public String resolvedBaseUrl() {
		return useTestnet ? testnetBaseUrl : baseUrl;
	}

	public Duration connectTimeout() {
		return Duration.ofMillis(connectTimeoutMs > 0 ? connectTimeoutMs : 5_000L);
	}

	public Duration responseTimeout() {
		return Duration.ofMillis(responseTimeoutMs > 0 ? responseTimeoutMs : 10_000L);
	}

	public Duration handshakeTimeout() {
		return Duration.ofMillis(handshakeTimeoutMs > 0 ? handshakeTimeoutMs : 10_000L);
	}

	public long resolvedRecvWindowMillis() {
		return recvWindowMillis > 0 ? recvWindowMillis : 10_000L;
	}
}
