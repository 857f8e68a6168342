package com.dcabot.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

@Configuration
public class WebClientConfig {

	private static final String POOL_NAME = "bybit-rest";
	private static final int MAX_CONNECTIONS = 16;
	private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(30);

	@Bean
	public WebClient.Builder webClientBuilder() {
		return WebClient.builder();
	}

	@Bean(destroyMethod = "dispose")
	public ConnectionProvider bybitConnectionProvider(BybitProperties properties) {
		return connectionProvider(properties);
	}

	@Bean
	public WebClient bybitWebClient(BybitProperties properties, WebClient.Builder builder,
			ConnectionProvider bybitConnectionProvider, DataSize maxInMemorySize) {
		return builder
				.baseUrl(properties.resolvedBaseUrl())
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.clientConnector(new ReactorClientHttpConnector(httpClient(bybitConnectionProvider, properties)))
				.exchangeStrategies(exchangeStrategies(maxInMemorySize))
				.build();
	}

	@Bean
	public DataSize maxInMemorySize(@Value("${spring.codec.max-in-memory-size:5MB}") DataSize maxInMemorySize) {
		return maxInMemorySize;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return new ObjectMapper().findAndRegisterModules();
	}

	ExchangeStrategies exchangeStrategies(DataSize maxInMemorySize) {
		int limit = Math.toIntExact(maxInMemorySize.toBytes());
		return ExchangeStrategies.builder()
				.codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(limit))
				.build();
	}

	// Acquisition waits at most the connect timeout.
	ConnectionProvider connectionProvider(BybitProperties properties) {
		return ConnectionProvider.builder(POOL_NAME)
				.maxConnections(MAX_CONNECTIONS)
				.pendingAcquireTimeout(properties.connectTimeout())
				.maxIdleTime(MAX_IDLE_TIME)
				.build();
	}

	HttpClient httpClient(ConnectionProvider provider, BybitProperties properties) {
		Duration handshake = properties.handshakeTimeout();
		return HttpClient.create(provider)
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(properties.connectTimeout().toMillis()))
				.responseTimeout(properties.responseTimeout())
				.secure(spec -> spec.handshakeTimeout(handshake));
	}
}
