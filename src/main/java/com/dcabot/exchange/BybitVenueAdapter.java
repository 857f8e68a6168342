package com.dcabot.exchange;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.dcabot.config.BybitProperties;
import com.dcabot.exchange.dto.OpenOrder;
import com.dcabot.exchange.dto.OrderRequest;
import com.dcabot.exchange.dto.OrderResult;
import com.dcabot.exchange.dto.OrderType;
import com.dcabot.exchange.dto.TradingConstraints;
import com.dcabot.exchange.dto.VenuePosition;
import com.dcabot.market.BybitMarketClient;
import com.dcabot.market.dto.Kline;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

@Component
public class BybitVenueAdapter implements TradingVenue {

	private static final Logger LOGGER = LoggerFactory.getLogger(BybitVenueAdapter.class);
	private static final Duration FILL_LOOKUP_DELAY = Duration.ofMillis(300);

	private final BybitMarketClient marketClient;
	private final BybitTradingClient tradingClient;
	private final TimeSyncService timeSyncService;
	private final BybitProperties properties;

	public BybitVenueAdapter(BybitMarketClient marketClient, BybitTradingClient tradingClient,
			TimeSyncService timeSyncService, BybitProperties properties) {
		this.marketClient = marketClient;
		this.tradingClient = tradingClient;
		this.timeSyncService = timeSyncService;
		this.properties = properties;
	}

	@Override
	public Mono<Void> connect() {
		if (!properties.hasCredentials()) {
			return Mono.error(new IllegalStateException(
					"Bybit API key/secret is not configured. Set BYBIT_API_KEY and BYBIT_SECRET_KEY."));
		}
		return timeSyncService.syncNow()
				.doOnNext(offset -> LOGGER.info("EVENT=VENUE_CONNECTED baseUrl={} testnet={} clockOffsetMs={}",
						properties.resolvedBaseUrl(), properties.useTestnet(), offset))
				.then();
	}

	@Override
	public Mono<Void> disconnect() {
		return Mono.fromRunnable(() -> LOGGER.info("EVENT=VENUE_DISCONNECTED baseUrl={}",
				properties.resolvedBaseUrl()));
	}

	@Override
	public Flux<VenuePosition> getPositions(String category, String symbol) {
		return tradingClient.fetchPositions(category, symbol);
	}

	@Override
	public Flux<OpenOrder> getOpenOrders(String category, String symbol) {
		return tradingClient.fetchOpenOrders(category, symbol);
	}

	@Override
	public Mono<OrderResult> placeOrder(OrderRequest request) {
		Mono<OrderResult> created = tradingClient.createOrder(request)
				.doOnNext(result -> LOGGER.info("EVENT=ORDER_CREATED symbol={} side={} type={} qty={} price={} orderId={}",
						request.symbol(), request.side(), request.orderType(), request.qty(), request.price(),
						result.orderId()));
		if (request.orderType() != OrderType.MARKET) {
			return created;
		}
		return created.flatMap(result -> fetchExecution(request, result));
	}

	private Mono<OrderResult> fetchExecution(OrderRequest request, OrderResult created) {
		return Mono.delay(FILL_LOOKUP_DELAY)
				.then(Mono.defer(() -> tradingClient.fetchOrder(request.category(), request.symbol(),
						created.orderId())))
				.retryWhen(Retry.fixedDelay(2, FILL_LOOKUP_DELAY))
				.doOnNext(filled -> LOGGER.info("EVENT=ORDER_EXECUTION orderId={} status={} executedQty={} avgPrice={}",
						filled.orderId(), filled.orderStatus(), filled.executedQty(), filled.avgPrice()))
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=ORDER_EXECUTION_LOOKUP_FAIL orderId={} reason={}", created.orderId(),
							error.getMessage());
					return Mono.just(created);
				});
	}

	@Override
	public Mono<Void> cancelOrder(String category, String symbol, String orderId) {
		return tradingClient.cancelOrder(category, symbol, orderId);
	}

	@Override
	public Mono<BigDecimal> getLatestPrice(String category, String symbol) {
		return marketClient.fetchLastPrice(category, symbol);
	}

	@Override
	public Mono<TradingConstraints> getTradingConstraints(String category, String symbol) {
		return marketClient.fetchTradingConstraints(category, symbol);
	}

	@Override
	public Mono<List<Kline>> getKlines(String category, String symbol, String interval, int limit) {
		return marketClient.fetchKlines(category, symbol, toVenueInterval(interval), limit);
	}

	@Override
	public Mono<BigDecimal> getAvailableBalance(String coin) {
		return tradingClient.fetchAvailableBalance(coin);
	}

	/**
	 * Maps {@code 5m}, {@code 1h}, {@code 1d} style intervals to the minute counts and letters the kline
	 * endpoint accepts.
	 */
	static String toVenueInterval(String interval) {
		String normalized = interval.trim().toLowerCase(Locale.ROOT);
		if (normalized.endsWith("m")) {
			return normalized.substring(0, normalized.length() - 1);
		}
		if (normalized.endsWith("h")) {
			int hours = Integer.parseInt(normalized.substring(0, normalized.length() - 1));
			return Integer.toString(hours * 60);
		}
		if (normalized.equals("1d") || normalized.equals("d")) {
			return "D";
		}
		if (normalized.equals("1w") || normalized.equals("w")) {
			return "W";
		}
		return normalized.toUpperCase(Locale.ROOT);
	}
}
