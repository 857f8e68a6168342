package com.dcabot.market;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.dcabot.exchange.BybitEnvelope;
import com.dcabot.exchange.NumericParser;
import com.dcabot.exchange.VenueApiException;
import com.dcabot.exchange.dto.TradingConstraints;
import com.dcabot.market.dto.Kline;
import com.fasterxml.jackson.databind.JsonNode;

import reactor.core.publisher.Mono;

@Component
public class BybitMarketClient {

	private final WebClient bybitWebClient;

	public BybitMarketClient(WebClient bybitWebClient) {
		this.bybitWebClient = bybitWebClient;
	}

	public Mono<BigDecimal> fetchLastPrice(String category, String symbol) {
		return fetchPublic("/v5/market/tickers", category, symbol, null, 0, "ticker")
				.map(result -> parseLastPrice(result, symbol));
	}

	public Mono<TradingConstraints> fetchTradingConstraints(String category, String symbol) {
		return fetchPublic("/v5/market/instruments-info", category, symbol, null, 0, "instruments info")
				.map(result -> parseTradingConstraints(result, symbol));
	}

	public Mono<List<Kline>> fetchKlines(String category, String symbol, String interval, int limit) {
		return fetchPublic("/v5/market/kline", category, symbol, interval, limit, "kline")
				.map(BybitMarketClient::parseKlines);
	}

	private Mono<JsonNode> fetchPublic(String path, String category, String symbol, String interval, int limit,
			String operation) {
		return bybitWebClient
				.get()
				.uri(uriBuilder -> {
					uriBuilder.path(path)
							.queryParam("category", category)
							.queryParam("symbol", symbol);
					if (interval != null) {
						uriBuilder.queryParam("interval", interval);
					}
					if (limit > 0) {
						uriBuilder.queryParam("limit", limit);
					}
					return uriBuilder.build();
				})
				.retrieve()
				.onStatus(status -> status.isError(), response -> response
						.bodyToMono(String.class)
						.defaultIfEmpty("<empty>")
						.flatMap(body -> Mono.error(BybitEnvelope.httpError("Bybit " + operation,
								response.statusCode().value(), body))))
				.bodyToMono(JsonNode.class)
				.map(body -> BybitEnvelope.result(body, "Bybit " + operation));
	}

	static BigDecimal parseLastPrice(JsonNode result, String symbol) {
		for (JsonNode entry : result.path("list")) {
			if (symbol.equalsIgnoreCase(BybitEnvelope.text(entry, "symbol"))) {
				BigDecimal price = NumericParser.parseOrNull(BybitEnvelope.text(entry, "lastPrice"));
				if (price != null && price.signum() > 0) {
					return price;
				}
			}
		}
		throw new VenueApiException(null, 200, "no last price for " + symbol);
	}

	static TradingConstraints parseTradingConstraints(JsonNode result, String symbol) {
		for (JsonNode entry : result.path("list")) {
			if (!symbol.equalsIgnoreCase(BybitEnvelope.text(entry, "symbol"))) {
				continue;
			}
			JsonNode lotSize = entry.path("lotSizeFilter");
			JsonNode priceFilter = entry.path("priceFilter");
			JsonNode leverageFilter = entry.path("leverageFilter");
			return new TradingConstraints(
					symbol,
					NumericParser.parseOrZero(BybitEnvelope.text(lotSize, "minOrderQty")),
					NumericParser.parseOrNull(BybitEnvelope.text(lotSize, "maxOrderQty")),
					NumericParser.parseOrNull(BybitEnvelope.text(lotSize, "qtyStep")),
					NumericParser.parseOrZero(BybitEnvelope.text(lotSize, "minNotionalValue")),
					NumericParser.parseOrNull(BybitEnvelope.text(priceFilter, "tickSize")),
					NumericParser.parseOrNull(BybitEnvelope.text(leverageFilter, "maxLeverage")));
		}
		throw new VenueApiException(110009, 200, "instrument not found: " + symbol);
	}

	/**
	 * Bybit lists candles newest first; the returned list is oldest first.
	 */
	static List<Kline> parseKlines(JsonNode result) {
		List<Kline> klines = new ArrayList<>();
		for (JsonNode entry : result.path("list")) {
			if (!entry.isArray() || entry.size() < 6) {
				continue;
			}
			klines.add(new Kline(
					entry.get(0).asLong(),
					entry.get(1).asDouble(),
					entry.get(2).asDouble(),
					entry.get(3).asDouble(),
					entry.get(4).asDouble(),
					entry.get(5).asDouble()));
		}
		Collections.reverse(klines);
		return klines;
	}
}
