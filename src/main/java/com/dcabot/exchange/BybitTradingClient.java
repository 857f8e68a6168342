package com.dcabot.exchange;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Supplier;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.dcabot.config.BybitProperties;
import com.dcabot.exchange.dto.OpenOrder;
import com.dcabot.exchange.dto.OrderRequest;
import com.dcabot.exchange.dto.OrderResult;
import com.dcabot.exchange.dto.OrderSide;
import com.dcabot.exchange.dto.OrderType;
import com.dcabot.exchange.dto.VenuePosition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Signed Bybit V5 endpoints: positions, orders and wallet balance.
 */
@Component
public class BybitTradingClient {

	private static final String HEADER_API_KEY = "X-BAPI-API-KEY";
	private static final String HEADER_SIGN = "X-BAPI-SIGN";
	private static final String HEADER_TIMESTAMP = "X-BAPI-TIMESTAMP";
	private static final String HEADER_RECV_WINDOW = "X-BAPI-RECV-WINDOW";
	private static final String MISSING_CREDENTIALS =
			"Bybit API key/secret is not configured. Set BYBIT_API_KEY and BYBIT_SECRET_KEY.";

	private final WebClient bybitWebClient;
	private final BybitProperties properties;
	private final RequestSigner signer;
	private final TimeSyncService timeSyncService;
	private final ObjectMapper objectMapper;

	public BybitTradingClient(WebClient bybitWebClient, BybitProperties properties, RequestSigner signer,
			TimeSyncService timeSyncService, ObjectMapper objectMapper) {
		this.bybitWebClient = bybitWebClient;
		this.properties = properties;
		this.signer = signer;
		this.timeSyncService = timeSyncService;
		this.objectMapper = objectMapper;
	}

	public Flux<VenuePosition> fetchPositions(String category, String symbol) {
		return signedGet("/v5/position/list", Map.of("category", category, "symbol", symbol), "position list")
				.flatMapIterable(BybitTradingClient::parsePositions);
	}

	public Flux<OpenOrder> fetchOpenOrders(String category, String symbol) {
		return signedGet("/v5/order/realtime", Map.of("category", category, "symbol", symbol, "openOnly", "0"),
				"open orders")
				.flatMapIterable(BybitTradingClient::parseOpenOrders);
	}

	public Mono<OrderResult> fetchOrder(String category, String symbol, String orderId) {
		return signedGet("/v5/order/realtime", Map.of("category", category, "symbol", symbol, "orderId", orderId),
				"order fetch")
				.flatMap(result -> {
					OrderResult order = parseOrderResult(result, orderId);
					return order == null
							? Mono.error(new VenueApiException(110001, 200, "order " + orderId + " not found"))
							: Mono.just(order);
				});
	}

	public Mono<OrderResult> createOrder(OrderRequest request) {
		ObjectNode body = objectMapper.createObjectNode();
		body.put("category", request.category());
		body.put("symbol", request.symbol());
		body.put("side", request.side().wireName());
		body.put("orderType", request.orderType().wireName());
		body.put("qty", request.qty().toPlainString());
		if (request.orderType() == OrderType.LIMIT) {
			body.put("price", request.price().toPlainString());
			body.put("timeInForce", "GTC");
		}
		if (request.reduceOnly()) {
			body.put("reduceOnly", true);
		}
		if (request.orderLinkId() != null && !request.orderLinkId().isBlank()) {
			body.put("orderLinkId", request.orderLinkId());
		}
		body.put("positionIdx", 0);
		return signedPost("/v5/order/create", body, "order create")
				.map(result -> new OrderResult(
						BybitEnvelope.text(result, "orderId"),
						BybitEnvelope.text(result, "orderLinkId"),
						"New",
						BigDecimal.ZERO,
						null));
	}

	public Mono<Void> cancelOrder(String category, String symbol, String orderId) {
		ObjectNode body = objectMapper.createObjectNode();
		body.put("category", category);
		body.put("symbol", symbol);
		body.put("orderId", orderId);
		return signedPost("/v5/order/cancel", body, "order cancel").then();
	}

	public Mono<BigDecimal> fetchAvailableBalance(String coin) {
		return signedGet("/v5/account/wallet-balance", Map.of("accountType", "UNIFIED", "coin", coin),
				"wallet balance")
				.map(result -> parseAvailableBalance(result, coin));
	}

	static List<VenuePosition> parsePositions(JsonNode result) {
		List<VenuePosition> positions = new ArrayList<>();
		for (JsonNode entry : result.path("list")) {
			positions.add(new VenuePosition(
					BybitEnvelope.text(entry, "symbol"),
					BybitEnvelope.text(entry, "side"),
					BybitEnvelope.text(entry, "size"),
					BybitEnvelope.text(entry, "positionValue"),
					BybitEnvelope.text(entry, "avgPrice")));
		}
		return positions;
	}

	static List<OpenOrder> parseOpenOrders(JsonNode result) {
		List<OpenOrder> orders = new ArrayList<>();
		for (JsonNode entry : result.path("list")) {
			String orderId = BybitEnvelope.text(entry, "orderId");
			if (orderId == null || orderId.isBlank()) {
				continue;
			}
			orders.add(new OpenOrder(
					orderId,
					BybitEnvelope.text(entry, "orderLinkId"),
					BybitEnvelope.text(entry, "symbol"),
					OrderSide.fromWire(BybitEnvelope.text(entry, "side")),
					OrderType.fromWire(BybitEnvelope.text(entry, "orderType")),
					NumericParser.parseOrNull(BybitEnvelope.text(entry, "price")),
					NumericParser.parseOrNull(BybitEnvelope.text(entry, "qty")),
					entry.path("reduceOnly").asBoolean(false),
					BybitEnvelope.text(entry, "orderStatus")));
		}
		return orders;
	}

	static OrderResult parseOrderResult(JsonNode result, String orderId) {
		for (JsonNode entry : result.path("list")) {
			if (orderId.equals(BybitEnvelope.text(entry, "orderId"))) {
				return new OrderResult(
						orderId,
						BybitEnvelope.text(entry, "orderLinkId"),
						BybitEnvelope.text(entry, "orderStatus"),
						NumericParser.parseOrZero(BybitEnvelope.text(entry, "cumExecQty")),
						NumericParser.parseOrNull(BybitEnvelope.text(entry, "avgPrice")));
			}
		}
		return null;
	}

	static BigDecimal parseAvailableBalance(JsonNode result, String coin) {
		for (JsonNode account : result.path("list")) {
			for (JsonNode coinNode : account.path("coin")) {
				if (!coin.equalsIgnoreCase(BybitEnvelope.text(coinNode, "coin"))) {
					continue;
				}
				BigDecimal available = NumericParser.parseOrNull(BybitEnvelope.text(coinNode, "availableToWithdraw"));
				if (available != null) {
					return available;
				}
				BigDecimal wallet = NumericParser.parseOrNull(BybitEnvelope.text(coinNode, "walletBalance"));
				if (wallet != null) {
					BigDecimal positionMargin = NumericParser.parseOrZero(BybitEnvelope.text(coinNode, "totalPositionIM"));
					BigDecimal orderMargin = NumericParser.parseOrZero(BybitEnvelope.text(coinNode, "totalOrderIM"));
					return wallet.subtract(positionMargin).subtract(orderMargin).max(BigDecimal.ZERO);
				}
			}
			BigDecimal accountAvailable = NumericParser.parseOrNull(
					BybitEnvelope.text(account, "totalAvailableBalance"));
			if (accountAvailable != null) {
				return accountAvailable;
			}
		}
		return BigDecimal.ZERO;
	}

	private Mono<JsonNode> signedGet(String path, Map<String, String> params, String operation) {
		if (!properties.hasCredentials()) {
			return Mono.error(new IllegalStateException(MISSING_CREDENTIALS));
		}
		String query = toQueryString(params);
		return withTimestampRetry(() -> {
			long timestamp = timeSyncService.currentTimestampMillis();
			long recvWindow = properties.resolvedRecvWindowMillis();
			String signature = signer.sign(timestamp, properties.apiKey(), recvWindow, query,
					properties.secretKey());
			return bybitWebClient
					.get()
					.uri(uriBuilder -> uriBuilder
							.path(path)
							.query(query)
							.build())
					.header(HEADER_API_KEY, properties.apiKey())
					.header(HEADER_SIGN, signature)
					.header(HEADER_TIMESTAMP, Long.toString(timestamp))
					.header(HEADER_RECV_WINDOW, Long.toString(recvWindow))
					.retrieve()
					.onStatus(status -> status.isError(), response -> response
							.bodyToMono(String.class)
							.defaultIfEmpty("<empty>")
							.flatMap(body -> Mono.error(BybitEnvelope.httpError("Bybit " + operation,
									response.statusCode().value(), body))))
					.bodyToMono(JsonNode.class)
					.map(body -> BybitEnvelope.result(body, "Bybit " + operation));
		});
	}

	private Mono<JsonNode> signedPost(String path, ObjectNode body, String operation) {
		if (!properties.hasCredentials()) {
			return Mono.error(new IllegalStateException(MISSING_CREDENTIALS));
		}
		String payload;
		try {
			payload = objectMapper.writeValueAsString(body);
		} catch (JsonProcessingException ex) {
			return Mono.error(new IllegalStateException("Unable to encode " + operation + " request", ex));
		}
		return withTimestampRetry(() -> {
			long timestamp = timeSyncService.currentTimestampMillis();
			long recvWindow = properties.resolvedRecvWindowMillis();
			String signature = signer.sign(timestamp, properties.apiKey(), recvWindow, payload,
					properties.secretKey());
			return bybitWebClient
					.post()
					.uri(path)
					.contentType(MediaType.APPLICATION_JSON)
					.header(HEADER_API_KEY, properties.apiKey())
					.header(HEADER_SIGN, signature)
					.header(HEADER_TIMESTAMP, Long.toString(timestamp))
					.header(HEADER_RECV_WINDOW, Long.toString(recvWindow))
					.bodyValue(payload)
					.retrieve()
					.onStatus(status -> status.isError(), response -> response
							.bodyToMono(String.class)
							.defaultIfEmpty("<empty>")
							.flatMap(errorBody -> Mono.error(BybitEnvelope.httpError("Bybit " + operation,
									response.statusCode().value(), errorBody))))
					.bodyToMono(JsonNode.class)
					.map(responseBody -> BybitEnvelope.result(responseBody, "Bybit " + operation));
		});
	}

	private <T> Mono<T> withTimestampRetry(Supplier<Mono<T>> requestSupplier) {
		return Mono.defer(requestSupplier)
				.onErrorResume(error -> {
					if (!BybitEnvelope.isTimestampError(error)) {
						return Mono.error(error);
					}
					return timeSyncService.syncNow()
							.then(Mono.defer(requestSupplier));
				});
	}

	static String toQueryString(Map<String, String> params) {
		StringJoiner joiner = new StringJoiner("&");
		params.entrySet().stream()
				.filter(entry -> entry.getValue() != null && !entry.getValue().isBlank())
				.sorted(Map.Entry.comparingByKey())
				.forEach(entry -> joiner.add(entry.getKey() + "=" + entry.getValue()));
		return joiner.toString();
	}
}
