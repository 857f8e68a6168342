package com.dcabot.exchange;

import java.math.BigDecimal;
import java.util.List;

import com.dcabot.exchange.dto.OpenOrder;
import com.dcabot.exchange.dto.OrderRequest;
import com.dcabot.exchange.dto.OrderResult;
import com.dcabot.exchange.dto.TradingConstraints;
import com.dcabot.exchange.dto.VenuePosition;
import com.dcabot.market.dto.Kline;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Venue operations the bot depends on. Implementations surface venue rejections as
 * {@link VenueApiException}.
 */
public interface TradingVenue {

	Mono<Void> connect();

	Mono<Void> disconnect();

	Flux<VenuePosition> getPositions(String category, String symbol);

	Flux<OpenOrder> getOpenOrders(String category, String symbol);

	/**
	 * Places an order. For market orders the executed quantity is read back from the venue before the
	 * result is emitted.
	 */
	Mono<OrderResult> placeOrder(OrderRequest request);

	Mono<Void> cancelOrder(String category, String symbol, String orderId);

	Mono<BigDecimal> getLatestPrice(String category, String symbol);

	Mono<TradingConstraints> getTradingConstraints(String category, String symbol);

	Mono<List<Kline>> getKlines(String category, String symbol, String interval, int limit);

	Mono<BigDecimal> getAvailableBalance(String coin);
}
