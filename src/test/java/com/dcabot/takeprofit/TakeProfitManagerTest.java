package com.dcabot.takeprofit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.dcabot.config.BotProperties;
import com.dcabot.exchange.TradingVenue;
import com.dcabot.exchange.dto.OpenOrder;
import com.dcabot.exchange.dto.OrderRequest;
import com.dcabot.exchange.dto.OrderResult;
import com.dcabot.exchange.dto.OrderSide;
import com.dcabot.exchange.dto.OrderType;
import com.dcabot.exchange.dto.TradingConstraints;
import com.dcabot.exchange.dto.VenuePosition;
import com.dcabot.market.TradingConstraintsService;
import com.dcabot.position.PositionSynchronizer;
import com.dcabot.resilience.CircuitBreakerRegistry;
import com.dcabot.resilience.RateLimiterRegistry;
import com.dcabot.resilience.ResilienceProperties;
import com.dcabot.resilience.VenueCallGuard;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class TakeProfitManagerTest {

	private static final TradingConstraints CONSTRAINTS = new TradingConstraints("BTCUSDT", new BigDecimal("0.001"),
			new BigDecimal("100"), new BigDecimal("0.001"), new BigDecimal("5"), new BigDecimal("0.01"),
			new BigDecimal("100"));

	private final TradingVenue venue = mock(TradingVenue.class);
	private final AtomicLong now = new AtomicLong();
	private final AtomicInteger orderIds = new AtomicInteger();
	private PositionSynchronizer synchronizer;
	private TakeProfitManager manager;

	@BeforeEach
	void setUp() {
		ResilienceProperties resilience = new ResilienceProperties(null, new ResilienceProperties.Limits(100, 100),
				null, new ResilienceProperties.Limits(100, 100), null, null, null);
		VenueCallGuard guard = new VenueCallGuard(new CircuitBreakerRegistry(resilience), new RateLimiterRegistry(),
				resilience);
		BotProperties bot = new BotProperties("BTCUSDT", null, null, "5m", new BigDecimal("40"), 0, 0, true, true,
				null, 0, 0, 0, null);
		synchronizer = new PositionSynchronizer(venue, guard, bot);
		TradingConstraintsService constraints = new TradingConstraintsService(venue, guard, bot, Duration.ofHours(1));
		manager = new TakeProfitManager(venue, guard, synchronizer, constraints, new FixedTakeProfitPercent(0.02),
				TakeProfitProperties.defaults(), bot, resilience, now::get);
		manager.registerResyncListener();

		when(venue.getTradingConstraints("linear", "BTCUSDT")).thenReturn(Mono.just(CONSTRAINTS));
		when(venue.placeOrder(any())).thenAnswer(invocation -> Mono.just(
				new OrderResult("tp-" + orderIds.incrementAndGet(), null, "New", BigDecimal.ZERO, null)));
		when(venue.cancelOrder(eq("linear"), eq("BTCUSDT"), anyString())).thenReturn(Mono.empty());
		when(venue.getOpenOrders("linear", "BTCUSDT")).thenReturn(Flux.empty());
	}

	private static OpenOrder sellLimit(String id, String price, String qty) {
		return new OpenOrder(id, null, "BTCUSDT", OrderSide.SELL, OrderType.LIMIT, new BigDecimal(price),
				new BigDecimal(qty), true, "New");
	}

	@Test
	void placesFullLadderAboveAverage() {
		StepVerifier.create(manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")))
				.assertNext(result -> {
					assertThat(result.outcome()).isEqualTo(PlacementResult.Outcome.FULL);
					assertThat(result.placed()).isEqualTo(5);
				})
				.verifyComplete();

		List<TakeProfitLeg> legs = manager.trackedLegs();
		assertThat(legs).extracting(TakeProfitLeg::level).containsExactly(1, 2, 3, 4, 5);
		assertThat(legs.get(0).targetPrice()).isEqualByComparingTo("100.4");
		assertThat(legs.get(4).targetPrice()).isEqualByComparingTo("102");
		assertThat(legs).allSatisfy(leg -> {
			assertThat(leg.quantity()).isEqualByComparingTo("0.2");
			assertThat(leg.status()).isEqualTo(LegStatus.PENDING);
		});

		ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
		verify(venue, times(5)).placeOrder(captor.capture());
		assertThat(captor.getAllValues()).allSatisfy(request -> {
			assertThat(request.side()).isEqualTo(OrderSide.SELL);
			assertThat(request.orderType()).isEqualTo(OrderType.LIMIT);
			assertThat(request.reduceOnly()).isTrue();
		});
	}

	@Test
	void replacingLadderCancelsTrackedLegsFirst() {
		manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")).block();

		StepVerifier.create(manager.placeAll(new BigDecimal("1.000"), new BigDecimal("98")))
				.expectNextMatches(result -> result.placed() == 5)
				.verifyComplete();

		verify(venue).cancelOrder("linear", "BTCUSDT", "tp-1");
		verify(venue).cancelOrder("linear", "BTCUSDT", "tp-5");
		assertThat(manager.trackedLegs()).extracting(TakeProfitLeg::orderId)
				.containsExactly("tp-6", "tp-7", "tp-8", "tp-9", "tp-10");
	}

	@Test
	void failedCancelDoesNotBlockNewLadder() {
		manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")).block();
		when(venue.cancelOrder(eq("linear"), eq("BTCUSDT"), anyString()))
				.thenReturn(Mono.error(new IllegalStateException("order not exists")));

		StepVerifier.create(manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")))
				.expectNextMatches(result -> result.placed() == 5)
				.verifyComplete();
	}

	@Test
	void singleLegFailureYieldsPartialResult() {
		when(venue.placeOrder(any())).thenAnswer(invocation -> {
			int id = orderIds.incrementAndGet();
			if (id == 3) {
				return Mono.error(new IllegalStateException("price out of band"));
			}
			return Mono.just(new OrderResult("tp-" + id, null, "New", BigDecimal.ZERO, null));
		});

		StepVerifier.create(manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")))
				.assertNext(result -> {
					assertThat(result.outcome()).isEqualTo(PlacementResult.Outcome.PARTIAL);
					assertThat(result.placed()).isEqualTo(4);
					assertThat(result.failed()).isEqualTo(1);
				})
				.verifyComplete();
	}

	@Test
	void noPlacedLegIsAnError() {
		when(venue.placeOrder(any())).thenReturn(Mono.error(new IllegalStateException("rejected")));

		StepVerifier.create(manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")))
				.expectErrorSatisfies(error -> {
					assertThat(error).isInstanceOf(TakeProfitPlacementException.class);
					assertThat(((TakeProfitPlacementException) error).result().failed()).isEqualTo(5);
				})
				.verify();
		assertThat(manager.hasLegs()).isFalse();
	}

	@Test
	void legsBelowMinimumValueAreSkipped() {
		StepVerifier.create(manager.placeAll(new BigDecimal("0.040"), new BigDecimal("100")))
				.expectErrorSatisfies(error -> assertThat(((TakeProfitPlacementException) error).result().skipped())
						.isEqualTo(5))
				.verify();
		verify(venue, never()).placeOrder(any());
	}

	@Test
	void stopsSendingLegsWhenBatchBudgetRunsOut() {
		when(venue.placeOrder(any())).thenAnswer(invocation -> {
			now.addAndGet(40_000);
			return Mono.just(new OrderResult("tp-" + orderIds.incrementAndGet(), null, "New", BigDecimal.ZERO, null));
		});

		StepVerifier.create(manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")))
				.assertNext(result -> {
					assertThat(result.outcome()).isEqualTo(PlacementResult.Outcome.PARTIAL);
					assertThat(result.placed()).isEqualTo(3);
					assertThat(result.skipped()).isEqualTo(2);
				})
				.verifyComplete();
	}

	@Test
	void legsMissingFromVenueAreReportedFilled() {
		manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")).block();
		when(venue.getOpenOrders("linear", "BTCUSDT")).thenReturn(Flux.just(
				sellLimit("tp-2", "100.8", "0.2"), sellLimit("tp-3", "101.2", "0.2"),
				sellLimit("tp-4", "101.6", "0.2"), sellLimit("tp-5", "102", "0.2")));

		StepVerifier.create(manager.detectFills())
				.assertNext(filled -> {
					assertThat(filled).hasSize(1);
					assertThat(filled.get(0).orderId()).isEqualTo("tp-1");
					assertThat(filled.get(0).status()).isEqualTo(LegStatus.FILLED);
				})
				.verifyComplete();
		assertThat(manager.trackedLegs()).hasSize(4);
		assertThat(manager.filledLegs()).hasSize(1);
	}

	@Test
	void cancelAllTwiceNeverErrors() {
		manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")).block();
		when(venue.getOpenOrders("linear", "BTCUSDT"))
				.thenReturn(Flux.just(sellLimit("tp-1", "100.4", "0.2"), sellLimit("tp-2", "100.8", "0.2")))
				.thenReturn(Flux.empty());

		StepVerifier.create(manager.cancelAll()).expectNext(2).verifyComplete();
		StepVerifier.create(manager.cancelAll()).expectNext(0).verifyComplete();
		assertThat(manager.hasLegs()).isFalse();
	}

	@Test
	void cancelAllFallsBackToTrackedLegsWhenQueryFails() {
		manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")).block();
		when(venue.getOpenOrders("linear", "BTCUSDT")).thenReturn(Flux.error(new IllegalStateException("down")));

		StepVerifier.create(manager.cancelAll()).expectNext(5).verifyComplete();
	}

	@Test
	void externalCloseClearsTrackedLegs() {
		synchronizer.applyVenueReport(List.of(new VenuePosition("BTCUSDT", "Buy", "1", "100", "100")));
		manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")).block();

		synchronizer.applyVenueReport(List.of());

		assertThat(manager.hasLegs()).isFalse();
	}

	@Test
	void updateOnFlatPositionCancelsInsteadOfPlacing() {
		manager.placeAll(new BigDecimal("1.000"), new BigDecimal("100")).block();
		when(venue.getPositions("linear", "BTCUSDT")).thenReturn(Flux.empty());

		StepVerifier.create(manager.updateAll(new BigDecimal("100"))).verifyComplete();
		assertThat(manager.hasLegs()).isFalse();
		verify(venue, times(5)).placeOrder(any());
	}

	@Test
	void updatePrefersVenueAverageWhenItMoved() {
		when(venue.getPositions("linear", "BTCUSDT"))
				.thenReturn(Flux.just(new VenuePosition("BTCUSDT", "Buy", "1", "95", "95")));

		StepVerifier.create(manager.updateAll(new BigDecimal("100")))
				.expectNextMatches(result -> result.placed() == 5)
				.verifyComplete();
		assertThat(manager.trackedLegs().get(0).targetPrice()).isEqualByComparingTo("95.38");
	}

	@Test
	void orphansAreAdoptedWhenCancellationIsOff() {
		synchronizer.applyVenueReport(List.of(new VenuePosition("BTCUSDT", "Buy", "1", "100", "100")));
		when(venue.getOpenOrders("linear", "BTCUSDT")).thenReturn(Flux.just(
				sellLimit("old-2", "103", "0.3"), sellLimit("old-1", "101", "0.3"),
				new OpenOrder("buy-1", null, "BTCUSDT", OrderSide.BUY, OrderType.LIMIT, new BigDecimal("90"),
						new BigDecimal("0.1"), false, "New")));

		StepVerifier.create(manager.adoptOrCancelOrphans()).expectNext(2).verifyComplete();
		assertThat(manager.trackedLegs()).extracting(TakeProfitLeg::orderId).containsExactly("old-1", "old-2");
		verify(venue, never()).cancelOrder(anyString(), anyString(), anyString());
	}
}
