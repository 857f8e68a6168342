package com.dcabot.takeprofit;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.dcabot.config.BotProperties;
import com.dcabot.exchange.TradingVenue;
import com.dcabot.exchange.dto.OpenOrder;
import com.dcabot.exchange.dto.OrderRequest;
import com.dcabot.exchange.dto.OrderSide;
import com.dcabot.exchange.dto.TradingConstraints;
import com.dcabot.market.TradingConstraintsService;
import com.dcabot.market.dto.Kline;
import com.dcabot.position.PositionSnapshot;
import com.dcabot.position.PositionSynchronizer;
import com.dcabot.position.ResyncListener;
import com.dcabot.resilience.OperationClass;
import com.dcabot.resilience.ResilienceProperties;
import com.dcabot.resilience.VenueCallGuard;

import jakarta.annotation.PostConstruct;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keeps a ladder of reduce-only limit sells above the average entry. The ladder is always replaced as a
 * whole: tracked legs are cancelled and forgotten before any new leg is sent.
 */
@Component
public class TakeProfitManager implements ResyncListener {

	private static final Logger LOGGER = LoggerFactory.getLogger(TakeProfitManager.class);

	private final TradingVenue venue;
	private final VenueCallGuard guard;
	private final PositionSynchronizer synchronizer;
	private final TradingConstraintsService constraintsService;
	private final TakeProfitPercentSource percentSource;
	private final TakeProfitProperties properties;
	private final BotProperties botProperties;
	private final Duration batchTimeout;
	private final Duration callTimeout;
	private final TakeProfitClassifier classifier;
	private final LongSupplier clock;

	private final Object legLock = new Object();
	private final List<TakeProfitLeg> trackedLegs = new ArrayList<>();
	private final List<TakeProfitLeg> filledLegs = new ArrayList<>();
	private volatile List<Kline> marketHistory = List.of();

	@Autowired
	public TakeProfitManager(TradingVenue venue, VenueCallGuard guard, PositionSynchronizer synchronizer,
			TradingConstraintsService constraintsService, TakeProfitPercentSource percentSource,
			TakeProfitProperties properties, BotProperties botProperties, ResilienceProperties resilience) {
		this(venue, guard, synchronizer, constraintsService, percentSource, properties, botProperties, resilience,
				System::currentTimeMillis);
	}

	TakeProfitManager(TradingVenue venue, VenueCallGuard guard, PositionSynchronizer synchronizer,
			TradingConstraintsService constraintsService, TakeProfitPercentSource percentSource,
			TakeProfitProperties properties, BotProperties botProperties, ResilienceProperties resilience,
			LongSupplier clock) {
		this.venue = venue;
		this.guard = guard;
		this.synchronizer = synchronizer;
		this.constraintsService = constraintsService;
		this.percentSource = percentSource;
		this.properties = properties;
		this.botProperties = botProperties;
		this.batchTimeout = resilience.batchTimeout();
		this.callTimeout = resilience.callTimeout();
		this.classifier = new TakeProfitClassifier(botProperties.symbol(), properties);
		this.clock = clock;
	}

	@PostConstruct
	public void registerResyncListener() {
		synchronizer.addResyncListener(this);
	}

	@Override
	public void onPositionClosedExternally(PositionSnapshot previous) {
		List<TakeProfitLeg> dropped;
		synchronized (legLock) {
			dropped = new ArrayList<>(trackedLegs);
			trackedLegs.clear();
		}
		LOGGER.info("EVENT=TP_LEGS_CLEARED reason=position_closed droppedLegs={}", dropped.size());
	}

	/**
	 * Latest klines, used by dynamic percentage sources.
	 */
	public void observeMarket(List<Kline> klines) {
		marketHistory = klines == null ? List.of() : List.copyOf(klines);
	}

	public Mono<PlacementResult> placeAll(BigDecimal totalQuantity, BigDecimal averagePrice) {
		return cancelTracked()
				.then(constraintsService.constraints())
				.flatMap(constraints -> placeLadder(totalQuantity, averagePrice, constraints));
	}

	private Mono<PlacementResult> placeLadder(BigDecimal totalQuantity, BigDecimal averagePrice,
			TradingConstraints constraints) {
		int levels = properties.levels();
		List<BigDecimal> quantities = LegQuantityDistributor.distribute(totalQuantity, levels,
				properties.quantityFraction(), constraints);
		double tpPercent = percentSource.percent(marketHistory, averagePrice);
		long deadline = clock.getAsLong() + batchTimeout.toMillis();
		String batchId = Long.toString(clock.getAsLong(), 36);
		AtomicInteger skipped = new AtomicInteger(levels - quantities.size());
		AtomicInteger failed = new AtomicInteger();

		LOGGER.info("EVENT=TP_BATCH_START symbol={} totalQty={} avgPrice={} levels={} fundedLegs={} tpPercent={} source={}",
				botProperties.symbol(), totalQuantity, averagePrice, levels, quantities.size(), tpPercent,
				percentSource.name());

		return Flux.range(1, quantities.size())
				.concatMap(level -> {
					long remaining = deadline - clock.getAsLong();
					if (remaining < properties.safetyMargin().toMillis()) {
						LOGGER.warn("EVENT=TP_BATCH_BUDGET_EXHAUSTED level={} remainingMs={}", level, remaining);
						skipped.incrementAndGet();
						return Mono.empty();
					}
					BigDecimal quantity = quantities.get(level - 1);
					BigDecimal price = legPrice(averagePrice, level, levels, tpPercent, constraints);
					if (!meetsMinimums(quantity, price, constraints)) {
						LOGGER.warn("EVENT=TP_LEG_SKIPPED level={} qty={} price={} minQty={} minValue={}", level,
								quantity, price, constraints.minOrderQty(), constraints.minOrderValue());
						skipped.incrementAndGet();
						return Mono.empty();
					}
					Duration timeout = Duration.ofMillis(Math.min(callTimeout.toMillis(), remaining));
					return placeLeg(level, quantity, price, batchId, timeout)
							.onErrorResume(error -> {
								LOGGER.warn("EVENT=TP_LEG_FAIL level={} qty={} price={} reason={}", level, quantity,
										price, error.getMessage());
								failed.incrementAndGet();
								return Mono.empty();
							});
				})
				.collectList()
				.flatMap(placed -> {
					PlacementResult result = PlacementResult.of(levels, skipped.get(), failed.get(), placed);
					LOGGER.info("EVENT=TP_BATCH_DONE outcome={} placed={} skipped={} failed={}", result.outcome(),
							result.placed(), result.skipped(), result.failed());
					if (!result.succeeded()) {
						return Mono.error(new TakeProfitPlacementException(result));
					}
					return Mono.just(result);
				});
	}

	static BigDecimal legPrice(BigDecimal averagePrice, int level, int levels, double tpPercent,
			TradingConstraints constraints) {
		BigDecimal levelPercent = BigDecimal.valueOf(tpPercent)
				.multiply(BigDecimal.valueOf(level))
				.divide(BigDecimal.valueOf(levels), MathContext.DECIMAL64);
		BigDecimal raw = averagePrice.multiply(BigDecimal.ONE.add(levelPercent));
		BigDecimal rounded = constraints.roundToTick(raw);
		return rounded.scale() < 0 ? rounded.setScale(0, RoundingMode.UNNECESSARY) : rounded;
	}

	private static boolean meetsMinimums(BigDecimal quantity, BigDecimal price, TradingConstraints constraints) {
		if (quantity.signum() <= 0) {
			return false;
		}
		if (constraints.minOrderQty() != null && quantity.compareTo(constraints.minOrderQty()) < 0) {
			return false;
		}
		return constraints.minOrderValue() == null
				|| quantity.multiply(price).compareTo(constraints.minOrderValue()) >= 0;
	}

	private Mono<TakeProfitLeg> placeLeg(int level, BigDecimal quantity, BigDecimal price, String batchId,
			Duration timeout) {
		OrderRequest request = OrderRequest.limit(botProperties.category(), botProperties.symbol(), OrderSide.SELL,
				quantity, price, true, "tp" + level + "-" + batchId);
		return guard.execute(OperationClass.TRADING, "placeTakeProfit", timeout, () -> venue.placeOrder(request))
				.map(result -> new TakeProfitLeg(level, price, quantity, result.orderId(), LegStatus.PENDING))
				.doOnNext(leg -> {
					synchronized (legLock) {
						trackedLegs.add(leg);
					}
					LOGGER.info("EVENT=TP_LEG_PLACED level={} qty={} price={} orderId={}", level, quantity, price,
							leg.orderId());
				});
	}

	/**
	 * Re-reads the position, records fills and rebuilds the ladder around the venue's average. A flat
	 * position cancels every leg and completes empty.
	 */
	public Mono<PlacementResult> updateAll(BigDecimal newAveragePrice) {
		return synchronizer.syncPosition()
				.flatMap(position -> {
					if (!position.isOpen()) {
						return cancelAll().then(Mono.<PlacementResult>empty());
					}
					BigDecimal average = resolveAverage(newAveragePrice, position.averagePrice());
					return detectFills()
							.onErrorResume(error -> {
								LOGGER.warn("EVENT=TP_FILL_CHECK_FAIL reason={}", error.getMessage());
								return Mono.just(List.of());
							})
							.then(placeAll(position.quantity(), average));
				});
	}

	BigDecimal resolveAverage(BigDecimal requested, BigDecimal venueAverage) {
		if (venueAverage == null || venueAverage.signum() <= 0) {
			return requested;
		}
		if (requested == null || requested.signum() <= 0) {
			return venueAverage;
		}
		BigDecimal relative = venueAverage.subtract(requested).abs().divide(requested, MathContext.DECIMAL64);
		if (relative.compareTo(BigDecimal.valueOf(properties.averageTolerance())) > 0) {
			LOGGER.info("EVENT=TP_AVG_FROM_VENUE requested={} venue={}", requested, venueAverage);
			return venueAverage;
		}
		return requested;
	}

	/**
	 * Moves tracked legs that are no longer open on the venue to the filled set and returns them.
	 */
	public Mono<List<TakeProfitLeg>> detectFills() {
		return fetchOpenOrders()
				.map(open -> {
					Set<String> openIds = open.stream().map(OpenOrder::orderId).collect(Collectors.toSet());
					List<TakeProfitLeg> newlyFilled = new ArrayList<>();
					synchronized (legLock) {
						trackedLegs.removeIf(leg -> {
							if (openIds.contains(leg.orderId())) {
								return false;
							}
							newlyFilled.add(leg.filled());
							return true;
						});
						filledLegs.addAll(newlyFilled);
					}
					for (TakeProfitLeg leg : newlyFilled) {
						LOGGER.info("EVENT=TP_FILLED level={} qty={} price={} orderId={}", leg.level(), leg.quantity(),
								leg.targetPrice(), leg.orderId());
					}
					return newlyFilled;
				});
	}

	public boolean isTakeProfitOrder(OpenOrder order) {
		PositionSnapshot position = synchronizer.snapshot();
		return classifier.isTakeProfitOrder(order, position.averagePrice(), position.quantity(), trackedIds());
	}

	/**
	 * Cancels every take-profit leg resting on the venue and forgets the tracked set. Emits the number of
	 * cancellations sent. If the open-order query fails only the tracked set is cancelled.
	 */
	public Mono<Integer> cancelAll() {
		Set<String> tracked = trackedIds();
		PositionSnapshot position = synchronizer.snapshot();
		synchronized (legLock) {
			trackedLegs.clear();
		}
		return fetchOpenOrders()
				.map(open -> open.stream()
						.filter(order -> classifier.isTakeProfitOrder(order, position.averagePrice(),
								position.quantity(), tracked))
						.map(OpenOrder::orderId)
						.collect(Collectors.toList()))
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=TP_OPEN_ORDERS_FAIL fallback=tracked count={} reason={}", tracked.size(),
							error.getMessage());
					return Mono.just(new ArrayList<>(tracked));
				})
				.flatMap(this::cancelOrders)
				.doOnNext(count -> {
					if (count > 0) {
						LOGGER.info("EVENT=TP_CANCEL_ALL cancelled={}", count);
					}
				});
	}

	/**
	 * Handles take-profit legs left on the venue by an earlier run: cancels them or adopts them into the
	 * tracked set so that the next {@link #placeAll} replaces them.
	 */
	public Mono<Integer> adoptOrCancelOrphans() {
		return fetchOpenOrders()
				.flatMap(open -> {
					Set<String> tracked = trackedIds();
					List<OpenOrder> orphans = open.stream()
							.filter(order -> !tracked.contains(order.orderId()) && isTakeProfitOrder(order))
							.sorted(Comparator.comparing(OpenOrder::price))
							.collect(Collectors.toList());
					if (orphans.isEmpty()) {
						return Mono.just(0);
					}
					if (properties.cancelOrphanedOrdersOnStartup()) {
						LOGGER.info("EVENT=TP_ORPHANS_CANCEL count={}", orphans.size());
						return cancelOrders(orphans.stream().map(OpenOrder::orderId).collect(Collectors.toList()));
					}
					synchronized (legLock) {
						int level = trackedLegs.size();
						for (OpenOrder orphan : orphans) {
							trackedLegs.add(new TakeProfitLeg(++level, orphan.price(), orphan.qty(), orphan.orderId(),
									LegStatus.PENDING));
						}
					}
					LOGGER.info("EVENT=TP_ORPHANS_ADOPTED count={}", orphans.size());
					return Mono.just(orphans.size());
				});
	}

	private Mono<Void> cancelTracked() {
		List<TakeProfitLeg> previous;
		synchronized (legLock) {
			previous = new ArrayList<>(trackedLegs);
			trackedLegs.clear();
		}
		if (previous.isEmpty()) {
			return Mono.empty();
		}
		return cancelOrders(previous.stream().map(TakeProfitLeg::orderId).collect(Collectors.toList())).then();
	}

	private Mono<Integer> cancelOrders(List<String> orderIds) {
		return Flux.fromIterable(orderIds)
				.concatMap(orderId -> guard.execute(OperationClass.TRADING, "cancelTakeProfit",
						() -> venue.cancelOrder(botProperties.category(), botProperties.symbol(), orderId))
						.thenReturn(1)
						.onErrorResume(error -> {
							LOGGER.warn("EVENT=TP_CANCEL_FAIL orderId={} reason={}", orderId, error.getMessage());
							return Mono.just(0);
						}))
				.reduce(0, Integer::sum);
	}

	private Mono<List<OpenOrder>> fetchOpenOrders() {
		return guard.executeMany(OperationClass.ACCOUNT_DATA, "getOpenOrders",
				() -> venue.getOpenOrders(botProperties.category(), botProperties.symbol()));
	}

	private Set<String> trackedIds() {
		synchronized (legLock) {
			return trackedLegs.stream().map(TakeProfitLeg::orderId).collect(Collectors.toCollection(HashSet::new));
		}
	}

	public List<TakeProfitLeg> trackedLegs() {
		synchronized (legLock) {
			return List.copyOf(trackedLegs);
		}
	}

	public List<TakeProfitLeg> filledLegs() {
		synchronized (legLock) {
			return List.copyOf(filledLegs);
		}
	}

	public boolean hasLegs() {
		synchronized (legLock) {
			return !trackedLegs.isEmpty();
		}
	}
}
