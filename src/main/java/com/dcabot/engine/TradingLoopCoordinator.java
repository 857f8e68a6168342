package com.dcabot.engine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.dcabot.config.BotProperties;
import com.dcabot.exchange.TradingVenue;
import com.dcabot.market.dto.Kline;
import com.dcabot.position.PositionSnapshot;
import com.dcabot.position.PositionSynchronizer;
import com.dcabot.resilience.BotException;
import com.dcabot.resilience.CircuitBreakerRegistry;
import com.dcabot.resilience.ErrorCategory;
import com.dcabot.resilience.ErrorClassifier;
import com.dcabot.resilience.OperationClass;
import com.dcabot.resilience.VenueCallGuard;
import com.dcabot.strategy.EntryDecision;
import com.dcabot.strategy.EntryGate;
import com.dcabot.strategy.EntrySignal;
import com.dcabot.strategy.EntrySignalProvider;
import com.dcabot.takeprofit.PlacementResult;
import com.dcabot.takeprofit.TakeProfitManager;
import com.dcabot.takeprofit.TakeProfitProperties;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Runs one trading cycle per candle boundary until stopped. A failing cycle is logged and the loop
 * carries on; repeated credential failures halt it.
 */
@Component
public class TradingLoopCoordinator {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingLoopCoordinator.class);
	private static final String COMPONENT = "TradingLoopCoordinator";

	private final TradingVenue venue;
	private final PositionSynchronizer synchronizer;
	private final TakeProfitManager takeProfitManager;
	private final EntryGate entryGate;
	private final EntrySignalProvider signalProvider;
	private final EntryExecutor entryExecutor;
	private final VenueCallGuard guard;
	private final CircuitBreakerRegistry breakers;
	private final BotProperties properties;
	private final BigDecimal averageTolerance;
	private final boolean autoTakeProfit;
	private final Supplier<Instant> clock;

	private final Sinks.Empty<Void> stopSignal = Sinks.empty();
	private final Sinks.Empty<Void> loopDone = Sinks.empty();
	private final AtomicBoolean stopped = new AtomicBoolean();
	private final AtomicBoolean loopActive = new AtomicBoolean();
	private final AtomicReference<Mono<ShutdownOutcome>> shutdownRef = new AtomicReference<>();
	private final AtomicInteger consecutiveCredentialFailures = new AtomicInteger();
	private final AtomicReference<BigDecimal> ladderAverage = new AtomicReference<>();
	private final Deque<BotException> errorQueue = new ArrayDeque<>();

	@Autowired
	public TradingLoopCoordinator(TradingVenue venue, PositionSynchronizer synchronizer,
			TakeProfitManager takeProfitManager, EntryGate entryGate, EntrySignalProvider signalProvider,
			EntryExecutor entryExecutor, VenueCallGuard guard, CircuitBreakerRegistry breakers,
			BotProperties properties, TakeProfitProperties takeProfitProperties) {
		this(venue, synchronizer, takeProfitManager, entryGate, signalProvider, entryExecutor, guard, breakers,
				properties, takeProfitProperties, Instant::now);
	}

	TradingLoopCoordinator(TradingVenue venue, PositionSynchronizer synchronizer,
			TakeProfitManager takeProfitManager, EntryGate entryGate, EntrySignalProvider signalProvider,
			EntryExecutor entryExecutor, VenueCallGuard guard, CircuitBreakerRegistry breakers,
			BotProperties properties, TakeProfitProperties takeProfitProperties, Supplier<Instant> clock) {
		this.venue = venue;
		this.synchronizer = synchronizer;
		this.takeProfitManager = takeProfitManager;
		this.entryGate = entryGate;
		this.signalProvider = signalProvider;
		this.entryExecutor = entryExecutor;
		this.guard = guard;
		this.breakers = breakers;
		this.properties = properties;
		this.averageTolerance = BigDecimal.valueOf(takeProfitProperties.averageTolerance());
		this.autoTakeProfit = takeProfitProperties.autoEnabled();
		this.clock = clock;
	}

	/**
	 * Connects, loads the venue state, then ticks on every interval boundary. Once the loop ends,
	 * whether stopped from outside or halted, the shutdown sequence runs before this completes.
	 */
	public Mono<Void> run() {
		return startup()
				.then(loop())
				.then(Mono.defer(this::shutdown))
				.then();
	}

	Mono<Void> startup() {
		return venue.connect()
				.then(refreshBalance()
						.doOnNext(balance -> LOGGER.info("EVENT=BALANCE_LOADED coin={} available={}",
								properties.quoteCoin(), balance))
						.then())
				.then(synchronizer.syncPosition()
						.doOnNext(position -> {
							credentialCallSucceeded();
							LOGGER.info("EVENT=POSITION_LOADED symbol={} qty={} avgPrice={} level={}",
									position.symbol(), position.quantity(), position.averagePrice(), position.dcaLevel());
						})
						.onErrorResume(error -> {
							recordError(error, "syncPosition");
							return Mono.empty();
						})
						.then())
				.then(takeProfitManager.adoptOrCancelOrphans()
						.onErrorResume(error -> {
							LOGGER.warn("EVENT=TP_ORPHAN_CHECK_FAIL reason={}", error.getMessage());
							return Mono.just(0);
						})
						.then());
	}

	Mono<Void> loop() {
		Duration interval = IntervalAlignment.parse(properties.interval());
		Duration initialDelay = IntervalAlignment.untilNextBoundary(clock.get(), interval);
		LOGGER.info("EVENT=LOOP_START symbol={} interval={} firstTickInMs={}", properties.symbol(), interval,
				initialDelay.toMillis());
		return Flux.interval(initialDelay, interval)
				.onBackpressureDrop(tick -> LOGGER.warn("EVENT=CYCLE_SKIPPED reason=previous_cycle_running tick={}",
						tick))
				.takeUntilOther(stopSignal.asMono())
				.concatMap(tick -> runCycle()
						.onErrorResume(error -> {
							recordError(error, "cycle");
							return Mono.empty();
						}), 1)
				.then()
				.doOnSubscribe(subscription -> loopActive.set(true))
				.doFinally(signal -> {
					LOGGER.info("EVENT=LOOP_END signal={}", signal);
					loopDone.tryEmitEmpty();
				});
	}

	Mono<CycleReport> runCycle() {
		return Mono.defer(() -> {
			Instant startedAt = clock.get();
			return refreshState()
					.then(Mono.zip(
							guard.execute(OperationClass.MARKET_DATA, "getLatestPrice",
									() -> venue.getLatestPrice(properties.category(), properties.symbol())),
							guard.execute(OperationClass.MARKET_DATA, "getKlines",
									() -> venue.getKlines(properties.category(), properties.symbol(),
											properties.interval(), properties.klineLimit()))))
					.flatMap(market -> cycleWithMarket(startedAt, market.getT1(), market.getT2()));
		});
	}

	private Mono<Void> refreshState() {
		return refreshBalance()
				.then(synchronizer.syncPosition()
						.doOnNext(position -> credentialCallSucceeded())
						.onErrorResume(error -> {
							recordError(error, "syncPosition");
							return Mono.just(synchronizer.snapshot());
						}))
				.then();
	}

	/**
	 * Balance read that feeds the credential streak. A failure leaves the last known balance in place.
	 */
	private Mono<BigDecimal> refreshBalance() {
		return synchronizer.refreshBalance()
				.doOnNext(balance -> credentialCallSucceeded())
				.onErrorResume(error -> {
					recordError(error, "syncBalance");
					return Mono.empty();
				});
	}

	private void credentialCallSucceeded() {
		int previous = consecutiveCredentialFailures.getAndSet(0);
		if (previous > 0) {
			LOGGER.info("EVENT=CREDENTIALS_ACCEPTED afterFailures={}", previous);
		}
	}

	private Mono<CycleReport> cycleWithMarket(Instant startedAt, BigDecimal price, List<Kline> klines) {
		takeProfitManager.observeMarket(klines);
		PositionSnapshot position = synchronizer.snapshot();
		EntrySignal signal = signalProvider.evaluate(klines);
		EntryDecision decision = entryGate.evaluate(position.dcaLevel(), position.averagePrice(), price, klines);

		Mono<Boolean> entry;
		if (!signal.buy()) {
			LOGGER.info("EVENT=ENTRY_NO_SIGNAL provider={} reason={}", signalProvider.name(), signal.reason());
			entry = Mono.just(false);
		} else if (!decision.allowed()) {
			LOGGER.info("EVENT=ENTRY_BLOCKED level={} reason={}", position.dcaLevel(), decision.reason());
			entry = Mono.just(false);
		} else if (stopped.get()) {
			LOGGER.info("EVENT=ENTRY_SKIPPED reason=stopping level={}", position.dcaLevel());
			entry = Mono.just(false);
		} else {
			entry = entryExecutor.execute(position.dcaLevel(), price)
					.flatMap(result -> {
						synchronizer.recordEntry();
						return synchronizer.syncPosition()
								.onErrorResume(error -> {
									recordError(error, "syncPosition");
									return Mono.just(synchronizer.snapshot());
								})
								.thenReturn(true);
					})
					.defaultIfEmpty(false);
		}

		return entry.flatMap(entryPlaced -> reconcileTakeProfit(entryPlaced)
				.then(detectFills())
				.map(filled -> {
					CycleReport report = new CycleReport(startedAt, price, signal, decision, entryPlaced,
							synchronizer.snapshot(), takeProfitManager.trackedLegs().size(), filled);
					logStatus(report);
					return report;
				}));
	}

	private Mono<Void> reconcileTakeProfit(boolean entryPlaced) {
		PositionSnapshot position = synchronizer.snapshot();
		if (!position.isOpen()) {
			ladderAverage.set(null);
			if (!takeProfitManager.hasLegs()) {
				return Mono.empty();
			}
			return takeProfitManager.cancelAll()
					.onErrorResume(error -> {
						recordError(error, "cancelTakeProfit");
						return Mono.just(0);
					})
					.then();
		}
		if (!autoTakeProfit) {
			return Mono.empty();
		}
		Mono<PlacementResult> action;
		if (entryPlaced || !takeProfitManager.hasLegs()) {
			action = takeProfitManager.placeAll(position.quantity(), position.averagePrice());
		} else if (averageMoved(ladderAverage.get(), position.averagePrice())) {
			action = takeProfitManager.updateAll(position.averagePrice());
		} else {
			return Mono.empty();
		}
		return action
				.doOnSuccess(ignored -> ladderAverage.set(position.averagePrice()))
				.onErrorResume(error -> {
					recordError(error, "reconcileTakeProfit");
					return Mono.empty();
				})
				.then();
	}

	private boolean averageMoved(BigDecimal previous, BigDecimal current) {
		if (previous == null || previous.signum() <= 0) {
			return true;
		}
		BigDecimal relative = current.subtract(previous).abs().divide(previous, MathContext.DECIMAL64);
		return relative.compareTo(averageTolerance) > 0;
	}

	private Mono<Integer> detectFills() {
		if (!takeProfitManager.hasLegs()) {
			return Mono.just(0);
		}
		return takeProfitManager.detectFills()
				.map(List::size)
				.onErrorResume(error -> {
					recordError(error, "detectFills");
					return Mono.just(0);
				});
	}

	private void logStatus(CycleReport report) {
		PositionSnapshot position = report.position();
		LOGGER.info("EVENT=CYCLE_STATUS symbol={} price={} qty={} avgPrice={} level={} signal={} gateAllowed={} "
				+ "entryPlaced={} tpLegs={} tpFilled={} balance={} openCircuits={}",
				properties.symbol(), report.price(), position.quantity(), position.averagePrice(), position.dcaLevel(),
				report.signal().buy(), report.decision().allowed(), report.entryPlaced(),
				report.activeTakeProfitLegs(), report.filledTakeProfitLegs(), synchronizer.availableBalance(),
				breakers.openCircuits());
	}

	void recordError(Throwable error, String operation) {
		BotException categorized = ErrorClassifier.categorize(error, COMPONENT, operation);
		synchronized (errorQueue) {
			if (errorQueue.size() >= properties.errorQueueCapacity()) {
				errorQueue.pollFirst();
			}
			errorQueue.addLast(categorized);
		}
		LOGGER.warn("EVENT=CYCLE_ERROR operation={} category={} reason={}", operation, categorized.category(),
				categorized.getMessage());
		if (categorized.category() == ErrorCategory.CREDENTIALS) {
			int failures = consecutiveCredentialFailures.incrementAndGet();
			if (failures >= properties.credentialFailureLimit()) {
				LOGGER.error("EVENT=BOT_HALTED reason=credential_failures count={}", failures);
				stop();
			}
		}
	}

	public List<BotException> recentErrors() {
		synchronized (errorQueue) {
			return List.copyOf(errorQueue);
		}
	}

	public boolean isStopped() {
		return stopped.get();
	}

	/**
	 * Signals the loop to end after the current cycle. Idempotent.
	 */
	public void stop() {
		if (stopped.compareAndSet(false, true)) {
			stopSignal.tryEmitEmpty();
			LOGGER.info("EVENT=STOP_SIGNALLED symbol={}", properties.symbol());
		}
	}

	/**
	 * Stops the loop and waits for a cycle in flight, then cancels take-profit legs, optionally
	 * flattens the position and disconnects, all within the configured timeout. Repeated calls share
	 * the first outcome.
	 */
	public Mono<ShutdownOutcome> shutdown() {
		Mono<ShutdownOutcome> created = Mono.defer(this::cleanup).cache();
		if (!shutdownRef.compareAndSet(null, created)) {
			return shutdownRef.get();
		}
		return created;
	}

	private Mono<ShutdownOutcome> cleanup() {
		stop();
		Duration timeout = properties.shutdownTimeout();
		Mono<Void> awaitLoop = loopActive.get()
				? loopDone.asMono().doOnSubscribe(subscription -> LOGGER.info("EVENT=SHUTDOWN_AWAIT_CYCLE"))
				: Mono.empty();
		Mono<Void> cancelLegs = Mono.defer(takeProfitManager::cancelAll)
				.doOnNext(count -> LOGGER.info("EVENT=SHUTDOWN_TP_CANCELLED count={}", count))
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=SHUTDOWN_TP_CANCEL_FAIL reason={}", error.getMessage());
					return Mono.empty();
				})
				.then();
		Mono<Void> flatten = properties.closePositionOnShutdown()
				? Mono.defer(synchronizer::flattenPosition)
						.doOnNext(qty -> LOGGER.info("EVENT=SHUTDOWN_POSITION_CLOSED qty={}", qty))
						.onErrorResume(error -> {
							LOGGER.warn("EVENT=SHUTDOWN_FLATTEN_FAIL reason={}", error.getMessage());
							return Mono.empty();
						})
						.then()
				: Mono.empty();
		Mono<Void> disconnect = venue.disconnect()
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=SHUTDOWN_DISCONNECT_FAIL reason={}", error.getMessage());
					return Mono.empty();
				});
		return awaitLoop.then(cancelLegs).then(flatten).then(disconnect)
				.thenReturn(ShutdownOutcome.GRACEFUL)
				.timeout(timeout, Mono.fromSupplier(() -> {
					LOGGER.error("EVENT=SHUTDOWN_FORCED timeoutMs={}", timeout.toMillis());
					return ShutdownOutcome.FORCED;
				}))
				.doOnNext(outcome -> LOGGER.info("EVENT=SHUTDOWN_DONE outcome={}", outcome));
	}
}
