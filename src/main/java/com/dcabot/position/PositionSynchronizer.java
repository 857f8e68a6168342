package com.dcabot.position;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.dcabot.config.BotProperties;
import com.dcabot.exchange.NumericParser;
import com.dcabot.exchange.TradingVenue;
import com.dcabot.exchange.dto.OrderRequest;
import com.dcabot.exchange.dto.OrderSide;
import com.dcabot.exchange.dto.VenuePosition;
import com.dcabot.resilience.OperationClass;
import com.dcabot.resilience.VenueCallGuard;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Owns the local replica of the position and the account balance. The venue report always wins: values
 * are overwritten from it and never derived from fills.
 */
@Component
public class PositionSynchronizer {

	private static final Logger LOGGER = LoggerFactory.getLogger(PositionSynchronizer.class);
	private static final BigDecimal MIN_SIZE = new BigDecimal("0.001");
	private static final BigDecimal MIN_NOTIONAL = new BigDecimal("0.01");
	private static final int FETCH_ATTEMPTS = 3;
	private static final Duration FETCH_RETRY_STEP = Duration.ofMillis(500);

	private final TradingVenue venue;
	private final VenueCallGuard guard;
	private final BotProperties properties;
	private final List<ResyncListener> listeners = new CopyOnWriteArrayList<>();

	private final Object positionLock = new Object();
	private BigDecimal quantity = BigDecimal.ZERO;
	private BigDecimal notional = BigDecimal.ZERO;
	private BigDecimal averagePrice = BigDecimal.ZERO;
	private int dcaLevel;

	private final Object balanceLock = new Object();
	private BigDecimal availableBalance;

	public PositionSynchronizer(TradingVenue venue, VenueCallGuard guard, BotProperties properties) {
		this.venue = venue;
		this.guard = guard;
		this.properties = properties;
	}

	public void addResyncListener(ResyncListener listener) {
		listeners.add(listener);
	}

	/**
	 * Re-reads the position from the venue. The fetch is attempted three times, 500 ms then 1 s apart;
	 * on failure the previous replica is left untouched and the error is emitted.
	 */
	public Mono<PositionSnapshot> syncPosition() {
		return guard.executeMany(OperationClass.ACCOUNT_DATA, "getPositions",
				() -> venue.getPositions(properties.category(), properties.symbol()))
				.retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
					long attempt = signal.totalRetries() + 1;
					LOGGER.warn("EVENT=POSITION_SYNC_ATTEMPT_FAIL attempt={} reason={}", attempt,
							signal.failure().getMessage());
					if (attempt >= FETCH_ATTEMPTS) {
						return Mono.error(signal.failure());
					}
					return Mono.delay(FETCH_RETRY_STEP.multipliedBy(attempt));
				})))
				.map(this::applyVenueReport)
				.doOnError(error -> LOGGER.warn("EVENT=POSITION_SYNC_FAIL symbol={} reason={}", properties.symbol(),
						error.getMessage()));
	}

	public PositionSnapshot applyVenueReport(List<VenuePosition> report) {
		AcceptedRecord accepted = findAcceptedRecord(report);
		PositionSnapshot closedSnapshot = null;
		PositionSnapshot result;
		synchronized (positionLock) {
			if (accepted != null) {
				if (averagePrice.signum() > 0 && accepted.averagePrice().compareTo(averagePrice) != 0) {
					LOGGER.info("EVENT=POSITION_AVG_CHANGED from={} to={}", averagePrice, accepted.averagePrice());
				}
				quantity = accepted.quantity();
				notional = accepted.notional();
				averagePrice = accepted.averagePrice();
				if (dcaLevel == 0) {
					dcaLevel = estimateLevel(notional);
					LOGGER.info("EVENT=DCA_LEVEL_ESTIMATED level={} notional={} baseAmount={}", dcaLevel, notional,
							properties.baseAmount());
				}
			} else if (quantity.signum() > 0 || notional.signum() > 0) {
				closedSnapshot = snapshotLocked();
				quantity = BigDecimal.ZERO;
				notional = BigDecimal.ZERO;
				averagePrice = BigDecimal.ZERO;
				dcaLevel = 0;
			}
			result = snapshotLocked();
		}
		if (closedSnapshot != null) {
			LOGGER.info("EVENT=POSITION_CLOSED_EXTERNALLY symbol={} previousQty={} previousAvg={}",
					properties.symbol(), closedSnapshot.quantity(), closedSnapshot.averagePrice());
			notifyResync(closedSnapshot);
		}
		return result;
	}

	private AcceptedRecord findAcceptedRecord(List<VenuePosition> report) {
		for (VenuePosition position : report) {
			if (position == null || !properties.symbol().equalsIgnoreCase(position.symbol())) {
				continue;
			}
			BigDecimal size = NumericParser.parseOrNull(position.size());
			BigDecimal value = NumericParser.parseOrNull(position.positionValue());
			BigDecimal avg = NumericParser.parseOrNull(position.avgPrice());
			if (size == null && value == null && avg == null) {
				LOGGER.warn("EVENT=POSITION_RECORD_UNPARSEABLE symbol={} size='{}' value='{}' avgPrice='{}'",
						position.symbol(), position.size(), position.positionValue(), position.avgPrice());
				continue;
			}
			boolean hasSize = size != null && size.compareTo(MIN_SIZE) > 0;
			boolean hasValue = value != null && value.compareTo(MIN_NOTIONAL) > 0;
			boolean hasPrice = avg != null && avg.signum() > 0;
			if ((hasSize || hasValue) && hasPrice) {
				BigDecimal resolvedValue = value != null ? value : size.multiply(avg);
				BigDecimal resolvedSize = size != null ? size : resolvedValue.divide(avg, 8, RoundingMode.DOWN);
				return new AcceptedRecord(resolvedSize, resolvedValue, avg);
			}
		}
		return null;
	}

	private int estimateLevel(BigDecimal positionNotional) {
		BigDecimal base = properties.baseAmount();
		if (base == null || base.signum() <= 0) {
			return 1;
		}
		int estimated = positionNotional.divide(base, 0, RoundingMode.FLOOR).intValue();
		return Math.max(1, estimated);
	}

	private void notifyResync(PositionSnapshot previous) {
		for (ResyncListener listener : listeners) {
			try {
				listener.onPositionClosedExternally(previous);
			} catch (RuntimeException ex) {
				LOGGER.warn("EVENT=RESYNC_LISTENER_FAIL reason={}", ex.getMessage());
			}
		}
	}

	public void recordEntry() {
		synchronized (positionLock) {
			dcaLevel++;
			LOGGER.info("EVENT=DCA_LEVEL_INCREMENTED level={}", dcaLevel);
		}
	}

	public PositionSnapshot snapshot() {
		synchronized (positionLock) {
			return snapshotLocked();
		}
	}

	private PositionSnapshot snapshotLocked() {
		return new PositionSnapshot(properties.symbol(), "Buy", quantity, notional, averagePrice, dcaLevel);
	}

	/**
	 * Reads the available quote balance and stores it. Failures are emitted and leave the last known
	 * value in place.
	 */
	public Mono<BigDecimal> refreshBalance() {
		return guard.execute(OperationClass.ACCOUNT_DATA, "getAvailableBalance",
				() -> venue.getAvailableBalance(properties.quoteCoin()))
				.doOnNext(balance -> {
					synchronized (balanceLock) {
						availableBalance = balance;
					}
				});
	}

	public BigDecimal availableBalance() {
		synchronized (balanceLock) {
			return availableBalance;
		}
	}

	/**
	 * Closes the live position with a reduce-only market sell sized from a fresh venue read. Emits the
	 * quantity sent, or zero when nothing was open.
	 */
	public Mono<BigDecimal> flattenPosition() {
		return syncPosition()
				.flatMap(current -> {
					if (current.quantity().signum() <= 0) {
						return Mono.just(BigDecimal.ZERO);
					}
					OrderRequest close = OrderRequest.market(properties.category(), properties.symbol(),
							OrderSide.SELL, current.quantity(), true);
					LOGGER.info("EVENT=POSITION_FLATTEN symbol={} qty={} avgPrice={}", properties.symbol(),
							current.quantity(), current.averagePrice());
					return guard.execute(OperationClass.TRADING, "flattenPosition", () -> venue.placeOrder(close))
							.thenReturn(current.quantity());
				});
	}

	private record AcceptedRecord(BigDecimal quantity, BigDecimal notional, BigDecimal averagePrice) {
	}
}
