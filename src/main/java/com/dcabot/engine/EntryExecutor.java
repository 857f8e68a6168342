package com.dcabot.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.dcabot.config.BotProperties;
import com.dcabot.exchange.TradingVenue;
import com.dcabot.exchange.dto.OrderRequest;
import com.dcabot.exchange.dto.OrderResult;
import com.dcabot.exchange.dto.OrderSide;
import com.dcabot.exchange.dto.TradingConstraints;
import com.dcabot.market.TradingConstraintsService;
import com.dcabot.position.PositionSynchronizer;
import com.dcabot.resilience.OperationClass;
import com.dcabot.resilience.RecoveryExecutor;
import com.dcabot.resilience.VenueCallGuard;

import reactor.core.publisher.Mono;

/**
 * Sizes and submits one DCA market buy. Completes empty when the entry is skipped.
 */
@Component
public class EntryExecutor {

	private static final Logger LOGGER = LoggerFactory.getLogger(EntryExecutor.class);
	private static final BigDecimal LEVEL_STEP = new BigDecimal("0.5");

	private final TradingVenue venue;
	private final VenueCallGuard guard;
	private final RecoveryExecutor recovery;
	private final PositionSynchronizer synchronizer;
	private final TradingConstraintsService constraintsService;
	private final BotProperties properties;

	public EntryExecutor(TradingVenue venue, VenueCallGuard guard, RecoveryExecutor recovery,
			PositionSynchronizer synchronizer, TradingConstraintsService constraintsService, BotProperties properties) {
		this.venue = venue;
		this.guard = guard;
		this.recovery = recovery;
		this.synchronizer = synchronizer;
		this.constraintsService = constraintsService;
		this.properties = properties;
	}

	public Mono<OrderResult> execute(int level, BigDecimal price) {
		if (!properties.ordersEnabled()) {
			LOGGER.info("EVENT=ENTRY_SKIPPED reason=orders_disabled level={} price={}", level, price);
			return Mono.empty();
		}
		return constraintsService.constraints()
				.flatMap(constraints -> {
					BigDecimal notional = entryNotional(properties.baseAmount(), level, properties.maxMultiplier());
					BigDecimal quantity = entryQuantity(notional, price, constraints);
					BigDecimal margin = quantity.multiply(price)
							.divide(BigDecimal.valueOf(properties.leverage()), 8, RoundingMode.HALF_UP);
					BigDecimal balance = synchronizer.availableBalance();
					if (balance != null && margin.compareTo(balance) > 0) {
						LOGGER.warn("EVENT=ENTRY_SKIPPED reason=insufficient_margin required={} available={}", margin,
								balance);
						return Mono.empty();
					}
					OrderRequest request = OrderRequest.market(properties.category(), properties.symbol(),
							OrderSide.BUY, quantity, false);
					LOGGER.info("EVENT=ENTRY_SUBMIT level={} qty={} price={} notional={} margin={}", level, quantity,
							price, notional, margin);
					return recovery.executeWithRecovery("EntryExecutor", "placeEntry",
							() -> guard.execute(OperationClass.TRADING, "placeEntry", () -> venue.placeOrder(request)))
							.doOnNext(result -> LOGGER.info("EVENT=ENTRY_FILLED orderId={} executedQty={} avgPrice={}",
									result.orderId(), result.executedQty(), result.avgPrice()));
				});
	}

	/**
	 * {@code base * min(1 + 0.5 * level, maxMultiplier)} in quote currency.
	 */
	static BigDecimal entryNotional(BigDecimal baseAmount, int level, double maxMultiplier) {
		BigDecimal multiplier = BigDecimal.ONE.add(LEVEL_STEP.multiply(BigDecimal.valueOf(level)));
		BigDecimal cap = BigDecimal.valueOf(maxMultiplier);
		return baseAmount.multiply(multiplier.min(cap));
	}

	/**
	 * Converts a quote amount to a quantity on the step grid, never below one step or the minimum order
	 * quantity.
	 */
	static BigDecimal entryQuantity(BigDecimal notional, BigDecimal price, TradingConstraints constraints) {
		BigDecimal raw = notional.divide(price, 12, RoundingMode.HALF_UP);
		BigDecimal step = constraints.qtyStep();
		BigDecimal quantity = raw;
		if (step != null && step.signum() > 0) {
			quantity = raw.divide(step, 0, RoundingMode.HALF_UP).max(BigDecimal.ONE).multiply(step);
		}
		if (constraints.minOrderQty() != null && quantity.compareTo(constraints.minOrderQty()) < 0) {
			quantity = constraints.minOrderQty();
		}
		return quantity.stripTrailingZeros();
	}
}
