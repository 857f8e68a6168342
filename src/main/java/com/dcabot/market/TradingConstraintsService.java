package com.dcabot.market;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.dcabot.config.BotProperties;
import com.dcabot.exchange.TradingVenue;
import com.dcabot.exchange.dto.TradingConstraints;
import com.dcabot.resilience.OperationClass;
import com.dcabot.resilience.VenueCallGuard;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Caches instrument constraints per symbol. An expired entry is refetched; if the refresh fails the
 * stale entry keeps being served.
 */
@Component
public class TradingConstraintsService {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingConstraintsService.class);
	private static final int FETCH_RETRIES = 3;
	private static final Duration FETCH_BACKOFF = Duration.ofSeconds(1);

	private final TradingVenue venue;
	private final VenueCallGuard guard;
	private final BotProperties properties;
	private final Duration ttl;
	private final LongSupplier clock;
	private final Map<String, CachedConstraints> cache = new ConcurrentHashMap<>();

	@Autowired
	public TradingConstraintsService(TradingVenue venue, VenueCallGuard guard, BotProperties properties,
			@Value("${bot.constraints-ttl:PT1H}") Duration ttl) {
		this(venue, guard, properties, ttl, System::currentTimeMillis);
	}

	TradingConstraintsService(TradingVenue venue, VenueCallGuard guard, BotProperties properties, Duration ttl,
			LongSupplier clock) {
		this.venue = venue;
		this.guard = guard;
		this.properties = properties;
		this.ttl = ttl;
		this.clock = clock;
	}

	public Mono<TradingConstraints> constraints() {
		return constraints(properties.symbol());
	}

	public Mono<TradingConstraints> constraints(String symbol) {
		CachedConstraints cached = cache.get(symbol);
		long now = clock.getAsLong();
		if (cached != null && now - cached.fetchedAtMillis() < ttl.toMillis()) {
			return Mono.just(cached.constraints());
		}
		return guard.execute(OperationClass.MARKET_DATA, "getTradingConstraints",
				() -> venue.getTradingConstraints(properties.category(), symbol))
				.retryWhen(Retry.backoff(FETCH_RETRIES, FETCH_BACKOFF))
				.doOnNext(fresh -> {
					cache.put(symbol, new CachedConstraints(fresh, clock.getAsLong()));
					LOGGER.info("EVENT=CONSTRAINTS_LOADED symbol={} minQty={} qtyStep={} minValue={} tickSize={}",
							symbol, fresh.minOrderQty(), fresh.qtyStep(), fresh.minOrderValue(), fresh.tickSize());
				})
				.onErrorResume(error -> {
					if (cached == null) {
						return Mono.error(error);
					}
					LOGGER.warn("EVENT=CONSTRAINTS_REFRESH_FAIL symbol={} reason={} servingStale=true", symbol,
							error.getMessage());
					return Mono.just(cached.constraints());
				});
	}

	public void invalidate(String symbol) {
		cache.remove(symbol);
	}

	private record CachedConstraints(TradingConstraints constraints, long fetchedAtMillis) {
	}
}
