package com.dcabot.exchange;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;

import jakarta.annotation.PostConstruct;
import reactor.core.publisher.Mono;

/**
 * Keeps the offset between the local clock and the venue clock so signed requests stay inside the
 * receive window.
 */
@Component
public class TimeSyncService {

	private static final Logger LOGGER = LoggerFactory.getLogger(TimeSyncService.class);
	private static final long SYNC_INTERVAL_MS = 60_000L;

	private final WebClient bybitWebClient;
	private final AtomicLong offsetMs = new AtomicLong();
	private final AtomicReference<Mono<Long>> inFlightSync = new AtomicReference<>();

	public TimeSyncService(WebClient bybitWebClient) {
		this.bybitWebClient = bybitWebClient;
	}

	@PostConstruct
	void init() {
		syncNow().subscribe(ignored -> { }, error -> LOGGER.warn("EVENT=TIME_SYNC_SUBSCRIBE_FAIL reason={}",
				error.getMessage()));
	}

	public long currentTimestampMillis() {
		return System.currentTimeMillis() + offsetMs.get();
	}

	public long offsetMillis() {
		return offsetMs.get();
	}

	public Mono<Long> syncNow() {
		Mono<Long> existing = inFlightSync.get();
		if (existing != null) {
			return existing;
		}
		long lastOffset = offsetMs.get();
		Mono<Long> syncMono = bybitWebClient
				.get()
				.uri("/v5/market/time")
				.retrieve()
				.bodyToMono(JsonNode.class)
				.map(body -> {
					long serverTime = serverTimeMillis(body);
					long offset = serverTime - System.currentTimeMillis();
					offsetMs.set(offset);
					LOGGER.info("EVENT=TIME_SYNC_OK offsetMs={}", offset);
					return offset;
				})
				.doOnError(error -> LOGGER.warn("EVENT=TIME_SYNC_FAIL reason={}", error.getMessage()))
				.onErrorReturn(lastOffset)
				.doFinally(ignored -> inFlightSync.set(null))
				.cache();
		if (inFlightSync.compareAndSet(null, syncMono)) {
			return syncMono;
		}
		Mono<Long> winner = inFlightSync.get();
		return winner != null ? winner : syncMono;
	}

	@Scheduled(fixedDelay = SYNC_INTERVAL_MS)
	void scheduledSync() {
		syncNow().subscribe(ignored -> { }, error -> LOGGER.warn("EVENT=TIME_SYNC_SCHEDULE_FAIL reason={}",
				error.getMessage()));
	}

	static long serverTimeMillis(JsonNode body) {
		long time = body.path("time").asLong(0L);
		if (time > 0) {
			return time;
		}
		JsonNode result = BybitEnvelope.result(body, "server time");
		long seconds = result.path("timeSecond").asLong(0L);
		if (seconds <= 0) {
			throw new VenueApiException(null, 200, "server time missing from response");
		}
		return seconds * 1000L;
	}
}
