package com.dcabot.engine;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.dcabot.config.BotProperties;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

/**
 * Starts the trading loop with the application context and runs the shutdown sequence when it closes.
 */
@Component
@ConditionalOnProperty(prefix = "bot", name = "autostart", havingValue = "true", matchIfMissing = true)
public class BotLifecycle {

	private static final Logger LOGGER = LoggerFactory.getLogger(BotLifecycle.class);
	private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

	private final TradingLoopCoordinator coordinator;
	private final BotProperties properties;
	private final AtomicReference<Disposable> loopRef = new AtomicReference<>();
	private final AtomicBoolean started = new AtomicBoolean(false);

	public BotLifecycle(TradingLoopCoordinator coordinator, BotProperties properties) {
		this.coordinator = coordinator;
		this.properties = properties;
	}

	@PostConstruct
	public void start() {
		if (!started.compareAndSet(false, true)) {
			return;
		}
		LOGGER.info("EVENT=BOT_START symbol={} interval={} baseAmount={} ordersEnabled={}", properties.symbol(),
				properties.interval(), properties.baseAmount(), properties.ordersEnabled());
		Disposable loop = coordinator.run()
				.subscribeOn(Schedulers.boundedElastic())
				.subscribe(
						ignored -> {
						},
						error -> LOGGER.error("EVENT=BOT_LOOP_FAILED reason={}", error.getMessage(), error),
						() -> LOGGER.info("EVENT=BOT_LOOP_COMPLETED symbol={}", properties.symbol()));
		loopRef.set(loop);
	}

	@PreDestroy
	public void stop() {
		if (!started.get()) {
			return;
		}
		ShutdownOutcome outcome = coordinator.shutdown()
				.block(properties.shutdownTimeout().plus(SHUTDOWN_GRACE));
		LOGGER.info("EVENT=BOT_STOPPED symbol={} outcome={}", properties.symbol(), outcome);
		Disposable loop = loopRef.getAndSet(null);
		if (loop != null) {
			loop.dispose();
		}
	}
}
