package com.dcabot.resilience;

import java.time.Duration;

public record RecoveryDecision(boolean stop, Duration delay, BotException error, String reason) {

	static RecoveryDecision retryAfter(Duration delay, BotException error) {
		return new RecoveryDecision(false, delay, error, null);
	}

	static RecoveryDecision stop(BotException error, String reason) {
		return new RecoveryDecision(true, Duration.ZERO, error, reason);
	}
}
