package com.dcabot.engine;

import java.math.BigDecimal;
import java.time.Instant;

import com.dcabot.position.PositionSnapshot;
import com.dcabot.strategy.EntryDecision;
import com.dcabot.strategy.EntrySignal;

public record CycleReport(
		Instant startedAt,
		BigDecimal price,
		EntrySignal signal,
		EntryDecision decision,
		boolean entryPlaced,
		PositionSnapshot position,
		int activeTakeProfitLegs,
		int filledTakeProfitLegs) {
}
