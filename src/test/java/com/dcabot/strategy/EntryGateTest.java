package com.dcabot.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.dcabot.position.PositionSnapshot;

class EntryGateTest {

	private final EntryGate gate = new EntryGate(new FixedProgressiveSpacing(0.03, 1.0, 0.20, 0.001));

	@Test
	void dropBeyondThresholdIsAllowed() {
		EntryDecision decision = gate.evaluate(1, new BigDecimal("100"), new BigDecimal("96"), List.of());

		assertThat(decision.allowed()).isTrue();
		assertThat(decision.requiredThreshold()).isEqualTo(0.03);
		assertThat(decision.priceChange()).isCloseTo(0.04, within(1e-9));
	}

	@Test
	void shallowDropIsBlocked() {
		EntryDecision decision = gate.evaluate(1, new BigDecimal("100"), new BigDecimal("98"), List.of());

		assertThat(decision.allowed()).isFalse();
		assertThat(decision.reason()).contains("below required");
	}

	@Test
	void priceAboveAverageIsBlocked() {
		assertThat(gate.evaluate(2, new BigDecimal("100"), new BigDecimal("101"), List.of()).allowed()).isFalse();
	}

	@Test
	void firstEntryWithoutPositionIsAllowed() {
		assertThat(gate.evaluate(0, BigDecimal.ZERO, new BigDecimal("100"), List.of()).allowed()).isTrue();
	}

	@Test
	void resyncResetsSpacing() {
		gate.onPositionClosedExternally(PositionSnapshot.flat("BTCUSDT"));

		assertThat(gate.spacing().name()).isEqualTo("fixed_progressive");
	}
}
