package com.dcabot.resilience;

public enum CircuitState {
	CLOSED,
	OPEN,
	HALF_OPEN
}
