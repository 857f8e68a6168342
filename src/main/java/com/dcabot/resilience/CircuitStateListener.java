package com.dcabot.resilience;

@FunctionalInterface
public interface CircuitStateListener {

	void onStateChange(String breakerName, CircuitState from, CircuitState to);
}
