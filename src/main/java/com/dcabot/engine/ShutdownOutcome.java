package com.dcabot.engine;

public enum ShutdownOutcome {
	GRACEFUL,
	FORCED
}
