package com.dcabot.resilience;

public enum BackoffStrategy {
	EXPONENTIAL,
	LINEAR,
	FIXED
}
