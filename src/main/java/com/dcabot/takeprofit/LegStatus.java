package com.dcabot.takeprofit;

public enum LegStatus {
	PENDING,
	FILLED
}
