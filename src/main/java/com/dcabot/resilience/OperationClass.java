package com.dcabot.resilience;

import java.util.Locale;

public enum OperationClass {
	TRADING,
	MARKET_DATA,
	ACCOUNT_DATA;

	public String key() {
		return name().toLowerCase(Locale.ROOT);
	}
}
