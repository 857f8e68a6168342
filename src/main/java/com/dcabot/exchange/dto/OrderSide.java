package com.dcabot.exchange.dto;

public enum OrderSide {
	BUY("Buy"),
	SELL("Sell");

	private final String wireName;

	OrderSide(String wireName) {
		this.wireName = wireName;
	}

	public String wireName() {
		return wireName;
	}

	public static OrderSide fromWire(String value) {
		if (value == null) {
			return null;
		}
		for (OrderSide side : values()) {
			if (side.wireName.equalsIgnoreCase(value)) {
				return side;
			}
		}
		return null;
	}
}
