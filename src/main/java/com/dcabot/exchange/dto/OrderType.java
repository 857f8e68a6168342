package com.dcabot.exchange.dto;

public enum OrderType {
	MARKET("Market"),
	LIMIT("Limit");

	private final String wireName;

	OrderType(String wireName) {
		this.wireName = wireName;
	}

	public String wireName() {
		return wireName;
	}

	public static OrderType fromWire(String value) {
		if (value == null) {
			return null;
		}
		for (OrderType type : values()) {
			if (type.wireName.equalsIgnoreCase(value)) {
				return type;
			}
		}
		return null;
	}
}
