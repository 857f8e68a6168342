package com.dcabot.takeprofit;

import com.dcabot.resilience.BotException;
import com.dcabot.resilience.ErrorCategory;

/**
 * Raised when a batch ends without a single take-profit leg resting on the venue.
 */
public class TakeProfitPlacementException extends BotException {

	private final transient PlacementResult result;

	public TakeProfitPlacementException(PlacementResult result) {
		super(ErrorCategory.ORDER, "TakeProfitManager", "placeAll",
				"no take-profit leg placed (requested=" + result.requested() + " skipped=" + result.skipped()
						+ " failed=" + result.failed() + ")");
		this.result = result;
	}

	public PlacementResult result() {
		return result;
	}
}
