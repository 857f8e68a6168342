package com.dcabot.takeprofit;

import java.util.List;

public record PlacementResult(
		Outcome outcome,
		int requested,
		int placed,
		int skipped,
		int failed,
		List<TakeProfitLeg> legs) {

	public enum Outcome {
		FULL,
		PARTIAL,
		FAILED
	}

	public static PlacementResult of(int requested, int skipped, int failed, List<TakeProfitLeg> legs) {
		Outcome outcome;
		if (legs.isEmpty()) {
			outcome = Outcome.FAILED;
		} else if (legs.size() == requested) {
			outcome = Outcome.FULL;
		} else {
			outcome = Outcome.PARTIAL;
		}
		return new PlacementResult(outcome, requested, legs.size(), skipped, failed, List.copyOf(legs));
	}

	public boolean succeeded() {
		return outcome != Outcome.FAILED;
	}
}
