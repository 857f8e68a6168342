package com.dcabot.takeprofit;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.dcabot.exchange.dto.TradingConstraints;

/**
 * Splits a position quantity across take-profit legs. Every quantity is a multiple of the quantity
 * step and the sum never exceeds the total; the rounding remainder lands on the last leg.
 */
public final class LegQuantityDistributor {

	private LegQuantityDistributor() {
	}

	/**
	 * Returns one quantity per funded leg. Fewer than {@code levels} entries come back when the total
	 * cannot fund every leg at the minimum order size; an empty list when it cannot fund one.
	 */
	public static List<BigDecimal> distribute(BigDecimal total, int levels, double fraction,
			TradingConstraints constraints) {
		if (total == null || total.signum() <= 0 || levels <= 0) {
			return Collections.emptyList();
		}
		BigDecimal step = constraints.qtyStep();
		BigDecimal minQty = constraints.minOrderQty() == null ? BigDecimal.ZERO : constraints.minOrderQty();

		BigDecimal base = total.multiply(BigDecimal.valueOf(fraction));
		if (base.compareTo(minQty) < 0) {
			base = minQty;
		}
		base = TradingConstraints.floorTo(base, step);

		BigDecimal levelCount = BigDecimal.valueOf(levels);
		if (base.signum() > 0 && base.multiply(levelCount).compareTo(total) <= 0) {
			List<BigDecimal> quantities = new ArrayList<>(Collections.nCopies(levels, base));
			BigDecimal leftover = TradingConstraints.floorTo(total.subtract(base.multiply(levelCount)), step);
			addToLast(quantities, leftover);
			return quantities;
		}
		return distributeAtMinimum(total, levels, minQty, step);
	}

	private static List<BigDecimal> distributeAtMinimum(BigDecimal total, int levels, BigDecimal minQty,
			BigDecimal step) {
		if (minQty.signum() <= 0) {
			BigDecimal single = TradingConstraints.floorTo(total, step);
			return single.signum() > 0 ? List.of(single) : Collections.emptyList();
		}
		int affordable = total.divide(minQty, 0, RoundingMode.FLOOR).intValue();
		int funded = Math.min(levels, affordable);
		if (funded <= 0) {
			return Collections.emptyList();
		}
		BigDecimal fundedCount = BigDecimal.valueOf(funded);
		BigDecimal remainder = total.subtract(minQty.multiply(fundedCount));
		BigDecimal share = TradingConstraints.floorTo(remainder.divide(fundedCount, 12, RoundingMode.FLOOR), step);
		BigDecimal perLeg = minQty.add(share);
		List<BigDecimal> quantities = new ArrayList<>(Collections.nCopies(funded, perLeg));
		BigDecimal leftover = TradingConstraints.floorTo(remainder.subtract(share.multiply(fundedCount)), step);
		addToLast(quantities, leftover);
		return quantities;
	}

	private static void addToLast(List<BigDecimal> quantities, BigDecimal leftover) {
		if (leftover == null || leftover.signum() <= 0 || quantities.isEmpty()) {
			return;
		}
		int last = quantities.size() - 1;
		quantities.set(last, quantities.get(last).add(leftover));
	}
}
