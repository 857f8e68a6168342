package com.dcabot.strategy;

import java.util.List;

import com.dcabot.market.dto.Kline;

/**
 * Decides from closed klines (oldest first) whether the market offers a buy.
 */
public interface EntrySignalProvider {

	EntrySignal evaluate(List<Kline> klines);

	String name();
}
