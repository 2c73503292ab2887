package com.backtester.history;

import com.backtester.domain.model.TradingPosition;

/**
 * Sink for finalized trades. The broker hands over every position unit exactly once,
 * right after it closes.
 */
public interface ClosedTradeCollection {

    void addClosedPosition(TradingPosition position);
}
