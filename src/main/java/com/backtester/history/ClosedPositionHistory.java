package com.backtester.history;

import com.backtester.domain.model.TradingPosition;
import com.backtester.exception.PositionStateException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory, append-only record of closed trades in the order they closed.
 */
public class ClosedPositionHistory implements ClosedTradeCollection {

    private final List<TradingPosition> positions = new ArrayList<>();

    @Override
    public void addClosedPosition(TradingPosition position) {
        if (position.isPositionOpen()) {
            throw new PositionStateException(
                    "Position " + position.getPositionId() + " (" + position.getTradingSymbol() + ") is still open");
        }
        positions.add(position);
    }

    public List<TradingPosition> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    public int getNumPositions() {
        return positions.size();
    }

    public int getNumWinningPositions() {
        return (int) positions.stream().filter(TradingPosition::isWinningPosition).count();
    }

    public int getNumLosingPositions() {
        return (int) positions.stream().filter(TradingPosition::isLosingPosition).count();
    }

    /** Total bars held across all closed trades, entry bars included. */
    public int getNumBarsInMarket() {
        return positions.stream().mapToInt(TradingPosition::getNumBarsInPosition).sum();
    }
}
