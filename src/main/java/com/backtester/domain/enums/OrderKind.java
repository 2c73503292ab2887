package com.backtester.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The eight order types the broker can submit.
 * Exits on a long position sell; exits on a short position buy to cover.
 */
@Getter
@RequiredArgsConstructor
public enum OrderKind {
    MARKET_ENTRY_LONG(OrderGroup.MARKET_ENTRY, PositionSide.LONG, true),
    MARKET_ENTRY_SHORT(OrderGroup.MARKET_ENTRY, PositionSide.SHORT, true),
    MARKET_EXIT_LONG(OrderGroup.MARKET_EXIT, PositionSide.LONG, false),
    MARKET_EXIT_SHORT(OrderGroup.MARKET_EXIT, PositionSide.SHORT, false),
    LIMIT_EXIT_LONG(OrderGroup.LIMIT_EXIT, PositionSide.LONG, false),
    LIMIT_EXIT_SHORT(OrderGroup.LIMIT_EXIT, PositionSide.SHORT, false),
    STOP_EXIT_LONG(OrderGroup.STOP_EXIT, PositionSide.LONG, false),
    STOP_EXIT_SHORT(OrderGroup.STOP_EXIT, PositionSide.SHORT, false);

    private final OrderGroup group;

    /** Side of the position this order opens or closes. */
    private final PositionSide positionSide;

    private final boolean entry;

    public boolean isExit() {
        return !entry;
    }

    public boolean isMarket() {
        return group == OrderGroup.MARKET_ENTRY || group == OrderGroup.MARKET_EXIT;
    }

    /** Limit and stop exits carry a trigger price. */
    public boolean isConditional() {
        return group == OrderGroup.STOP_EXIT || group == OrderGroup.LIMIT_EXIT;
    }
}
