package com.backtester.domain.enums;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Processing group for pending orders in the per-date pass.
 *
 * <p>Groups resolve by ascending level, then FIFO within a group. Exits settle before
 * new entries on the same symbol, and stop exits resolve before limit exits so that a
 * bar touching both levels is assumed to have hit the stop first.
 */
@Getter
@RequiredArgsConstructor
public enum OrderGroup {
    MARKET_EXIT(0, "Market-on-open exits"),
    MARKET_ENTRY(1, "Market-on-open entries"),
    STOP_EXIT(2, "Stop exits"),
    LIMIT_EXIT(3, "Limit exits");

    private final int level;
    private final String description;

    private static final List<OrderGroup> PROCESSING_ORDER = Arrays.stream(values())
            .sorted(Comparator.comparingInt(OrderGroup::getLevel))
            .toList();

    /** All groups, lowest level first. */
    public static List<OrderGroup> inProcessingOrder() {
        return PROCESSING_ORDER;
    }
}
