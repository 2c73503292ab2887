package com.backtester.event;

/**
 * Classifies the resolution that triggered an {@link OrderEvent}.
 *
 * <p>Every pending order ends in exactly one of these. A conditional order that does
 * not trigger on the bar it is evaluated against is CANCELED, not retried; the
 * strategy resubmits on a later date if it still wants the exit.
 */
public enum OrderEventType {

    /** Order filled on the processing date's bar. */
    FILLED,

    /** Order did not trigger, or its position was already flat. */
    CANCELED
}
