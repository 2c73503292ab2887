package com.backtester.event;

/**
 * Classifies the position change behind a {@link PositionEvent}.
 */
public enum PositionEventType {

    /** The unit was closed. Fired exactly once per unit. */
    CLOSED
}
