package com.backtester.domain.enums;

/**
 * Direction of a position unit. All open units of one instrument share a side.
 */
public enum PositionSide {
    LONG,
    SHORT
}
