package com.backtester.domain.enums;

public enum PositionState {
    OPEN,
    CLOSED
}
