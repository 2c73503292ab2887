package com.backtester.domain.enums;

/**
 * Lifecycle state of a trading order.
 * PENDING is the only non-terminal state; EXECUTED and CANCELED never change again.
 */
public enum OrderState {
    PENDING,
    EXECUTED,
    CANCELED
}
