package com.backtester.domain.enums;

/**
 * OPEN until the exit order for the transaction's position unit executes.
 */
public enum TransactionState {
    OPEN,
    COMPLETE
}
