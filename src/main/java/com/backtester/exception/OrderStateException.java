package com.backtester.exception;

/**
 * An order was asked to do something its lifecycle forbids: re-resolving an executed or
 * canceled order, filling on or before its order date, or filling at a price that
 * contradicts its trigger.
 */
public class OrderStateException extends BaseException {

    public OrderStateException(String message) {
        super(ErrorCode.PRECONDITION_VIOLATION, message);
    }
}
