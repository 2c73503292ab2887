package com.backtester.exception;

/**
 * A position unit was mutated against its lifecycle (closed twice, bar added after
 * close, exit dated before entry).
 */
public class PositionStateException extends BaseException {

    public PositionStateException(String message) {
        super(ErrorCode.PRECONDITION_VIOLATION, message);
    }
}
