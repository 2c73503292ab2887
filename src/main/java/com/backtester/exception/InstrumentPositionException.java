package com.backtester.exception;

public class InstrumentPositionException extends BaseException {

    public InstrumentPositionException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
