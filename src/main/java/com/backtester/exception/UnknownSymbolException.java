package com.backtester.exception;

public class UnknownSymbolException extends BaseException {

    public UnknownSymbolException(String resourceType, String symbol) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found for symbol: %s", resourceType, symbol));
    }
}
