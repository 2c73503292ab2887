package com.backtester.exception;

import java.util.Map;

/**
 * A strategy asked the broker for something the current position state does not
 * allow, e.g. exiting a long position on a symbol that is flat or short.
 */
public class StrategyBrokerException extends BaseException {

    public StrategyBrokerException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public StrategyBrokerException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_STATE, message, details);
    }
}
