package com.backtester.exception;

import java.util.Map;

/**
 * The broker's transaction records and the position ledger have diverged. Statistics
 * computed after this point would be unreliable, so the run must stop.
 */
public class InconsistentStateException extends BaseException {

    public InconsistentStateException(String message) {
        super(ErrorCode.INTERNAL_ERROR, message);
    }

    public InconsistentStateException(String message, Map<String, Object> details) {
        super(ErrorCode.INTERNAL_ERROR, message, details);
    }
}
