package com.backtester.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error categories raised by the engine.
 *
 * <p>Fatal categories signal a programming defect or a diverged engine state and must
 * abort the backtest run. Non-fatal categories are caller misuse: the engine state is
 * left unchanged and the driving loop may skip the offending symbol or strategy.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    INVALID_STATE("INVALID_STATE", false),
    NOT_FOUND("NOT_FOUND", false),
    PRECONDITION_VIOLATION("PRECONDITION_VIOLATION", true),
    INTERNAL_ERROR("INTERNAL_ERROR", true);

    private final String code;
    private final boolean fatal;
}
