package com.fundingarb.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes with their HTTP mapping and whether a caller may retry the failed call as-is.
 * Only I/O-level venue failures are retryable; anything that may have changed exposure is not.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    TRADE_NOT_FOUND("TRADE_NOT_FOUND", 404, false),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", 422, false),
    ORDER_REJECTED("ORDER_REJECTED", 422, false),
    ORDER_TIMEOUT("ORDER_TIMEOUT", 504, false),
    ORDER_NOT_FOUND("ORDER_NOT_FOUND", 404, false),
    ORDER_CANCEL_FAILED("ORDER_CANCEL_FAILED", 502, true),
    EXECUTION_ERROR("EXECUTION_ERROR", 500, false),
    LEG1_FAILED("LEG1_FAILED", 500, false),
    LEG2_FAILED("LEG2_FAILED", 500, false),
    PREFLIGHT_FAILED("PREFLIGHT_FAILED", 409, false),
    ORDERBOOK_DATA("ORDERBOOK_DATA", 503, false),
    SIZING_ERROR("SIZING_ERROR", 422, false),
    ROLLBACK_FAILED("ROLLBACK_FAILED", 500, false),
    RECONCILIATION_ERROR("RECONCILIATION_ERROR", 500, false),
    EXCHANGE_ERROR("EXCHANGE_ERROR", 502, false),
    RATE_LIMITED("RATE_LIMITED", 429, true),
    EXCHANGE_CONNECTION("EXCHANGE_CONNECTION", 503, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
