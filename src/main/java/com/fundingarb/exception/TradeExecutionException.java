package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;
import java.util.Map;

/** Generic execution failure and base of the entry-specific failures. */
public class TradeExecutionException extends BaseException {

    public TradeExecutionException(String message, String symbol) {
        super(ErrorCode.EXECUTION_ERROR, message, symbol, null);
    }

    public TradeExecutionException(String message, String symbol, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, message, symbol, null, null, cause);
    }

    protected TradeExecutionException(
            ErrorCode errorCode, String message, String symbol, Venue venue, Map<String, Object> details) {
        super(errorCode, message, symbol, venue, details, null);
    }

    protected TradeExecutionException(ErrorCode errorCode, String message, String symbol, Throwable cause) {
        super(errorCode, message, symbol, null, null, cause);
    }
}
