package com.fundingarb.exception;

public class PreflightCheckException extends TradeExecutionException {

    public PreflightCheckException(String symbol, String reason) {
        super(ErrorCode.PREFLIGHT_FAILED, "Preflight failed for " + symbol + ": " + reason, symbol, null, null);
    }
}
