package com.fundingarb.exception;

public class SizingException extends TradeExecutionException {

    public SizingException(String symbol, String reason) {
        super(ErrorCode.SIZING_ERROR, "Cannot size " + symbol + ": " + reason, symbol, null, null);
    }
}
