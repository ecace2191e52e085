package com.fundingarb.exception;

public class TradeNotFoundException extends BaseException {

    public TradeNotFoundException(String tradeId) {
        super(ErrorCode.TRADE_NOT_FOUND, "No trade with id " + tradeId, null, null, details("tradeId", tradeId), null);
    }
}
