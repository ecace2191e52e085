package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;

public class OrderbookDataException extends TradeExecutionException {

    public OrderbookDataException(String symbol, Venue venue, String reason) {
        super(ErrorCode.ORDERBOOK_DATA, "No usable orderbook for " + symbol + " on " + venue + ": " + reason, symbol,
                venue, null);
    }
}
