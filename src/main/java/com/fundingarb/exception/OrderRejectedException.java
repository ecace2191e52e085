package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;

public class OrderRejectedException extends OrderException {

    public OrderRejectedException(String symbol, Venue venue, String reason) {
        super(ErrorCode.ORDER_REJECTED, "Order rejected on " + venue + ": " + reason, symbol, venue, null);
    }
}
