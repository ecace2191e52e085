package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;

public class OrderCancelFailedException extends OrderException {

    public OrderCancelFailedException(String symbol, Venue venue, String orderId, Throwable cause) {
        super(ErrorCode.ORDER_CANCEL_FAILED, "Cancel failed for order " + orderId + " on " + venue, symbol, venue,
                orderId, cause);
    }
}
