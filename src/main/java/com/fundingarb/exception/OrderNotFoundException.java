package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;

public class OrderNotFoundException extends OrderException {

    public OrderNotFoundException(String symbol, Venue venue, String orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order " + orderId + " not found on " + venue, symbol, venue, orderId);
    }
}
