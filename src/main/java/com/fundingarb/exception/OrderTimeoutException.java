package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;

public class OrderTimeoutException extends OrderException {

    public OrderTimeoutException(String symbol, Venue venue, String orderId, String message) {
        super(ErrorCode.ORDER_TIMEOUT, message, symbol, venue, orderId);
    }
}
