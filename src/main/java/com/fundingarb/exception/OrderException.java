package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;
import lombok.Getter;

/** Base for failures of a single venue order. */
@Getter
public class OrderException extends BaseException {

    private final String orderId;

    public OrderException(ErrorCode errorCode, String message, String symbol, Venue venue, String orderId) {
        super(errorCode, message, symbol, venue, details("orderId", orderId), null);
        this.orderId = orderId;
    }

    public OrderException(
            ErrorCode errorCode, String message, String symbol, Venue venue, String orderId, Throwable cause) {
        super(errorCode, message, symbol, venue, details("orderId", orderId), cause);
        this.orderId = orderId;
    }
}
