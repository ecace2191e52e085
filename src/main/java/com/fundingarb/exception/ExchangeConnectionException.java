package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;

public class ExchangeConnectionException extends ExchangeException {

    public ExchangeConnectionException(Venue venue, String message) {
        super(ErrorCode.EXCHANGE_CONNECTION, venue, message, null);
    }

    public ExchangeConnectionException(Venue venue, String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_CONNECTION, venue, message, cause);
    }
}
