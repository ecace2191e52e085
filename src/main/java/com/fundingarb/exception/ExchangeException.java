package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;

/** Venue call failure. Subclasses with a retryable error code may be retried by the caller. */
public class ExchangeException extends BaseException {

    public ExchangeException(Venue venue, String message) {
        super(ErrorCode.EXCHANGE_ERROR, message, null, venue);
    }

    public ExchangeException(Venue venue, String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_ERROR, message, null, venue, null, cause);
    }

    protected ExchangeException(ErrorCode errorCode, Venue venue, String message, Throwable cause) {
        super(errorCode, message, null, venue, null, cause);
    }
}
