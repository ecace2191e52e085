package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;

public class RateLimitException extends ExchangeException {

    public RateLimitException(Venue venue, String message) {
        super(ErrorCode.RATE_LIMITED, venue, message, null);
    }
}
