package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;

public class InsufficientBalanceException extends BaseException {

    public InsufficientBalanceException(Venue venue, BigDecimal required, BigDecimal available) {
        super(
                ErrorCode.INSUFFICIENT_BALANCE,
                String.format("Insufficient balance on %s: required %s, available %s", venue, required, available),
                null,
                venue,
                details("required", required, "available", available),
                null);
    }

    public InsufficientBalanceException(Venue venue, String message) {
        super(ErrorCode.INSUFFICIENT_BALANCE, message, null, venue);
    }
}
