package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;

/** Maker leg did not fill enough to be worth hedging. Whatever filled is rolled back. */
public class Leg1FailedException extends TradeExecutionException {

    public Leg1FailedException(String symbol, Venue venue, BigDecimal filledQty, BigDecimal targetQty, String reason) {
        super(
                ErrorCode.LEG1_FAILED,
                String.format("Leg1 failed on %s for %s: %s (filled %s of %s)", venue, symbol, reason, filledQty,
                        targetQty),
                symbol,
                venue,
                details("filledQty", filledQty, "targetQty", targetQty));
    }
}
