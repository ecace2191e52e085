package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;

/** Hedge leg failed after leg 1 went live. Triggers an emergency unwind, never a silent retry. */
public class Leg2FailedException extends TradeExecutionException {

    public Leg2FailedException(String symbol, Venue venue, BigDecimal hedgedQty, BigDecimal requiredQty, String reason) {
        super(
                ErrorCode.LEG2_FAILED,
                String.format("Leg2 failed on %s for %s: %s (hedged %s of %s)", venue, symbol, reason, hedgedQty,
                        requiredQty),
                symbol,
                venue,
                details("hedgedQty", hedgedQty, "requiredQty", requiredQty));
    }
}
