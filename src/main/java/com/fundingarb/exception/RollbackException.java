package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;

/** A compensating close failed and live exposure remains. Requires manual intervention. */
public class RollbackException extends BaseException {

    public RollbackException(String symbol, Venue venue, BigDecimal remainingQty, String reason, Throwable cause) {
        super(
                ErrorCode.ROLLBACK_FAILED,
                String.format("Rollback failed on %s for %s: %s (remaining %s)", venue, symbol, reason, remainingQty),
                symbol,
                venue,
                details("remainingQty", remainingQty),
                cause);
    }
}
