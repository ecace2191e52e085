package com.fundingarb.event;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;

/**
 * Outcome of a compensating close. {@code slippageLoss} is what unwinding cost relative to the
 * entry price, fees included; null when the close did not fill.
 */
public class RollbackCompletedEvent extends DomainEvent {

    private final Venue venue;
    private final boolean success;
    private final BigDecimal closedQty;
    private final BigDecimal slippageLoss;

    public RollbackCompletedEvent(
            Object source,
            String symbol,
            String tradeId,
            Venue venue,
            boolean success,
            BigDecimal closedQty,
            BigDecimal slippageLoss) {
        super(source, symbol, tradeId);
        this.venue = venue;
        this.success = success;
        this.closedQty = closedQty;
        this.slippageLoss = slippageLoss;
    }

    public Venue getVenue() {
        return venue;
    }

    public boolean isSuccess() {
        return success;
    }

    public BigDecimal getClosedQty() {
        return closedQty;
    }

    public BigDecimal getSlippageLoss() {
        return slippageLoss;
    }
}
