package com.fundingarb.event;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;

public class RollbackInitiatedEvent extends DomainEvent {

    private final Venue venue;
    private final BigDecimal qty;
    private final String reason;

    public RollbackInitiatedEvent(
            Object source, String symbol, String tradeId, Venue venue, BigDecimal qty, String reason) {
        super(source, symbol, tradeId);
        this.venue = venue;
        this.qty = qty;
        this.reason = reason;
    }

    public Venue getVenue() {
        return venue;
    }

    public BigDecimal getQty() {
        return qty;
    }

    public String getReason() {
        return reason;
    }
}
