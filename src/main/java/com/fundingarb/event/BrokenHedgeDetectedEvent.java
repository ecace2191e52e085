package com.fundingarb.event;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;

/**
 * One leg of a trade is confirmed missing on its venue. Listeners pause new entries until the
 * surviving symbol is flat again or an operator acknowledges.
 */
public class BrokenHedgeDetectedEvent extends DomainEvent {

    private final Venue missingVenue;
    private final Venue survivingVenue;
    private final BigDecimal survivingQty;

    public BrokenHedgeDetectedEvent(
            Object source,
            String symbol,
            String tradeId,
            Venue missingVenue,
            Venue survivingVenue,
            BigDecimal survivingQty) {
        super(source, symbol, tradeId);
        this.missingVenue = missingVenue;
        this.survivingVenue = survivingVenue;
        this.survivingQty = survivingQty;
    }

    public Venue getMissingVenue() {
        return missingVenue;
    }

    public Venue getSurvivingVenue() {
        return survivingVenue;
    }

    public BigDecimal getSurvivingQty() {
        return survivingQty;
    }
}
