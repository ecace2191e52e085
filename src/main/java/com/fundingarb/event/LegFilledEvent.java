package com.fundingarb.event;

import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;

/** Published when an entry leg finishes filling (leg 1 after the chase, leg 2 after the hedge). */
public class LegFilledEvent extends DomainEvent {

    private final int legNumber;
    private final Venue venue;
    private final Side side;
    private final BigDecimal filledQty;
    private final BigDecimal avgPrice;

    public LegFilledEvent(
            Object source,
            String symbol,
            String tradeId,
            int legNumber,
            Venue venue,
            Side side,
            BigDecimal filledQty,
            BigDecimal avgPrice) {
        super(source, symbol, tradeId);
        this.legNumber = legNumber;
        this.venue = venue;
        this.side = side;
        this.filledQty = filledQty;
        this.avgPrice = avgPrice;
    }

    public int getLegNumber() {
        return legNumber;
    }

    public Venue getVenue() {
        return venue;
    }

    public Side getSide() {
        return side;
    }

    public BigDecimal getFilledQty() {
        return filledQty;
    }

    public BigDecimal getAvgPrice() {
        return avgPrice;
    }
}
