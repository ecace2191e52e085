package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Top-of-book (L1) snapshot for one symbol on one venue.
 */
@Data
@Builder(toBuilder = true)
public class OrderbookSnapshot {

    private String symbol;
    private Venue venue;

    @Builder.Default
    private BigDecimal bestBid = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal bestBidQty = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal bestAsk = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal bestAskQty = BigDecimal.ZERO;

    private Instant updatedAt;

    /** Both sides quoted with size, and the book is not crossed. */
    public boolean hasDepth() {
        return bestBid.signum() > 0
                && bestAsk.signum() > 0
                && bestBidQty.signum() > 0
                && bestAskQty.signum() > 0
                && bestBid.compareTo(bestAsk) < 0;
    }

    public BigDecimal mid() {
        return bestBid.add(bestAsk).divide(BigDecimal.valueOf(2));
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return updatedAt == null || updatedAt.plus(maxAge).isBefore(now);
    }
}
