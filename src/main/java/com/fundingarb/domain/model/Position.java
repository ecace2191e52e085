package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Live position as reported by a venue. Read-only mirror of exchange truth; never persisted.
 * {@code qty} is always non-negative; direction is carried by {@code side}.
 * A liquidation price of null or zero means the venue did not report one.
 */
@Data
@Builder
public class Position {

    private String symbol;
    private Venue venue;
    private Side side;
    private BigDecimal qty;
    private BigDecimal entryPrice;
    private BigDecimal markPrice;
    private BigDecimal liquidationPrice;
    private BigDecimal unrealizedPnl;

    /** Quantity with sign: positive for long, negative for short. */
    public BigDecimal signedQty() {
        return side == Side.BUY ? qty : qty.negate();
    }

    public boolean isAbove(BigDecimal dust) {
        return qty != null && qty.abs().compareTo(dust) > 0;
    }
}
