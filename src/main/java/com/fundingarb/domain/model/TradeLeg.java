package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * One side of a hedged trade, held on one venue. Owned exclusively by its {@link Trade}.
 *
 * <p>{@code qty} is the requested size; {@code filledQty} is what actually filled and is the size
 * every later step (hedge, close, reconciliation) works from.
 */
@Data
@Builder(toBuilder = true)
public class TradeLeg {

    private Venue venue;
    private Side side;
    private BigDecimal qty;

    @Builder.Default
    private BigDecimal filledQty = BigDecimal.ZERO;

    private BigDecimal entryPrice;
    private BigDecimal exitPrice;

    /** Quantity already closed on exit; {@code exitPrice} is its weighted average. */
    @Builder.Default
    private BigDecimal closedQty = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal fees = BigDecimal.ZERO;

    private String orderId;
    private String exitOrderId;

    /** Realised price PnL net of this leg's fees. Uses entry as exit while the leg is still open. */
    public BigDecimal pnl() {
        if (entryPrice == null || filledQty.signum() == 0) {
            return fees.negate();
        }
        BigDecimal exit = exitPrice != null ? exitPrice : entryPrice;
        return pricePnl(exit).subtract(fees);
    }

    /** Price PnL at the given price, before fees. */
    public BigDecimal pricePnl(BigDecimal price) {
        if (entryPrice == null || price == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal move = price.subtract(entryPrice).multiply(filledQty);
        return side == Side.BUY ? move : move.negate();
    }

    public BigDecimal signedFilledQty() {
        return side == Side.BUY ? filledQty : filledQty.negate();
    }

    public void addFees(BigDecimal fee) {
        if (fee != null) {
            fees = fees.add(fee);
        }
    }

    public TradeLeg copy() {
        return toBuilder().build();
    }
}
