package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.OrderStatus;
import com.fundingarb.domain.enums.OrderType;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TimeInForce;
import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A venue order as last reported by the venue (or by the order-update stream).
 *
 * <p>{@code filledQty} and {@code avgFillPrice} are cumulative for the order; {@code fee} is the
 * cumulative fee charged so far. The venue is the source of truth, this is a snapshot.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;
    private String clientOrderId;
    private String symbol;
    private Venue venue;
    private Side side;
    private OrderType type;
    private TimeInForce timeInForce;

    /** Limit price. Null for MARKET orders. */
    private BigDecimal price;

    private BigDecimal quantity;

    @Builder.Default
    private BigDecimal filledQty = BigDecimal.ZERO;

    private BigDecimal avgFillPrice;

    @Builder.Default
    private BigDecimal fee = BigDecimal.ZERO;

    private OrderStatus status;
    private boolean reduceOnly;
    private String rejectReason;
    private Instant createdAt;
    private Instant updatedAt;

    public BigDecimal remainingQty() {
        BigDecimal filled = filledQty != null ? filledQty : BigDecimal.ZERO;
        return quantity.subtract(filled).max(BigDecimal.ZERO);
    }

    public boolean hasFill() {
        return filledQty != null && filledQty.signum() > 0;
    }
}
