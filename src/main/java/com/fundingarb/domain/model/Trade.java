package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.ExecutionState;
import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A hedged two-leg position: leg 1 is the maker leg, leg 2 the hedge.
 *
 * <p>The trade store hands out copies; callers mutate their copy and write it back through
 * {@code TradeStorePort.updateTrade}. {@link #advanceTo} is the only way to change the
 * execution state, and refuses to move it backwards.
 */
@Data
@Builder(toBuilder = true)
public class Trade {

    private String id;
    private String symbol;
    private TradeLeg leg1;
    private TradeLeg leg2;
    private BigDecimal targetQty;
    private BigDecimal targetNotionalUsd;
    private BigDecimal entryApy;
    private BigDecimal entrySpreadPct;

    @Builder.Default
    private TradeStatus status = TradeStatus.PENDING;

    @Builder.Default
    private ExecutionState executionState = ExecutionState.PENDING;

    private Instant createdAt;
    private Instant openedAt;
    private Instant closedAt;
    private String closeReason;

    @Builder.Default
    private BigDecimal fundingCollected = BigDecimal.ZERO;

    private BigDecimal realizedPnl;

    /** Highest unrealised PnL seen while open. */
    @Builder.Default
    private BigDecimal highWaterMark = BigDecimal.ZERO;

    private String error;

    /** Set when a close left residual exposure; the next close attempt waits for the cooldown. */
    private Instant lastCloseAttemptAt;

    public BigDecimal totalFees() {
        return leg1.getFees().add(leg2.getFees());
    }

    public void advanceTo(ExecutionState next) {
        if (!executionState.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    String.format("Trade %s cannot move from %s to %s", id, executionState, next));
        }
        executionState = next;
    }

    public Duration holdDuration(Instant now) {
        Instant start = openedAt != null ? openedAt : createdAt;
        if (start == null) {
            return Duration.ZERO;
        }
        return Duration.between(start, closedAt != null ? closedAt : now);
    }

    public boolean isActive() {
        return status.isActive();
    }

    public TradeLeg legOn(Venue venue) {
        return leg1.getVenue() == venue ? leg1 : leg2;
    }

    /** Notional at entry prices, using leg 1 filled size. */
    public BigDecimal entryNotional() {
        if (leg1.getEntryPrice() == null) {
            return targetNotionalUsd != null ? targetNotionalUsd : BigDecimal.ZERO;
        }
        return leg1.getFilledQty().multiply(leg1.getEntryPrice());
    }

    public Trade copy() {
        return toBuilder().leg1(leg1.copy()).leg2(leg2.copy()).build();
    }
}
