package com.fundingarb.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Coarse lifecycle of a hedged trade.
 *
 * <p>PENDING -> OPENING -> OPEN -> CLOSING -> CLOSED, or ABORTED from any point before OPEN.
 * REJECTED is used for trades refused before any order reached a venue.
 */
public enum TradeStatus {
    PENDING,
    OPENING,
    OPEN,
    CLOSING,
    CLOSED,
    ABORTED,
    REJECTED;

    /** Statuses that count against the one-active-trade-per-symbol rule. */
    public static final Set<TradeStatus> ACTIVE = EnumSet.of(OPENING, OPEN, CLOSING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return this == CLOSED || this == ABORTED || this == REJECTED;
    }
}
