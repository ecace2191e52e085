package com.fundingarb.domain.enums;

/**
 * Lifecycle status of a venue order.
 * PENDING is our internal pre-acknowledgement state; the rest mirror what venues report.
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED;

    /** True once the venue will not fill the order any further. */
    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED || this == EXPIRED;
    }

    public boolean isActive() {
        return this == PENDING || this == OPEN || this == PARTIALLY_FILLED;
    }
}
