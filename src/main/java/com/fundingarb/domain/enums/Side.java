package com.fundingarb.domain.enums;

/** Buy or sell side of an order or position. */
public enum Side {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for close and rollback orders. */
    public Side inverse() {
        return this == BUY ? SELL : BUY;
    }
}
