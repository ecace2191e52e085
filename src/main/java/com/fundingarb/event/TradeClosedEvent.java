package com.fundingarb.event;

import com.fundingarb.domain.model.Trade;

/**
 * Published when a trade reaches CLOSED. Carries the final trade copy, including realised PnL,
 * funding collected, and fees.
 */
public class TradeClosedEvent extends DomainEvent {

    private final Trade trade;
    private final String reason;

    public TradeClosedEvent(Object source, Trade trade, String reason) {
        super(source, trade.getSymbol(), trade.getId());
        this.trade = trade;
        this.reason = reason;
    }

    public Trade getTrade() {
        return trade;
    }

    public String getReason() {
        return reason;
    }
}
