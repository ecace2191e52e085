package com.fundingarb.event;

import com.fundingarb.domain.model.Trade;

/** Published once both legs of a new trade are filled and the trade is OPEN. */
public class TradeOpenedEvent extends DomainEvent {

    private final Trade trade;

    public TradeOpenedEvent(Object source, Trade trade) {
        super(source, trade.getSymbol(), trade.getId());
        this.trade = trade;
    }

    public Trade getTrade() {
        return trade;
    }
}
