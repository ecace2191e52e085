package com.fundingarb.event;

import org.springframework.context.ApplicationEvent;

/**
 * Base of all engine events. Published through {@code EventBusPort}, which delivers them both to
 * Spring {@code @EventListener}s and to handlers registered with {@code subscribe}.
 */
public abstract class DomainEvent extends ApplicationEvent {

    private final String symbol;
    private final String tradeId;

    protected DomainEvent(Object source, String symbol, String tradeId) {
        super(source);
        this.symbol = symbol;
        this.tradeId = tradeId;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getTradeId() {
        return tradeId;
    }

    /** Short event name used in the trade event journal. */
    public String getEventType() {
        String name = getClass().getSimpleName();
        return name.endsWith("Event") ? name.substring(0, name.length() - "Event".length()) : name;
    }
}
