package com.fundingarb.event;

import com.fundingarb.domain.enums.ExecutionState;

public class TradeStateChangedEvent extends DomainEvent {

    private final ExecutionState previousState;
    private final ExecutionState newState;

    public TradeStateChangedEvent(
            Object source, String symbol, String tradeId, ExecutionState previousState, ExecutionState newState) {
        super(source, symbol, tradeId);
        this.previousState = previousState;
        this.newState = newState;
    }

    public ExecutionState getPreviousState() {
        return previousState;
    }

    public ExecutionState getNewState() {
        return newState;
    }
}
