package com.fundingarb.unit.support;

import com.fundingarb.domain.enums.ExecutionState;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import java.math.BigDecimal;
import java.time.Instant;

/** Builders for hedged trades used across tests. */
public final class TestTrades {

    private TestTrades() {}

    /**
     * An OPEN trade long {@code qty} on Lighter (leg 1) and short on X10 (leg 2), both filled at
     * {@code price}.
     */
    public static Trade openTrade(String symbol, BigDecimal qty, BigDecimal price, Instant openedAt) {
        return Trade.builder()
                .id("trade-" + symbol)
                .symbol(symbol)
                .leg1(TradeLeg.builder()
                        .venue(Venue.LIGHTER)
                        .side(Side.BUY)
                        .qty(qty)
                        .filledQty(qty)
                        .entryPrice(price)
                        .build())
                .leg2(TradeLeg.builder()
                        .venue(Venue.X10)
                        .side(Side.SELL)
                        .qty(qty)
                        .filledQty(qty)
                        .entryPrice(price)
                        .build())
                .targetQty(qty)
                .targetNotionalUsd(qty.multiply(price))
                .entryApy(new BigDecimal("0.50"))
                .status(TradeStatus.OPEN)
                .executionState(ExecutionState.COMPLETE)
                .createdAt(openedAt)
                .openedAt(openedAt)
                .build();
    }
}
