package com.fundingarb.position;

import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Partial single-leg close that brings the two legs' notionals back together.
 *
 * <p>The leg with the larger notional at mark is reduced by the notional gap converted to its
 * quantity. Price PnL on the reduced quantity is booked into the trade's realised PnL.
 */
@Component
public class Rebalancer {

    private static final Logger log = LoggerFactory.getLogger(Rebalancer.class);

    private final CoordinatedCloser closer;
    private final PositionConfig positionConfig;

    public Rebalancer(CoordinatedCloser closer, PositionConfig positionConfig) {
        this.closer = closer;
        this.positionConfig = positionConfig;
    }

    /** @return quantity removed from the heavier leg; zero when nothing was worth trading */
    public BigDecimal rebalance(Trade trade, BigDecimal leg1Mark, BigDecimal leg2Mark) {
        BigDecimal p1 = priceOr(leg1Mark, trade.getLeg1());
        BigDecimal p2 = priceOr(leg2Mark, trade.getLeg2());
        if (p1 == null || p2 == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal n1 = trade.getLeg1().getFilledQty().multiply(p1);
        BigDecimal n2 = trade.getLeg2().getFilledQty().multiply(p2);
        boolean leg1Heavier = n1.compareTo(n2) > 0;
        TradeLeg heavy = leg1Heavier ? trade.getLeg1() : trade.getLeg2();
        BigDecimal heavyPrice = leg1Heavier ? p1 : p2;
        BigDecimal excessQty = n1.subtract(n2).abs().divide(heavyPrice, MathContext.DECIMAL64);

        log.info("Rebalancing {} (trade {}): reducing {} leg on {} by {}", trade.getSymbol(), trade.getId(),
                heavy.getSide(), heavy.getVenue(), excessQty);
        Duration makerTimeout = positionConfig.getRebalanceMakerTimeout();
        BigDecimal reduced = closer.reduce(trade, heavy, excessQty, makerTimeout, positionConfig.isRebalanceIocFallback());
        if (reduced.signum() == 0) {
            log.warn("Rebalance of {} filled nothing", trade.getSymbol());
            return reduced;
        }

        BigDecimal booked = heavy.pricePnl(heavyPrice)
                .multiply(reduced)
                .divide(heavy.getFilledQty(), MathContext.DECIMAL64);
        heavy.setFilledQty(heavy.getFilledQty().subtract(reduced));
        BigDecimal realized = trade.getRealizedPnl() != null ? trade.getRealizedPnl() : BigDecimal.ZERO;
        trade.setRealizedPnl(realized.add(booked));
        log.info("Rebalanced {}: {} leg now {}", trade.getSymbol(), heavy.getVenue(), heavy.getFilledQty());
        return reduced;
    }

    private static BigDecimal priceOr(BigDecimal mark, TradeLeg leg) {
        return mark != null && mark.signum() > 0 ? mark : leg.getEntryPrice();
    }
}
