package com.fundingarb.position;

import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.port.EventBusPort;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Informational checks on live leg sizes. Never trades. */
@Component
public class ImbalanceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ImbalanceMonitor.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PositionConfig positionConfig;
    private final EventBusPort eventBus;

    public ImbalanceMonitor(PositionConfig positionConfig, EventBusPort eventBus) {
        this.positionConfig = positionConfig;
        this.eventBus = eventBus;
    }

    /**
     * Compares live quantities against the trade's target.
     *
     * @return the imbalance in percent of target, or null when the trade is too young or has no target
     */
    public BigDecimal check(Trade trade, BigDecimal leg1LiveQty, BigDecimal leg2LiveQty, Instant now) {
        Instant openedAt = trade.getOpenedAt() != null ? trade.getOpenedAt() : trade.getCreatedAt();
        if (openedAt == null || Duration.between(openedAt, now).compareTo(positionConfig.getImbalanceMinTradeAge()) < 0) {
            return null;
        }
        BigDecimal target = trade.getTargetQty();
        if (target == null || target.signum() == 0) {
            return null;
        }
        BigDecimal pct = leg1LiveQty.abs().subtract(leg2LiveQty.abs()).abs()
                .divide(target, MathContext.DECIMAL64)
                .multiply(HUNDRED);
        if (pct.compareTo(positionConfig.getImbalanceWarnPct()) > 0) {
            String message = String.format("Leg imbalance on %s: %s vs %s (%s%% of target %s)", trade.getSymbol(),
                    leg1LiveQty, leg2LiveQty, pct.setScale(2, RoundingMode.HALF_UP), target);
            log.warn(message);
            eventBus.publish(new AlertEvent(this, AlertLevel.WARNING, trade.getSymbol(), message,
                    "imbalance:" + trade.getId()));
        }
        return pct;
    }

    /** Logs notional drift between legs at mark when it exceeds the configured percentage. */
    public void logDeltaDrift(Trade trade, BigDecimal leg1Mark, BigDecimal leg2Mark) {
        BigDecimal drift = ExitEvaluator.deltaDrift(trade, leg1Mark, leg2Mark);
        if (drift == null) {
            return;
        }
        BigDecimal pct = drift.multiply(HUNDRED);
        if (pct.compareTo(positionConfig.getDeltaDriftLogPct()) > 0) {
            log.warn("Delta drift on {} (trade {}): {}%", trade.getSymbol(), trade.getId(),
                    pct.setScale(2, RoundingMode.HALF_UP));
        }
    }
}
