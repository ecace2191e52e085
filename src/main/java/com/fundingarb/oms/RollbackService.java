package com.fundingarb.oms;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.Position;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.RollbackCompletedEvent;
import com.fundingarb.event.RollbackInitiatedEvent;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.port.ExchangePort;
import com.fundingarb.port.TradeStorePort;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compensating close of a leg that went live when the trade could not be completed.
 *
 * <p>Closes the quantity the venue actually reports, not the recorded fill, with reduce-only
 * MARKET orders, then verifies the position is flat. A rollback runs to completion even when the
 * calling thread has been interrupted for shutdown: the interrupt flag is cleared for the duration
 * and restored afterwards.
 */
@Service
public class RollbackService {

    private static final Logger log = LoggerFactory.getLogger(RollbackService.class);

    private final ExchangeRegistry exchangeRegistry;
    private final FillWaiter fillWaiter;
    private final EventBusPort eventBus;
    private final TradeStorePort tradeStore;
    private final ExecutionConfig executionConfig;
    private final PositionConfig positionConfig;

    public RollbackService(
            ExchangeRegistry exchangeRegistry,
            FillWaiter fillWaiter,
            EventBusPort eventBus,
            TradeStorePort tradeStore,
            ExecutionConfig executionConfig,
            PositionConfig positionConfig) {
        this.exchangeRegistry = exchangeRegistry;
        this.fillWaiter = fillWaiter;
        this.eventBus = eventBus;
        this.tradeStore = tradeStore;
        this.executionConfig = executionConfig;
        this.positionConfig = positionConfig;
    }

    /**
     * Flattens the live position behind {@code leg}. Updates the leg's exit price and fees.
     *
     * @return true when the venue reports the position flat afterwards
     */
    public boolean rollbackLeg(Trade trade, TradeLeg leg, String reason) {
        boolean interrupted = Thread.interrupted();
        try {
            return doRollback(trade, leg, reason);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private boolean doRollback(Trade trade, TradeLeg leg, String reason) {
        String symbol = trade.getSymbol();
        ExchangePort exchange = exchangeRegistry.get(leg.getVenue());
        Side closeSide = leg.getSide().inverse();

        BigDecimal live = liveQty(exchange, symbol, leg.getSide());
        BigDecimal initial = live != null ? live : leg.getFilledQty();
        log.warn("Rolling back {} leg on {} for {} (trade {}): {} live, reason: {}", leg.getSide(), leg.getVenue(),
                symbol, trade.getId(), initial, reason);
        eventBus.publish(new RollbackInitiatedEvent(this, symbol, trade.getId(), leg.getVenue(), initial, reason));
        journal(trade, "ROLLBACK_INITIATED", leg, initial, reason);

        BigDecimal closedQty = BigDecimal.ZERO;
        BigDecimal closedNotional = BigDecimal.ZERO;
        boolean flat = false;

        for (int attempt = 1; attempt <= executionConfig.getRollbackMaxAttempts(); attempt++) {
            BigDecimal remaining = liveQty(exchange, symbol, leg.getSide());
            if (remaining == null) {
                remaining = attempt == 1 ? leg.getFilledQty().subtract(closedQty) : BigDecimal.ZERO;
            }
            if (remaining.compareTo(positionConfig.getPositionQtyThreshold()) <= 0) {
                flat = true;
                break;
            }
            try {
                Order placed = exchange.placeOrder(OrderRequest.reduceOnlyMarket(symbol, closeSide, remaining));
                Order result = fillWaiter.awaitTerminal(exchange, placed, executionConfig.getRollbackFillTimeout());
                if (result.getStatus() == null || !result.getStatus().isTerminal()) {
                    result = fillWaiter.cancelAndFetch(exchange, result);
                }
                if (result.hasFill()) {
                    closedQty = closedQty.add(result.getFilledQty());
                    if (result.getAvgFillPrice() != null) {
                        closedNotional = closedNotional.add(result.getFilledQty().multiply(result.getAvgFillPrice()));
                    }
                    leg.addFees(result.getFee());
                    leg.setExitOrderId(result.getId());
                }
                log.info("Rollback attempt {}/{} for {} on {}: closed {} of {}", attempt,
                        executionConfig.getRollbackMaxAttempts(), symbol, leg.getVenue(), result.getFilledQty(),
                        remaining);
            } catch (RuntimeException e) {
                log.error("Rollback attempt {}/{} for {} on {} failed: {}", attempt,
                        executionConfig.getRollbackMaxAttempts(), symbol, leg.getVenue(), e.getMessage());
            }
            sleep(executionConfig.getRollbackVerifyDelay());
        }
        if (!flat) {
            BigDecimal remaining = liveQty(exchange, symbol, leg.getSide());
            flat = remaining != null && remaining.compareTo(positionConfig.getPositionQtyThreshold()) <= 0;
        }

        BigDecimal slippageLoss = BigDecimal.ZERO;
        if (closedQty.signum() > 0 && closedNotional.signum() > 0) {
            BigDecimal exitPrice = closedNotional.divide(closedQty, MathContext.DECIMAL64);
            leg.setExitPrice(exitPrice);
            slippageLoss = leg.pricePnl(exitPrice).negate().max(BigDecimal.ZERO);
        }

        eventBus.publish(new RollbackCompletedEvent(
                this, symbol, trade.getId(), leg.getVenue(), flat, closedQty, slippageLoss));
        journal(trade, flat ? "ROLLBACK_DONE" : "ROLLBACK_FAILED", leg, closedQty, reason);
        if (flat) {
            log.info("Rollback of {} on {} complete: closed {} with slippage loss {}", symbol, leg.getVenue(),
                    closedQty, slippageLoss);
        } else {
            log.error("Rollback of {} on {} FAILED, exposure remains. Manual intervention required", symbol,
                    leg.getVenue());
            eventBus.publish(new AlertEvent(
                    this,
                    AlertLevel.CRITICAL,
                    symbol,
                    String.format("Rollback failed for %s on %s (trade %s): %s", symbol, leg.getVenue(),
                            trade.getId(), reason),
                    "rollback-failed:" + symbol + ":" + leg.getVenue()));
        }
        return flat;
    }

    /** Live quantity on the leg's side, zero if flat or reversed, null if the venue could not be read. */
    private BigDecimal liveQty(ExchangePort exchange, String symbol, Side side) {
        try {
            return exchange.getPosition(symbol)
                    .filter(p -> p.getSide() == side)
                    .map(Position::getQty)
                    .orElse(BigDecimal.ZERO);
        } catch (RuntimeException e) {
            log.warn("Position read for {} on {} failed during rollback: {}", symbol, exchange.getVenue(),
                    e.getMessage());
            return null;
        }
    }

    private void journal(Trade trade, String type, TradeLeg leg, BigDecimal qty, String reason) {
        if (trade.getId() == null) {
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("venue", leg.getVenue());
        payload.put("qty", qty);
        payload.put("reason", reason);
        try {
            tradeStore.appendEvent(trade.getId(), type, payload);
        } catch (RuntimeException e) {
            log.warn("Could not journal {} for trade {}: {}", type, trade.getId(), e.getMessage());
        }
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
