package com.fundingarb.position;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.FeeConfig;
import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.CloseResult;
import com.fundingarb.domain.model.ExitDecision;
import com.fundingarb.domain.model.FundingSnapshot;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.domain.model.Position;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.BrokenHedgeDetectedEvent;
import com.fundingarb.event.TradeClosedEvent;
import com.fundingarb.exception.TradeNotFoundException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.oms.SymbolLockRegistry;
import com.fundingarb.opportunity.OpportunityEngine;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.port.TradeStorePort;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Watches open trades and decides when and how they leave the book.
 *
 * <p>Each check reads both venues' live positions, accrues funding, runs broken-hedge detection
 * and imbalance monitoring, then asks {@link ExitEvaluator} for a decision and carries it out
 * (rebalance or close). Checks and closes of one symbol hold that symbol's lock, so they never
 * overlap with an entry or a reconciliation on the same symbol.
 *
 * <p>{@link #closeTrade} is idempotent: a trade already CLOSING gets no second set of close
 * orders, except the throttled retry of a close that left residual exposure.
 */
@Service
public class PositionManager {

    private static final Logger log = LoggerFactory.getLogger(PositionManager.class);

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final TradeStorePort tradeStore;
    private final ExchangeRegistry exchangeRegistry;
    private final MarketDataService marketDataService;
    private final OpportunityEngine opportunityEngine;
    private final ExitEvaluator exitEvaluator;
    private final CoordinatedCloser closer;
    private final Rebalancer rebalancer;
    private final BrokenHedgeDetector brokenHedgeDetector;
    private final ImbalanceMonitor imbalanceMonitor;
    private final SymbolLockRegistry symbolLocks;
    private final EventBusPort eventBus;
    private final PositionConfig positionConfig;
    private final FeeConfig feeConfig;
    private final Clock clock;

    private final Map<String, Instant> lastFundingAccrual = new ConcurrentHashMap<>();

    public PositionManager(
            TradeStorePort tradeStore,
            ExchangeRegistry exchangeRegistry,
            MarketDataService marketDataService,
            OpportunityEngine opportunityEngine,
            ExitEvaluator exitEvaluator,
            CoordinatedCloser closer,
            Rebalancer rebalancer,
            BrokenHedgeDetector brokenHedgeDetector,
            ImbalanceMonitor imbalanceMonitor,
            SymbolLockRegistry symbolLocks,
            EventBusPort eventBus,
            PositionConfig positionConfig,
            FeeConfig feeConfig,
            Clock clock) {
        this.tradeStore = tradeStore;
        this.exchangeRegistry = exchangeRegistry;
        this.marketDataService = marketDataService;
        this.opportunityEngine = opportunityEngine;
        this.exitEvaluator = exitEvaluator;
        this.closer = closer;
        this.rebalancer = rebalancer;
        this.brokenHedgeDetector = brokenHedgeDetector;
        this.imbalanceMonitor = imbalanceMonitor;
        this.symbolLocks = symbolLocks;
        this.eventBus = eventBus;
        this.positionConfig = positionConfig;
        this.feeConfig = feeConfig;
        this.clock = clock;
    }

    // ========================
    // PERIODIC CHECK
    // ========================

    /** One pass over every OPEN trade plus due close retries. Returns the number of trades checked. */
    public int checkAll() {
        List<Trade> open = tradeStore.listByStatus(TradeStatus.OPEN);
        for (Trade trade : open) {
            try {
                checkTrade(trade.getId());
            } catch (RuntimeException e) {
                log.error("Position check for {} (trade {}) failed: {}", trade.getSymbol(), trade.getId(),
                        e.getMessage(), e);
            }
        }
        retryPendingCloses();
        return open.size();
    }

    /** Runs one check of a single trade. Skipped when the symbol is busy. */
    public void checkTrade(String tradeId) {
        Trade snapshot = tradeStore.getTrade(tradeId).orElse(null);
        if (snapshot == null) {
            return;
        }
        ReentrantLock lock = symbolLocks.lockFor(snapshot.getSymbol());
        if (!lock.tryLock()) {
            log.debug("Position check for {} skipped: symbol busy", snapshot.getSymbol());
            return;
        }
        try {
            Trade trade = tradeStore.getTrade(tradeId).orElse(null);
            if (trade == null || trade.getStatus() != TradeStatus.OPEN) {
                return;
            }
            evaluateLocked(trade);
        } finally {
            lock.unlock();
        }
    }

    private void evaluateLocked(Trade trade) {
        Instant now = clock.instant();
        Optional<Position> pos1;
        Optional<Position> pos2;
        try {
            pos1 = exchangeRegistry.get(trade.getLeg1().getVenue()).getPosition(trade.getSymbol());
            pos2 = exchangeRegistry.get(trade.getLeg2().getVenue()).getPosition(trade.getSymbol());
        } catch (RuntimeException e) {
            log.warn("Live positions for {} unavailable, skipping check: {}", trade.getSymbol(), e.getMessage());
            return;
        }
        BigDecimal live1 = pos1.map(Position::getQty).orElse(BigDecimal.ZERO);
        BigDecimal live2 = pos2.map(Position::getQty).orElse(BigDecimal.ZERO);

        Optional<Venue> missing = brokenHedgeDetector.observe(trade, live1, live2, now);
        if (missing.isPresent()) {
            handleBrokenHedge(trade, missing.get(), missing.get() == trade.getLeg1().getVenue() ? live2 : live1);
            return;
        }
        imbalanceMonitor.check(trade, live1, live2, now);

        // without rates and marks every economic rule would read zero funding, so hold
        Optional<FundingSnapshot> funding = marketDataService.getFundingSnapshot(trade.getSymbol());
        if (funding.isEmpty() || !funding.get().hasRates()) {
            log.debug("Holding {} (trade {}): No market data", trade.getSymbol(), trade.getId());
            return;
        }
        BigDecimal mark1 = markPrice(trade.getSymbol(), trade.getLeg1().getVenue());
        BigDecimal mark2 = markPrice(trade.getSymbol(), trade.getLeg2().getVenue());
        if (mark1 == null || mark2 == null) {
            log.debug("Holding {} (trade {}): No market data", trade.getSymbol(), trade.getId());
            return;
        }
        imbalanceMonitor.logDeltaDrift(trade, mark1, mark2);

        ExitContext ctx = buildContext(trade, now, pos1, pos2, mark1, mark2);
        accrueFunding(trade, ctx, now);
        if (ctx.getCurrentPnl().compareTo(trade.getHighWaterMark()) > 0) {
            trade.setHighWaterMark(ctx.getCurrentPnl());
        }
        tradeStore.updateTrade(trade);

        ExitDecision decision = exitEvaluator.evaluate(ctx);
        if (decision.isRebalance()) {
            log.info("{} (trade {}): {}", trade.getSymbol(), trade.getId(), decision.getReason());
            rebalancer.rebalance(trade, mark1, mark2);
            tradeStore.updateTrade(trade);
        } else if (decision.isShouldExit()) {
            log.info("Exit triggered for {} (trade {}): {}", trade.getSymbol(), trade.getId(), decision.getReason());
            closeTrade(trade.getId(), decision.getReason(), decision.isEmergency());
        } else {
            log.debug("Holding {} (trade {}): {}", trade.getSymbol(), trade.getId(), decision.getReason());
        }
    }

    private BigDecimal markPrice(String symbol, Venue venue) {
        try {
            BigDecimal mark = marketDataService.getMarkPrice(symbol, venue);
            return mark != null && mark.signum() > 0 ? mark : null;
        } catch (RuntimeException e) {
            log.warn("Mark price for {} on {} unavailable: {}", symbol, venue, e.getMessage());
            return null;
        }
    }

    ExitContext buildContext(
            Trade trade,
            Instant now,
            Optional<Position> pos1,
            Optional<Position> pos2,
            BigDecimal mark1,
            BigDecimal mark2) {
        Optional<FundingSnapshot> funding = marketDataService.getFundingSnapshot(trade.getSymbol());
        BigDecimal pricePnl = trade.getLeg1().pricePnl(mark1)
                .add(trade.getLeg2().pricePnl(mark2))
                .subtract(trade.totalFees());
        BigDecimal realized = trade.getRealizedPnl() != null ? trade.getRealizedPnl() : BigDecimal.ZERO;
        pricePnl = pricePnl.add(realized);
        return ExitContext.builder()
                .trade(trade)
                .now(now)
                .lighterRate(funding.map(FundingSnapshot::getLighterRate).orElse(null))
                .x10Rate(funding.map(FundingSnapshot::getX10Rate).orElse(null))
                .leg1MarkPrice(mark1)
                .leg2MarkPrice(mark2)
                .leg1LiquidationDistance(liquidationDistance(pos1, mark1))
                .leg2LiquidationDistance(liquidationDistance(pos2, mark2))
                .pricePnl(pricePnl)
                .currentPnl(pricePnl.add(trade.getFundingCollected()))
                .estimatedExitCostUsd(estimateExitCost(trade, mark1, mark2))
                .bestOpportunityApy(opportunityEngine.bestApyExcluding(trade.getSymbol()).orElse(null))
                .build();
    }

    /** Taker fees on both legs at mark plus half the current spread. */
    BigDecimal estimateExitCost(Trade trade, BigDecimal mark1, BigDecimal mark2) {
        BigDecimal cost = BigDecimal.ZERO;
        for (TradeLeg leg : List.of(trade.getLeg1(), trade.getLeg2())) {
            BigDecimal mark = leg == trade.getLeg1() ? mark1 : mark2;
            BigDecimal price = mark != null && mark.signum() > 0 ? mark : leg.getEntryPrice();
            if (price == null) {
                continue;
            }
            BigDecimal qty = leg.getFilledQty();
            cost = cost.add(qty.multiply(price).multiply(feeConfig.takerFee(leg.getVenue())));
            Optional<OrderbookSnapshot> book = marketDataService.getCachedOrderbook(trade.getSymbol(), leg.getVenue());
            if (book.isPresent() && book.get().hasDepth()) {
                BigDecimal halfSpread = book.get().getBestAsk().subtract(book.get().getBestBid()).divide(TWO);
                cost = cost.add(qty.multiply(halfSpread.max(BigDecimal.ZERO)));
            }
        }
        return cost;
    }

    private static BigDecimal liquidationDistance(Optional<Position> position, BigDecimal mark) {
        if (position.isEmpty() || mark == null || mark.signum() <= 0) {
            return null;
        }
        BigDecimal liquidation = position.get().getLiquidationPrice();
        if (liquidation == null || liquidation.signum() <= 0) {
            return null;
        }
        return mark.subtract(liquidation).abs().divide(mark, MathContext.DECIMAL64);
    }

    private void accrueFunding(Trade trade, ExitContext ctx, Instant now) {
        Instant since = lastFundingAccrual.put(trade.getId(), now);
        if (since == null) {
            since = trade.getOpenedAt();
        }
        if (since == null || !now.isAfter(since)) {
            return;
        }
        BigDecimal hours = BigDecimal.valueOf(Duration.between(since, now).getSeconds())
                .divide(SECONDS_PER_HOUR, MathContext.DECIMAL64);
        BigDecimal accrued = ctx.netFundingHourly().multiply(trade.entryNotional().abs()).multiply(hours);
        trade.setFundingCollected(trade.getFundingCollected().add(accrued));
    }

    // ========================
    // CLOSE
    // ========================

    /**
     * Closes a trade. Returns a skipped result when the trade is not OPEN, or is CLOSING and not
     * yet due for a retry.
     *
     * @throws TradeNotFoundException if the trade is unknown
     */
    public CloseResult closeTrade(String tradeId, String reason, boolean emergency) {
        Trade snapshot = tradeStore.getTrade(tradeId).orElseThrow(() -> new TradeNotFoundException(tradeId));
        ReentrantLock lock = symbolLocks.lockFor(snapshot.getSymbol());
        lock.lock();
        try {
            Trade trade = tradeStore.getTrade(tradeId).orElseThrow(() -> new TradeNotFoundException(tradeId));
            String refusal = closeRefusal(trade);
            if (refusal != null) {
                log.info("Close of trade {} skipped: {}", tradeId, refusal);
                return CloseResult.skipped(tradeId, refusal);
            }
            return doClose(trade, reason, emergency);
        } finally {
            lock.unlock();
        }
    }

    private String closeRefusal(Trade trade) {
        if (trade.getStatus() == TradeStatus.OPEN) {
            return null;
        }
        if (trade.getStatus() != TradeStatus.CLOSING) {
            return "trade is " + trade.getStatus();
        }
        if (trade.getLastCloseAttemptAt() == null) {
            return "close already in progress";
        }
        Instant due = trade.getLastCloseAttemptAt().plus(positionConfig.getCloseRetryCooldown());
        if (clock.instant().isBefore(due)) {
            return "close retry not due before " + due;
        }
        return null;
    }

    private CloseResult doClose(Trade trade, String reason, boolean emergency) {
        boolean retry = trade.getStatus() == TradeStatus.CLOSING;
        trade.setStatus(TradeStatus.CLOSING);
        trade.setLastCloseAttemptAt(null);
        if (trade.getCloseReason() == null) {
            trade.setCloseReason(reason);
        }
        tradeStore.updateTrade(trade);
        journal(trade, retry ? "CLOSE_RETRY" : "CLOSE_STARTED", reason);

        CloseResult result;
        try {
            result = closer.close(trade, emergency);
        } catch (RuntimeException e) {
            log.error("Coordinated close of {} failed, falling back to sequential: {}", trade.getSymbol(),
                    e.getMessage());
            result = closer.closeSequentially(trade);
        }
        result.setReason(trade.getCloseReason());

        if (result.isSuccess()) {
            BigDecimal realized = trade.getRealizedPnl() != null ? trade.getRealizedPnl() : BigDecimal.ZERO;
            realized = realized
                    .add(trade.getLeg1().pnl())
                    .add(trade.getLeg2().pnl())
                    .add(trade.getFundingCollected());
            trade.setRealizedPnl(realized);
            trade.setStatus(TradeStatus.CLOSED);
            trade.setClosedAt(clock.instant());
            tradeStore.updateTrade(trade);
            journal(trade, "CLOSED", trade.getCloseReason());
            lastFundingAccrual.remove(trade.getId());
            brokenHedgeDetector.clear(trade.getId());
            eventBus.publish(new TradeClosedEvent(this, trade.copy(), trade.getCloseReason()));
            result.setRealizedPnl(realized);
            log.info("Trade {} CLOSED: {} realised {} (funding {}, fees {}) reason: {}", trade.getId(),
                    trade.getSymbol(), realized, trade.getFundingCollected(), trade.totalFees(),
                    trade.getCloseReason());
            return result;
        }

        trade.setLastCloseAttemptAt(clock.instant());
        tradeStore.updateTrade(trade);
        journal(trade, "CLOSE_INCOMPLETE", result.getMessage());
        log.error("Close of {} (trade {}) left residual exposure: {}. Retrying after {}", trade.getSymbol(),
                trade.getId(), result.getMessage(), positionConfig.getCloseRetryCooldown());
        eventBus.publish(new AlertEvent(this, AlertLevel.CRITICAL, trade.getSymbol(),
                String.format("Close of %s incomplete (%s), exposure remains", trade.getSymbol(), result.getMessage()),
                "close-failed:" + trade.getId()));
        return result;
    }

    /** Retries closes that previously left residual exposure, once their cooldown has passed. */
    public void retryPendingCloses() {
        Instant now = clock.instant();
        for (Trade trade : tradeStore.listByStatus(TradeStatus.CLOSING)) {
            Instant last = trade.getLastCloseAttemptAt();
            if (last == null || now.isBefore(last.plus(positionConfig.getCloseRetryCooldown()))) {
                continue;
            }
            try {
                closeTrade(trade.getId(), trade.getCloseReason(), true);
            } catch (RuntimeException e) {
                log.error("Close retry for trade {} failed: {}", trade.getId(), e.getMessage());
            }
        }
    }

    // ========================
    // BROKEN HEDGE
    // ========================

    private void handleBrokenHedge(Trade trade, Venue missingVenue, BigDecimal survivingQty) {
        Venue surviving = missingVenue.other();
        log.error("BROKEN HEDGE confirmed on {} (trade {}): {} leg gone, {} {} still live", trade.getSymbol(),
                trade.getId(), missingVenue, survivingQty, surviving);
        eventBus.publish(new BrokenHedgeDetectedEvent(this, trade.getSymbol(), trade.getId(), missingVenue, surviving,
                survivingQty));
        eventBus.publish(new AlertEvent(this, AlertLevel.CRITICAL, trade.getSymbol(),
                String.format("Broken hedge on %s: %s leg missing, closing %s leg", trade.getSymbol(), missingVenue,
                        surviving),
                "broken-hedge:" + trade.getSymbol()));
        closeTrade(trade.getId(), "BROKEN_HEDGE: " + missingVenue + " leg missing", true);
    }

    private void journal(Trade trade, String type, String detail) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("status", trade.getStatus());
        payload.put("detail", detail);
        tradeStore.appendEvent(trade.getId(), type, payload);
    }
}
