package com.fundingarb.reconciliation;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.config.ReconciliationConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.enums.ExecutionState;
import com.fundingarb.domain.enums.GhostPolicy;
import com.fundingarb.domain.enums.ReconcileAction;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.Position;
import com.fundingarb.domain.model.ReconciliationFinding;
import com.fundingarb.domain.model.ReconciliationResult;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.PositionReconciledEvent;
import com.fundingarb.exception.BaseException;
import com.fundingarb.exception.ReconciliationException;
import com.fundingarb.oms.FillWaiter;
import com.fundingarb.oms.SymbolLockRegistry;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.port.ExchangePort;
import com.fundingarb.port.TradeStorePort;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps persisted trades in line with what the venues actually hold.
 *
 * <p>Each pass builds a live-position index per venue and classifies every PENDING, OPENING and
 * OPEN trade, then looks for live exposure that no trade owns:
 * <ul>
 *   <li>stale PENDING/OPENING trade without live legs: resting orders cancelled, trade ABORTED
 *       ({@code closed_zombie})</li>
 *   <li>stale OPENING trade with both legs live: promoted to OPEN from the live quantities
 *       ({@code adopted_ghost})</li>
 *   <li>live side opposite to the recorded side: the conflicting live leg is force-closed
 *       ({@code closed_conflict})</li>
 *   <li>sides agree but quantity differs beyond tolerance: alert only ({@code quantity_mismatch})</li>
 *   <li>live exposure with no trade: adopted, flattened or ignored by {@link GhostPolicy}</li>
 * </ul>
 *
 * <p>Every action is safe to repeat: a handled trade leaves the classified state, and a closed
 * position no longer appears in the next index. Each action publishes a
 * {@link PositionReconciledEvent}. Symbols whose lock is held (entry or close in flight) are skipped
 * for this pass.
 */
@Service
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final ExchangeRegistry exchangeRegistry;
    private final TradeStorePort tradeStore;
    private final EventBusPort eventBus;
    private final FillWaiter fillWaiter;
    private final SymbolLockRegistry symbolLocks;
    private final ReconciliationConfig config;
    private final ExecutionConfig executionConfig;
    private final Clock clock;

    public Reconciler(
            ExchangeRegistry exchangeRegistry,
            TradeStorePort tradeStore,
            EventBusPort eventBus,
            FillWaiter fillWaiter,
            SymbolLockRegistry symbolLocks,
            ReconciliationConfig config,
            ExecutionConfig executionConfig,
            Clock clock) {
        this.exchangeRegistry = exchangeRegistry;
        this.tradeStore = tradeStore;
        this.eventBus = eventBus;
        this.fillWaiter = fillWaiter;
        this.symbolLocks = symbolLocks;
        this.config = config;
        this.executionConfig = executionConfig;
        this.clock = clock;
    }

    /** Scheduled pass from the supervisor loop. */
    public ReconciliationResult reconcile() {
        return reconcile("scheduled", false);
    }

    /**
     * Runs one reconciliation pass.
     *
     * @param trigger "startup", "scheduled" or "manual"
     * @param startup at startup every OPENING trade is stale: its execution died with the process
     */
    public ReconciliationResult reconcile(String trigger, boolean startup) {
        long start = System.currentTimeMillis();
        Instant now = clock.instant();
        ReconciliationResult result = ReconciliationResult.builder().timestamp(now).trigger(trigger).build();
        log.info("Reconciliation started: trigger={}", trigger);

        Map<Venue, Map<String, Position>> live;
        try {
            live = liveIndex();
        } catch (BaseException e) {
            // without a complete index a missing position is indistinguishable from a failed read
            log.error("Reconciliation aborted, live positions unavailable: {}", e.getMessage());
            result.getErrors().add(e.getMessage());
            result.setDurationMs(System.currentTimeMillis() - start);
            return result;
        }
        result.setLivePositionCount(live.values().stream().mapToInt(Map::size).sum());

        Set<String> tradeSymbols = new HashSet<>();
        List<Trade> trades = tradeStore.listOpenTrades();
        for (Trade trade : trades) {
            tradeSymbols.add(trade.getSymbol());
            if (trade.getStatus() == TradeStatus.CLOSING) {
                continue;
            }
            result.setTradesChecked(result.getTradesChecked() + 1);
            withSymbolLock(trade.getSymbol(), result, () -> checkTrade(trade.getId(), live, now, startup, result));
        }

        // the index is stale for symbols the trade pass acted on; the next pass sees what is left
        TreeSet<String> liveSymbols = new TreeSet<>();
        live.values().forEach(byVenue -> liveSymbols.addAll(byVenue.keySet()));
        liveSymbols.removeAll(tradeSymbols);
        for (String symbol : liveSymbols) {
            withSymbolLock(symbol, result, () -> checkGhost(symbol, live, result));
        }

        result.setDurationMs(System.currentTimeMillis() - start);
        if (result.hasFindings()) {
            log.warn("Reconciliation complete: {} findings, {} errors, duration={}ms", result.getFindings().size(),
                    result.getErrors().size(), result.getDurationMs());
        } else {
            log.info("Reconciliation complete: no findings, duration={}ms", result.getDurationMs());
        }
        return result;
    }

    // ========================
    // PERSISTED TRADES
    // ========================

    private void checkTrade(
            String tradeId, Map<Venue, Map<String, Position>> live, Instant now, boolean startup,
            ReconciliationResult result) {
        // re-read under the lock: the trade may have moved since the list was taken
        Optional<Trade> current = tradeStore.getTrade(tradeId);
        if (current.isEmpty()) {
            return;
        }
        Trade trade = current.get();
        TradeStatus status = trade.getStatus();
        if (status != TradeStatus.PENDING && status != TradeStatus.OPENING && status != TradeStatus.OPEN) {
            return;
        }
        Position live1 = live.get(trade.getLeg1().getVenue()).get(trade.getSymbol());
        Position live2 = live.get(trade.getLeg2().getVenue()).get(trade.getSymbol());

        if (status != TradeStatus.OPEN) {
            if (isStale(trade, now, startup)) {
                handleStaleEntry(trade, live1, live2, result);
            }
            return;
        }

        if (live1 == null && live2 == null) {
            abandonTrade(trade, TradeStatus.CLOSED, "zombie: no live positions", result);
            return;
        }

        boolean conflict = false;
        for (TradeLeg leg : List.of(trade.getLeg1(), trade.getLeg2())) {
            Position position = leg == trade.getLeg1() ? live1 : live2;
            if (position != null && position.getSide() != leg.getSide()) {
                conflict = true;
                closeConflict(trade, leg, position, result);
            }
        }
        if (conflict) {
            return;
        }

        // one missing leg is a broken hedge, confirmed by the position manager's debounce
        checkQuantity(trade, trade.getLeg1(), live1, result);
        checkQuantity(trade, trade.getLeg2(), live2, result);
    }

    boolean isStale(Trade trade, Instant now, boolean startup) {
        if (trade.getCreatedAt() == null) {
            return true;
        }
        if (trade.getStatus() == TradeStatus.OPENING && startup) {
            return true;
        }
        Duration timeout = trade.getStatus() == TradeStatus.PENDING
                ? config.getPendingStaleTimeout()
                : config.getOpeningStaleTimeout();
        return Duration.between(trade.getCreatedAt(), now).compareTo(timeout) > 0;
    }

    private void handleStaleEntry(Trade trade, Position live1, Position live2, ReconciliationResult result) {
        cancelRestingOrders(trade.getSymbol());
        boolean sidesMatch = live1 != null && live2 != null
                && live1.getSide() == trade.getLeg1().getSide()
                && live2.getSide() == trade.getLeg2().getSide();
        if (sidesMatch) {
            promoteToOpen(trade, live1, live2, result);
            return;
        }
        if (live1 != null) {
            forceClose(trade.getSymbol(), live1);
        }
        if (live2 != null) {
            forceClose(trade.getSymbol(), live2);
        }
        abandonTrade(trade, TradeStatus.ABORTED, "zombie: stale " + trade.getStatus(), result);
    }

    private void promoteToOpen(Trade trade, Position live1, Position live2, ReconciliationResult result) {
        adoptLeg(trade.getLeg1(), live1);
        adoptLeg(trade.getLeg2(), live2);
        trade.setTargetQty(trade.getLeg1().getFilledQty());
        advance(trade, ExecutionState.COMPLETE);
        trade.setStatus(TradeStatus.OPEN);
        trade.setOpenedAt(clock.instant());
        tradeStore.updateTrade(trade);
        tradeStore.appendEvent(trade.getId(), "RECONCILED", Map.of("action", ReconcileAction.ADOPTED_GHOST.getCode()));
        record(result, ReconciliationFinding.builder()
                .symbol(trade.getSymbol())
                .tradeId(trade.getId())
                .action(ReconcileAction.ADOPTED_GHOST)
                .actualQty(live1.getQty())
                .detail("stale opening trade promoted to OPEN from live legs")
                .build());
    }

    private void abandonTrade(Trade trade, TradeStatus terminal, String reason, ReconciliationResult result) {
        if (trade.getExecutionState().canAdvanceTo(ExecutionState.ABORTED)) {
            trade.advanceTo(ExecutionState.ABORTED);
        }
        trade.setStatus(terminal);
        trade.setCloseReason(reason);
        trade.setClosedAt(clock.instant());
        if (trade.getRealizedPnl() == null) {
            trade.setRealizedPnl(trade.getLeg1().pnl().add(trade.getLeg2().pnl()).add(trade.getFundingCollected()));
        }
        tradeStore.updateTrade(trade);
        tradeStore.appendEvent(trade.getId(), "RECONCILED", Map.of(
                "action", ReconcileAction.CLOSED_ZOMBIE.getCode(), "reason", reason));
        log.warn("Trade {} {} marked {}: {}", trade.getId(), trade.getSymbol(), terminal, reason);
        record(result, ReconciliationFinding.builder()
                .symbol(trade.getSymbol())
                .tradeId(trade.getId())
                .action(ReconcileAction.CLOSED_ZOMBIE)
                .detail(reason)
                .build());
    }

    private void closeConflict(Trade trade, TradeLeg leg, Position position, ReconciliationResult result) {
        log.error("Trade {} {}: live {} on {} conflicts with recorded {}, force-closing", trade.getId(),
                trade.getSymbol(), position.getSide(), leg.getVenue(), leg.getSide());
        BigDecimal closed = forceClose(trade.getSymbol(), position);
        tradeStore.appendEvent(trade.getId(), "RECONCILED", Map.of(
                "action", ReconcileAction.CLOSED_CONFLICT.getCode(),
                "venue", leg.getVenue().name(),
                "closedQty", closed));
        record(result, ReconciliationFinding.builder()
                .symbol(trade.getSymbol())
                .tradeId(trade.getId())
                .venue(leg.getVenue())
                .action(ReconcileAction.CLOSED_CONFLICT)
                .expectedQty(leg.getFilledQty())
                .actualQty(position.getQty())
                .detail("live " + position.getSide() + " vs recorded " + leg.getSide())
                .build());
    }

    /**
     * Alert-only: partial automatic adjustment could compound the error, so nothing is traded.
     */
    void checkQuantity(Trade trade, TradeLeg leg, Position position, ReconciliationResult result) {
        if (position == null) {
            return;
        }
        BigDecimal expected = leg.getFilledQty().subtract(leg.getClosedQty());
        BigDecimal delta = expected.subtract(position.getQty()).abs();
        if (expected.signum() == 0 || delta.compareTo(config.getDustQty()) <= 0) {
            return;
        }
        BigDecimal relative = delta.divide(expected, MathContext.DECIMAL64);
        if (relative.compareTo(config.getQtyTolerance()) <= 0) {
            return;
        }
        log.warn("Trade {} {} quantity mismatch on {}: recorded {}, live {}, delta {}", trade.getId(),
                trade.getSymbol(), leg.getVenue(), expected, position.getQty(), delta);
        ReconciliationFinding finding = ReconciliationFinding.builder()
                .symbol(trade.getSymbol())
                .tradeId(trade.getId())
                .venue(leg.getVenue())
                .action(ReconcileAction.QUANTITY_MISMATCH)
                .delta(delta)
                .expectedQty(expected)
                .actualQty(position.getQty())
                .detail("relative delta " + relative)
                .build();
        record(result, finding);
        eventBus.publish(new AlertEvent(this, AlertLevel.WARNING, trade.getSymbol(),
                String.format("Quantity mismatch on %s %s: recorded %s, live %s", trade.getSymbol(),
                        leg.getVenue(), expected, position.getQty()),
                "quantity-mismatch:" + trade.getId() + ":" + leg.getVenue()));
    }

    // ========================
    // GHOST POSITIONS
    // ========================

    private void checkGhost(String symbol, Map<Venue, Map<String, Position>> live, ReconciliationResult result) {
        if (tradeStore.findActiveBySymbol(symbol).isPresent()) {
            return;
        }
        Map<Venue, Position> ghosts = new EnumMap<>(Venue.class);
        for (Venue venue : Venue.values()) {
            Position position = live.get(venue).get(symbol);
            if (position != null) {
                ghosts.put(venue, position);
            }
        }
        if (ghosts.isEmpty()) {
            return;
        }
        GhostPolicy policy = config.getGhostPolicy();
        log.warn("Ghost exposure on {} with no trade: {} (policy {})", symbol, ghosts.keySet(), policy);

        if (policy == GhostPolicy.IGNORE) {
            ghosts.forEach((venue, position) -> record(result, ghostFinding(symbol, venue, position,
                    ReconcileAction.IGNORED, "ghost ignored by policy")));
            return;
        }
        if (policy == GhostPolicy.ADOPT && isHedgedPair(ghosts)) {
            adoptGhost(symbol, ghosts, result);
            return;
        }
        // a single unhedged ghost cannot be adopted as a hedge, so it is flattened
        ghosts.forEach((venue, position) -> {
            BigDecimal closed = forceClose(symbol, position);
            record(result, ghostFinding(symbol, venue, position, ReconcileAction.CLOSED_ZOMBIE,
                    "ghost flattened, closed " + closed));
        });
    }

    private static boolean isHedgedPair(Map<Venue, Position> ghosts) {
        return ghosts.size() == 2 && ghosts.get(Venue.LIGHTER).getSide() != ghosts.get(Venue.X10).getSide();
    }

    private void adoptGhost(String symbol, Map<Venue, Position> ghosts, ReconciliationResult result) {
        Venue makerVenue = executionConfig.getMakerVenue();
        Position maker = ghosts.get(makerVenue);
        Position hedge = ghosts.get(makerVenue.other());
        Instant now = clock.instant();
        Trade draft = Trade.builder()
                .symbol(symbol)
                .leg1(TradeLeg.builder().venue(makerVenue).side(maker.getSide()).qty(maker.getQty()).build())
                .leg2(TradeLeg.builder().venue(makerVenue.other()).side(hedge.getSide()).qty(hedge.getQty()).build())
                .targetQty(maker.getQty())
                .entryApy(BigDecimal.ZERO)
                .createdAt(now)
                .build();
        adoptLeg(draft.getLeg1(), maker);
        adoptLeg(draft.getLeg2(), hedge);
        if (maker.getEntryPrice() != null) {
            draft.setTargetNotionalUsd(maker.getQty().multiply(maker.getEntryPrice()));
        }
        Trade trade = tradeStore.createTrade(draft);
        advance(trade, ExecutionState.COMPLETE);
        trade.setStatus(TradeStatus.OPEN);
        trade.setOpenedAt(now);
        tradeStore.updateTrade(trade);
        tradeStore.appendEvent(trade.getId(), "RECONCILED", Map.of("action", ReconcileAction.ADOPTED_GHOST.getCode()));
        log.warn("Adopted ghost positions on {} as trade {}", symbol, trade.getId());
        record(result, ReconciliationFinding.builder()
                .symbol(symbol)
                .tradeId(trade.getId())
                .action(ReconcileAction.ADOPTED_GHOST)
                .actualQty(maker.getQty())
                .detail("ghost pair adopted")
                .build());
    }

    private static ReconciliationFinding ghostFinding(
            String symbol, Venue venue, Position position, ReconcileAction action, String detail) {
        return ReconciliationFinding.builder()
                .symbol(symbol)
                .venue(venue)
                .action(action)
                .expectedQty(BigDecimal.ZERO)
                .actualQty(position.getQty())
                .detail(detail)
                .build();
    }

    // ========================
    // HELPERS
    // ========================

    private Map<Venue, Map<String, Position>> liveIndex() {
        Map<Venue, Map<String, Position>> index = new EnumMap<>(Venue.class);
        for (ExchangePort exchange : exchangeRegistry.all()) {
            Map<String, Position> bySymbol = new LinkedHashMap<>();
            for (Position position : exchange.listPositions()) {
                if (position.isAbove(config.getDustQty())) {
                    bySymbol.put(position.getSymbol(), position);
                }
            }
            index.put(exchange.getVenue(), bySymbol);
        }
        for (Venue venue : Venue.values()) {
            index.putIfAbsent(venue, new HashMap<>());
        }
        return index;
    }

    private void withSymbolLock(String symbol, ReconciliationResult result, Runnable action) {
        ReentrantLock lock = symbolLocks.lockFor(symbol);
        boolean acquired;
        try {
            acquired = lock.tryLock(config.getSymbolLockWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (!acquired) {
            log.debug("Skipping {} this pass, symbol busy", symbol);
            return;
        }
        try {
            action.run();
        } catch (BaseException e) {
            log.error("Reconciliation of {} failed: {}", symbol, e.getMessage());
            result.getErrors().add(symbol + ": " + e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private void cancelRestingOrders(String symbol) {
        for (ExchangePort exchange : exchangeRegistry.all()) {
            for (Order order : exchange.getOpenOrders(symbol)) {
                try {
                    exchange.cancelOrder(symbol, order.getId());
                    log.info("Cancelled resting order {} on {} {}", order.getId(), exchange.getVenue(), symbol);
                } catch (BaseException e) {
                    log.warn("Cancel of {} on {} failed: {}", order.getId(), exchange.getVenue(), e.getMessage());
                }
            }
        }
    }

    /**
     * Flattens a live position with a reduce-only market order.
     *
     * @return quantity closed
     * @throws ReconciliationException if the order could not be placed
     */
    private BigDecimal forceClose(String symbol, Position position) {
        ExchangePort exchange = exchangeRegistry.get(position.getVenue());
        Side closeSide = position.getSide().inverse();
        Order placed;
        try {
            placed = exchange.placeOrder(OrderRequest.reduceOnlyMarket(symbol, closeSide, position.getQty()));
        } catch (BaseException e) {
            throw new ReconciliationException(
                    "Force close of " + symbol + " on " + position.getVenue() + " failed: " + e.getMessage(), e);
        }
        Order done = fillWaiter.awaitTerminal(exchange, placed, config.getGhostCloseTimeout());
        BigDecimal filled = done.getFilledQty() != null ? done.getFilledQty() : BigDecimal.ZERO;
        log.warn("Force-closed {} {} {} on {}", filled, symbol, position.getSide(), position.getVenue());
        return filled;
    }

    private static void adoptLeg(TradeLeg leg, Position position) {
        leg.setQty(position.getQty());
        leg.setFilledQty(position.getQty());
        if (position.getEntryPrice() != null) {
            leg.setEntryPrice(position.getEntryPrice());
        }
    }

    private static void advance(Trade trade, ExecutionState target) {
        if (trade.getExecutionState().canAdvanceTo(target)) {
            trade.advanceTo(target);
        }
    }

    private void record(ReconciliationResult result, ReconciliationFinding finding) {
        result.getFindings().add(finding);
        eventBus.publish(new PositionReconciledEvent(this, finding));
    }
}
