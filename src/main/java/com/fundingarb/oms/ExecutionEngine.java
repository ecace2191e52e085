package com.fundingarb.oms;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.config.OpportunityConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.enums.ExecutionMode;
import com.fundingarb.domain.enums.ExecutionState;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Balance;
import com.fundingarb.domain.model.ExecutionResult;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.Opportunity;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.BrokenHedgeDetectedEvent;
import com.fundingarb.event.LegFilledEvent;
import com.fundingarb.event.TradeOpenedEvent;
import com.fundingarb.event.TradeStateChangedEvent;
import com.fundingarb.exception.BaseException;
import com.fundingarb.exception.InsufficientBalanceException;
import com.fundingarb.exception.Leg1FailedException;
import com.fundingarb.exception.Leg2FailedException;
import com.fundingarb.exception.PreflightCheckException;
import com.fundingarb.exception.RollbackException;
import com.fundingarb.exception.TradeExecutionException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.port.ExchangePort;
import com.fundingarb.port.TradeStorePort;
import com.fundingarb.risk.CircuitBreaker;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Opens a hedged trade for one opportunity: leg 1 on the maker venue, leg 2 on the other.
 *
 * <p>Execution state only moves forward:
 * {@code PENDING -> LEG1_SUBMITTED -> LEG1_FILLED -> LEG2_SUBMITTED -> COMPLETE}, with
 * {@code ABORTED} reachable from any state before COMPLETE. An aborted trade that holds exposure
 * continues through the rollback sub-states.
 *
 * <p><b>Modes:</b>
 * <ul>
 *   <li>{@code SEQUENTIAL}: leg 2 is only sent once leg 1 is done, sized to leg 1's fill</li>
 *   <li>{@code PARALLEL}: both legs run at once on the leg executor; afterwards leg 2 is topped up
 *       or trimmed to match leg 1, or the surviving leg is rolled back if the other filled nothing</li>
 * </ul>
 *
 * <p>Entries for one symbol are serialised by a per-symbol lock; a second concurrent entry is
 * refused rather than queued. Every state change is persisted, journaled and published.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final ExchangeRegistry exchangeRegistry;
    private final MarketDataService marketDataService;
    private final Leg1Executor leg1Executor;
    private final Leg2Executor leg2Executor;
    private final RollbackService rollbackService;
    private final FillWaiter fillWaiter;
    private final SymbolLockRegistry symbolLocks;
    private final CircuitBreaker circuitBreaker;
    private final TradeStorePort tradeStore;
    private final EventBusPort eventBus;
    private final ExecutionConfig executionConfig;
    private final OpportunityConfig opportunityConfig;
    private final Executor legExecutor;
    private final Clock clock;

    public ExecutionEngine(
            ExchangeRegistry exchangeRegistry,
            MarketDataService marketDataService,
            Leg1Executor leg1Executor,
            Leg2Executor leg2Executor,
            RollbackService rollbackService,
            FillWaiter fillWaiter,
            SymbolLockRegistry symbolLocks,
            CircuitBreaker circuitBreaker,
            TradeStorePort tradeStore,
            EventBusPort eventBus,
            ExecutionConfig executionConfig,
            OpportunityConfig opportunityConfig,
            @Qualifier("legExecutor") Executor legExecutor,
            Clock clock) {
        this.exchangeRegistry = exchangeRegistry;
        this.marketDataService = marketDataService;
        this.leg1Executor = leg1Executor;
        this.leg2Executor = leg2Executor;
        this.rollbackService = rollbackService;
        this.fillWaiter = fillWaiter;
        this.symbolLocks = symbolLocks;
        this.circuitBreaker = circuitBreaker;
        this.tradeStore = tradeStore;
        this.eventBus = eventBus;
        this.executionConfig = executionConfig;
        this.opportunityConfig = opportunityConfig;
        this.legExecutor = legExecutor;
        this.clock = clock;
    }

    /**
     * Executes one opportunity. Never throws for trading failures: they come back as a failed
     * result, carrying the aborted trade when one was created.
     */
    public ExecutionResult execute(Opportunity opportunity) {
        String symbol = opportunity.getSymbol();
        ReentrantLock lock = symbolLocks.lockFor(symbol);
        if (!lock.tryLock()) {
            log.info("Entry for {} skipped: another execution holds the symbol", symbol);
            return ExecutionResult.failure(new PreflightCheckException(symbol, "execution already in progress"));
        }
        try {
            return executeLocked(opportunity);
        } finally {
            lock.unlock();
        }
    }

    private ExecutionResult executeLocked(Opportunity opportunity) {
        String symbol = opportunity.getSymbol();
        Venue makerVenue = executionConfig.getMakerVenue();
        Venue hedgeVenue = makerVenue.other();

        BigDecimal qty;
        try {
            qty = preflight(opportunity, makerVenue, hedgeVenue);
        } catch (BaseException e) {
            log.info("Preflight for {} failed: {}", symbol, e.getMessage());
            return ExecutionResult.failure(e);
        }

        Side leg1Side = opportunity.getLongVenue() == makerVenue ? Side.BUY : Side.SELL;
        BigDecimal price = referencePrice(opportunity, makerVenue);
        Trade draft = Trade.builder()
                .symbol(symbol)
                .leg1(TradeLeg.builder().venue(makerVenue).side(leg1Side).qty(qty).build())
                .leg2(TradeLeg.builder().venue(hedgeVenue).side(leg1Side.inverse()).qty(qty).build())
                .targetQty(qty)
                .targetNotionalUsd(qty.multiply(price))
                .entryApy(opportunity.getApy())
                .entrySpreadPct(opportunity.getSpreadPct())
                .build();

        Trade trade;
        try {
            trade = tradeStore.createTrade(draft);
        } catch (BaseException e) {
            log.info("Trade for {} not created: {}", symbol, e.getMessage());
            return ExecutionResult.failure(e);
        }
        trade.setStatus(TradeStatus.OPENING);
        tradeStore.updateTrade(trade);
        log.info("Opening {} {} {} on {} / {} on {} (APY {}, mode {})", symbol, qty, leg1Side, makerVenue,
                leg1Side.inverse(), hedgeVenue, opportunity.getApy(), executionConfig.getMode());

        try {
            if (executionConfig.getMode() == ExecutionMode.PARALLEL) {
                runParallel(trade);
            } else {
                runSequential(trade);
            }
        } catch (BaseException e) {
            return fail(trade, e);
        } catch (RuntimeException e) {
            return fail(trade, new TradeExecutionException("Unexpected execution error: " + e.getMessage(), symbol, e));
        }
        return complete(trade);
    }

    // ========================
    // PREFLIGHT
    // ========================

    private BigDecimal preflight(Opportunity opportunity, Venue makerVenue, Venue hedgeVenue) {
        String symbol = opportunity.getSymbol();
        if (!circuitBreaker.isTradingAllowed()) {
            throw new PreflightCheckException(symbol, "circuit breaker open: " + circuitBreaker.getPauseReason());
        }
        if (tradeStore.findActiveBySymbol(symbol).isPresent()) {
            throw new PreflightCheckException(symbol, "an active trade already exists");
        }
        for (ExchangePort exchange : exchangeRegistry.all()) {
            Balance balance = exchange.getAvailableBalance();
            BigDecimal available = balance.getAvailable() != null ? balance.getAvailable() : BigDecimal.ZERO;
            if (available.compareTo(executionConfig.getMinVenueBalanceUsd()) < 0) {
                throw new InsufficientBalanceException(exchange.getVenue(), executionConfig.getMinVenueBalanceUsd(),
                        available);
            }
        }

        BigDecimal notional = opportunity.getSuggestedNotionalUsd() != null
                ? opportunity.getSuggestedNotionalUsd()
                : opportunityConfig.getDesiredNotionalUsd();
        MarketInfo makerInfo = exchangeRegistry.get(makerVenue).getMarketInfo(symbol);
        MarketInfo hedgeInfo = exchangeRegistry.get(hedgeVenue).getMarketInfo(symbol);
        BigDecimal qty = QuantitySizer.size(symbol, notional, referencePrice(opportunity, makerVenue), makerInfo,
                hedgeInfo);

        if (executionConfig.isHedgeDepthGuardEnabled()) {
            OrderbookSnapshot book = marketDataService.getFreshOrderbook(symbol, hedgeVenue);
            // the hedge leg takes the side opposite to the maker leg
            boolean hedgeBuys = opportunity.getLongVenue() == hedgeVenue;
            BigDecimal l1Qty = hedgeBuys ? book.getBestAskQty() : book.getBestBidQty();
            BigDecimal required = qty.multiply(executionConfig.getHedgeDepthMultiplier());
            if (l1Qty.compareTo(required) < 0) {
                throw new PreflightCheckException(symbol,
                        String.format("hedge L1 depth %s on %s below required %s", l1Qty, hedgeVenue, required));
            }
        }
        return qty;
    }

    private BigDecimal referencePrice(Opportunity opportunity, Venue venue) {
        BigDecimal price = opportunity.priceOn(venue);
        if (price == null || price.signum() <= 0) {
            price = marketDataService.getMarkPrice(opportunity.getSymbol(), venue);
        }
        return price;
    }

    // ========================
    // SEQUENTIAL
    // ========================

    private void runSequential(Trade trade) {
        transition(trade, ExecutionState.LEG1_SUBMITTED);
        leg1Executor.execute(trade);
        TradeLeg leg1 = trade.getLeg1();
        requireHedgeable(trade);
        clampTargetToFill(trade);
        transition(trade, ExecutionState.LEG1_FILLED);
        publishLegFilled(trade, 1, leg1);

        trade.getLeg2().setQty(leg1.getFilledQty());
        transition(trade, ExecutionState.LEG2_SUBMITTED);
        hedge(trade, leg1.getFilledQty());
    }

    // ========================
    // PARALLEL
    // ========================

    private void runParallel(Trade trade) {
        transition(trade, ExecutionState.LEG1_SUBMITTED);
        BigDecimal target = trade.getTargetQty();
        LegTask leg1Task = new LegTask("leg1", () -> leg1Executor.execute(trade));
        LegTask leg2Task = new LegTask("leg2", () -> leg2Executor.execute(trade, target));
        legExecutor.execute(leg1Task.future);
        try {
            legExecutor.execute(leg2Task.future);
        } catch (RuntimeException e) {
            leg1Task.stop(trade.getSymbol(), executionConfig.getParallelLegStopTimeout());
            throw e;
        }

        long deadline = System.nanoTime() + executionConfig.getParallelLegTimeout().toNanos();
        Throwable leg1Error = leg1Task.await(deadline, executionConfig.getParallelLegTimeout());
        Throwable leg2Error = leg2Task.await(deadline, executionConfig.getParallelLegTimeout());
        // nothing reads or unwinds a leg while its worker may still place orders
        leg1Task.stop(trade.getSymbol(), executionConfig.getParallelLegStopTimeout());
        leg2Task.stop(trade.getSymbol(), executionConfig.getParallelLegStopTimeout());

        TradeLeg leg1 = trade.getLeg1();
        TradeLeg leg2 = trade.getLeg2();
        if (leg1Error != null) {
            log.warn("Parallel leg1 for {} ended with error: {}", trade.getSymbol(), leg1Error.getMessage());
        }
        if (leg2Error != null) {
            log.warn("Parallel leg2 for {} ended with error: {}", trade.getSymbol(), leg2Error.getMessage());
        }

        if (leg1.getFilledQty().signum() > 0 && leg2.getFilledQty().signum() == 0) {
            signalBrokenHedge(trade, leg2Error != null ? leg2Error.getMessage() : "hedge leg filled nothing");
        }
        if (leg1.getFilledQty().signum() == 0 || leg2.getFilledQty().signum() == 0) {
            // one side never filled: roll back the survivor instead of chasing the loser
            Throwable cause = leg1.getFilledQty().signum() == 0 ? leg1Error : leg2Error;
            if (cause instanceof BaseException) {
                throw (BaseException) cause;
            }
            throw new TradeExecutionException(
                    String.format("Parallel entry incomplete: leg1 filled %s, leg2 filled %s", leg1.getFilledQty(),
                            leg2.getFilledQty()),
                    trade.getSymbol());
        }
        requireHedgeable(trade);
        clampTargetToFill(trade);
        transition(trade, ExecutionState.LEG1_FILLED);
        publishLegFilled(trade, 1, leg1);
        transition(trade, ExecutionState.LEG2_SUBMITTED);

        MarketInfo hedgeInfo = exchangeRegistry.get(leg2.getVenue()).getMarketInfo(trade.getSymbol());
        BigDecimal gap = leg1.getFilledQty().subtract(leg2.getFilledQty());
        if (gap.compareTo(hedgeInfo.getMinQty()) >= 0) {
            hedge(trade, gap);
        } else if (gap.negate().compareTo(hedgeInfo.getMinQty()) >= 0) {
            trimExcess(trade, leg2, gap.negate());
        }
        leg2.setQty(leg1.getFilledQty());
    }

    /** Reduces an over-filled hedge leg back to leg 1's size. */
    private void trimExcess(Trade trade, TradeLeg leg, BigDecimal excess) {
        ExchangePort exchange = exchangeRegistry.get(leg.getVenue());
        log.warn("Trimming {} excess {} on {} for {}", leg.getSide(), excess, leg.getVenue(), trade.getSymbol());
        Order placed = exchange.placeOrder(
                OrderRequest.reduceOnlyMarket(trade.getSymbol(), leg.getSide().inverse(), excess));
        Order result = fillWaiter.awaitTerminal(exchange, placed, executionConfig.getHedgeFillTimeout());
        if (!result.getStatus().isTerminal()) {
            result = fillWaiter.cancelAndFetch(exchange, result);
        }
        if (result.hasFill()) {
            leg.setFilledQty(leg.getFilledQty().subtract(result.getFilledQty()));
            leg.addFees(result.getFee());
        }
    }

    // ========================
    // SHARED STEPS
    // ========================

    private void hedge(Trade trade, BigDecimal qty) {
        try {
            leg2Executor.execute(trade, qty);
        } catch (Leg2FailedException e) {
            signalBrokenHedge(trade, e.getMessage());
            throw e;
        }
    }

    /** Leg 1 must hold at least the hedge venue minimum and the micro-fill notional. */
    private void requireHedgeable(Trade trade) {
        TradeLeg leg1 = trade.getLeg1();
        BigDecimal filled = leg1.getFilledQty();
        MarketInfo hedgeInfo = exchangeRegistry.get(trade.getLeg2().getVenue()).getMarketInfo(trade.getSymbol());
        BigDecimal price = leg1.getEntryPrice() != null ? leg1.getEntryPrice() : BigDecimal.ZERO;
        boolean tooSmall = filled.compareTo(hedgeInfo.getMinQty()) < 0
                || filled.multiply(price).compareTo(executionConfig.getMicrofillMaxUnhedgedUsd()) < 0;
        if (filled.signum() == 0 || tooSmall) {
            throw new Leg1FailedException(trade.getSymbol(), leg1.getVenue(), filled, trade.getTargetQty(),
                    "fill below hedgeable minimum");
        }
    }

    private void clampTargetToFill(Trade trade) {
        TradeLeg leg1 = trade.getLeg1();
        if (leg1.getFilledQty().compareTo(trade.getTargetQty()) < 0) {
            log.info("Leg1 for {} partially filled {} of {}, clamping target", trade.getSymbol(),
                    leg1.getFilledQty(), trade.getTargetQty());
            trade.setTargetQty(leg1.getFilledQty());
            trade.setTargetNotionalUsd(leg1.getFilledQty().multiply(leg1.getEntryPrice()));
        }
    }

    private void signalBrokenHedge(Trade trade, String reason) {
        TradeLeg leg1 = trade.getLeg1();
        log.error("BROKEN HEDGE on {}: leg1 {} live on {}, hedge failed: {}", trade.getSymbol(),
                leg1.getFilledQty(), leg1.getVenue(), reason);
        eventBus.publish(new BrokenHedgeDetectedEvent(
                this, trade.getSymbol(), trade.getId(), trade.getLeg2().getVenue(), leg1.getVenue(),
                leg1.getFilledQty()));
        eventBus.publish(new AlertEvent(this, AlertLevel.CRITICAL, trade.getSymbol(),
                String.format("Hedge failed for %s after leg1 filled %s on %s, unwinding", trade.getSymbol(),
                        leg1.getFilledQty(), leg1.getVenue()),
                "broken-hedge:" + trade.getSymbol()));
    }

    // ========================
    // OUTCOMES
    // ========================

    private ExecutionResult complete(Trade trade) {
        trade.setStatus(TradeStatus.OPEN);
        trade.setOpenedAt(clock.instant());
        transition(trade, ExecutionState.COMPLETE);
        publishLegFilled(trade, 2, trade.getLeg2());
        eventBus.publish(new TradeOpenedEvent(this, trade.copy()));
        circuitBreaker.recordSuccess();
        log.info("Trade {} OPEN: {} leg1 {} @ {} on {}, leg2 {} @ {} on {}", trade.getId(), trade.getSymbol(),
                trade.getLeg1().getFilledQty(), trade.getLeg1().getEntryPrice(), trade.getLeg1().getVenue(),
                trade.getLeg2().getFilledQty(), trade.getLeg2().getEntryPrice(), trade.getLeg2().getVenue());
        return ExecutionResult.success(trade);
    }

    private ExecutionResult fail(Trade trade, BaseException error) {
        String symbol = trade.getSymbol();
        log.error("Execution of {} (trade {}) failed in {}: {}", symbol, trade.getId(), trade.getExecutionState(),
                error.getMessage());
        if (trade.getExecutionState().canAdvanceTo(ExecutionState.ABORTED)) {
            transition(trade, ExecutionState.ABORTED);
        }

        boolean exposed = trade.getLeg1().getFilledQty().signum() > 0 || trade.getLeg2().getFilledQty().signum() > 0;
        BaseException reported = error;
        if (exposed) {
            transition(trade, ExecutionState.ROLLBACK_QUEUED);
            transition(trade, ExecutionState.ROLLBACK_IN_PROGRESS);
            TradeLeg stuck = null;
            for (TradeLeg leg : new TradeLeg[] {trade.getLeg1(), trade.getLeg2()}) {
                if (leg.getFilledQty().signum() > 0 && !rollbackService.rollbackLeg(trade, leg, error.getMessage())) {
                    stuck = leg;
                }
            }
            transition(trade, stuck == null ? ExecutionState.ROLLBACK_DONE : ExecutionState.ROLLBACK_FAILED);
            trade.setRealizedPnl(trade.getLeg1().pnl().add(trade.getLeg2().pnl()));
            if (stuck != null) {
                reported = new RollbackException(symbol, stuck.getVenue(), stuck.getFilledQty(),
                        "exposure remains after rollback", error);
            }
        }

        boolean nothingSent = trade.getLeg1().getOrderId() == null && trade.getLeg2().getOrderId() == null;
        trade.setStatus(!exposed && nothingSent ? TradeStatus.REJECTED : TradeStatus.ABORTED);
        trade.setError(error.getMessage());
        trade.setClosedAt(clock.instant());
        tradeStore.updateTrade(trade);
        circuitBreaker.recordFailure(symbol, error.getMessage());
        return ExecutionResult.failure(trade, reported);
    }

    private void transition(Trade trade, ExecutionState next) {
        ExecutionState previous = trade.getExecutionState();
        trade.advanceTo(next);
        tradeStore.updateTrade(trade);
        Map<String, Object> payload = new HashMap<>();
        payload.put("from", previous);
        payload.put("to", next);
        tradeStore.appendEvent(trade.getId(), "STATE_CHANGED", payload);
        eventBus.publish(new TradeStateChangedEvent(this, trade.getSymbol(), trade.getId(), previous, next));
        log.debug("Trade {} {} -> {}", trade.getId(), previous, next);
    }

    private void publishLegFilled(Trade trade, int legNumber, TradeLeg leg) {
        eventBus.publish(new LegFilledEvent(this, trade.getSymbol(), trade.getId(), legNumber, leg.getVenue(),
                leg.getSide(), leg.getFilledQty(), leg.getEntryPrice()));
    }

    /**
     * One leg of a parallel entry, run on the leg executor. A leg still working at the deadline is
     * interrupted and joined, so its orders stop before the other leg is reconciled or unwound.
     */
    private static final class LegTask {

        private static final int NEW = 0;
        private static final int RUNNING = 1;
        private static final int SKIPPED = 2;

        private final String name;
        private final AtomicInteger phase = new AtomicInteger(NEW);
        private final CountDownLatch exited = new CountDownLatch(1);
        private final FutureTask<Void> future;

        LegTask(String name, Runnable body) {
            this.name = name;
            this.future = new FutureTask<>(() -> {
                try {
                    if (phase.compareAndSet(NEW, RUNNING)) {
                        body.run();
                    }
                } finally {
                    exited.countDown();
                }
                return null;
            });
        }

        /** The leg's error, a timeout error, or null when it finished cleanly. */
        Throwable await(long deadlineNanos, Duration timeout) {
            try {
                future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
                return null;
            } catch (ExecutionException e) {
                return e.getCause();
            } catch (TimeoutException e) {
                return new TradeExecutionException(name + " did not finish within " + timeout, null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new TradeExecutionException("interrupted while waiting for " + name, null, e);
            }
        }

        /** Interrupts the leg if it is still working and waits for its worker to return. */
        void stop(String symbol, Duration grace) {
            if (phase.compareAndSet(NEW, SKIPPED)) {
                future.cancel(false);
                return;
            }
            if (future.isDone()) {
                return;
            }
            log.warn("Interrupting parallel {} for {}", name, symbol);
            future.cancel(true);
            boolean interrupted = Thread.interrupted();
            try {
                if (!exited.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.error("Parallel {} for {} still running {} after interrupt", name, symbol, grace);
                }
            } catch (InterruptedException e) {
                interrupted = true;
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
