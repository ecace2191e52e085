package com.fundingarb.supervisor;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.MarketDataConfig;
import com.fundingarb.config.ReconciliationConfig;
import com.fundingarb.config.SupervisorConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.model.Balance;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.exception.BaseException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.opportunity.OpportunityEngine;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.port.ExchangePort;
import com.fundingarb.port.TradeStorePort;
import com.fundingarb.position.PositionManager;
import com.fundingarb.reconciliation.Reconciler;
import com.fundingarb.recovery.StartupRecoveryService;
import com.fundingarb.risk.CircuitBreaker;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs the background loops, each on its own thread, and restarts a loop after an unhandled
 * failure with exponential backoff.
 *
 * <p>Loops: {@code market-data}, {@code opportunity-scan}, {@code position-management},
 * {@code reconciliation} and {@code heartbeat}. Startup recovery runs before any loop starts.
 *
 * <p>{@link #stop()} stops restarts and interrupts the loops. Rollbacks clear the interrupt flag
 * for their own duration, so compensations in flight still finish before the thread exits.
 */
@Component
public class Supervisor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    private final MarketDataService marketDataService;
    private final OpportunityEngine opportunityEngine;
    private final PositionManager positionManager;
    private final Reconciler reconciler;
    private final StartupRecoveryService startupRecoveryService;
    private final CircuitBreaker circuitBreaker;
    private final ExchangeRegistry exchangeRegistry;
    private final TradeStorePort tradeStore;
    private final EventBusPort eventBus;
    private final SupervisorConfig config;
    private final MarketDataConfig marketDataConfig;
    private final ReconciliationConfig reconciliationConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<SupervisedLoop> loops = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();

    public Supervisor(
            MarketDataService marketDataService,
            OpportunityEngine opportunityEngine,
            PositionManager positionManager,
            Reconciler reconciler,
            StartupRecoveryService startupRecoveryService,
            CircuitBreaker circuitBreaker,
            ExchangeRegistry exchangeRegistry,
            TradeStorePort tradeStore,
            EventBusPort eventBus,
            SupervisorConfig config,
            MarketDataConfig marketDataConfig,
            ReconciliationConfig reconciliationConfig) {
        this.marketDataService = marketDataService;
        this.opportunityEngine = opportunityEngine;
        this.positionManager = positionManager;
        this.reconciler = reconciler;
        this.startupRecoveryService = startupRecoveryService;
        this.circuitBreaker = circuitBreaker;
        this.exchangeRegistry = exchangeRegistry;
        this.tradeStore = tradeStore;
        this.eventBus = eventBus;
        this.config = config;
        this.marketDataConfig = marketDataConfig;
        this.reconciliationConfig = reconciliationConfig;
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        if (!config.isTradingEnabled()) {
            log.warn("Trading disabled (funding.supervisor.trading-enabled=false), loops not started");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        startupRecoveryService.recover();

        loops.add(new SupervisedLoop("market-data", marketDataConfig.getRefreshInterval(), marketDataService::refresh));
        loops.add(new SupervisedLoop("opportunity-scan", config.getOpportunityScanInterval(),
                opportunityEngine::scanAndExecute));
        loops.add(new SupervisedLoop("position-management", config.getPositionCheckInterval(),
                positionManager::checkAll));
        loops.add(new SupervisedLoop("reconciliation", reconciliationConfig.getInterval(), reconciler::reconcile));
        loops.add(new SupervisedLoop("heartbeat", config.getHeartbeatInterval(), this::heartbeat));

        for (SupervisedLoop loop : loops) {
            Thread thread = new Thread(() -> runLoop(loop), loop.getName());
            thread.setDaemon(true);
            threads.add(thread);
            thread.start();
        }
        log.info("Supervisor started {} loops", loops.size());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Supervisor stopping, waiting up to {} for loops", config.getShutdownTimeout());
        threads.forEach(Thread::interrupt);
        long deadline = System.currentTimeMillis() + config.getShutdownTimeout().toMillis();
        for (Thread thread : threads) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            try {
                thread.join(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        threads.stream().filter(Thread::isAlive).forEach(t -> log.warn("Loop {} still running at shutdown", t.getName()));
        threads.clear();
        loops.clear();
        log.info("Supervisor stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // stop before the executors the loops rely on
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    // ========================
    // LOOPS
    // ========================

    private void runLoop(SupervisedLoop loop) {
        log.info("Loop {} started", loop.getName());
        while (running.get()) {
            boolean ok = runOnce(loop);
            if (!running.get()) {
                break;
            }
            Duration pause = ok ? loop.getInterval() : computeBackoff(loop.getFailures(), config.getInitialBackoff(),
                    config.getMaxBackoff());
            if (!ok) {
                log.warn("Restarting loop {} in {} (failure #{})", loop.getName(), pause, loop.getFailures());
            }
            if (!sleep(pause)) {
                break;
            }
        }
        log.info("Loop {} exited", loop.getName());
    }

    /**
     * Runs one iteration. A failure increments the loop's failure count and raises an ERROR alert;
     * a success resets the count so the next failure starts again from the initial backoff.
     *
     * @return whether the iteration completed
     */
    public boolean runOnce(SupervisedLoop loop) {
        try {
            loop.getBody().run();
            loop.resetFailures();
            return true;
        } catch (RuntimeException e) {
            int failures = loop.recordFailure();
            log.error("Loop {} failed (#{}): {}", loop.getName(), failures, e.getMessage(), e);
            eventBus.publish(new AlertEvent(this, AlertLevel.ERROR, null,
                    String.format("Loop %s failed (#%d): %s", loop.getName(), failures, e.getMessage()),
                    "loop-restart:" + loop.getName()));
            return false;
        }
    }

    /** {@code min(max, initial * 2^(n-1))} for the n-th consecutive failure. */
    public static Duration computeBackoff(int failures, Duration initial, Duration max) {
        if (failures <= 1) {
            return initial.compareTo(max) > 0 ? max : initial;
        }
        int shift = Math.min(failures - 1, 30);
        long millis = initial.toMillis() * (1L << shift);
        if (millis <= 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }

    void heartbeat() {
        BigDecimal equity = BigDecimal.ZERO;
        boolean complete = true;
        for (ExchangePort exchange : exchangeRegistry.all()) {
            try {
                Balance balance = exchange.getAvailableBalance();
                equity = equity.add(balance.getTotal() != null ? balance.getTotal() : balance.getAvailable());
            } catch (BaseException e) {
                complete = false;
                log.warn("Heartbeat: balance on {} unavailable: {}", exchange.getVenue(), e.getMessage());
            }
        }
        // a partial sum would read as a drawdown
        if (complete) {
            circuitBreaker.checkDrawdown(equity);
        }
        circuitBreaker.maybeResume();
        log.info("Heartbeat: equity={}, openTrades={}, tradingAllowed={}, marketDataHealthy={}", equity,
                tradeStore.listOpenTrades().size(), circuitBreaker.isTradingAllowed(), marketDataService.isHealthy());
    }

    List<SupervisedLoop> getLoops() {
        return loops;
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
