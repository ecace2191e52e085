package com.fundingarb.risk;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.PositionConfig;
import com.fundingarb.config.RiskConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.model.Position;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.BrokenHedgeDetectedEvent;
import com.fundingarb.event.CircuitBreakerTrippedEvent;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.port.ExchangePort;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Global pause for new entries.
 *
 * <p>Trips on:
 * <ul>
 *   <li>consecutive execution failures: paused for {@code failure-cooldown}</li>
 *   <li>equity drawdown from the observed peak: paused until acknowledged</li>
 *   <li>a broken hedge: paused for {@code broken-hedge-cooldown}, then only resumed once the
 *       affected symbol is verified flat or balanced on both venues</li>
 * </ul>
 *
 * <p>Only entries are gated. Position management and closing never consult the breaker.
 * All state is guarded by one lock.
 */
@Service
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final RiskConfig riskConfig;
    private final PositionConfig positionConfig;
    private final ExchangeRegistry exchangeRegistry;
    private final EventBusPort eventBus;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    private int consecutiveFailures;
    private boolean paused;
    private String pauseReason;
    /** Null while paused means the pause lasts until acknowledged. */
    private Instant pausedUntil;
    /** Symbol that must be verified hedged before an automatic resume. */
    private String pendingVerificationSymbol;
    private BigDecimal peakEquity;

    public CircuitBreaker(
            RiskConfig riskConfig,
            PositionConfig positionConfig,
            ExchangeRegistry exchangeRegistry,
            EventBusPort eventBus,
            Clock clock) {
        this.riskConfig = riskConfig;
        this.positionConfig = positionConfig;
        this.exchangeRegistry = exchangeRegistry;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    // ========================
    // QUERIES
    // ========================

    /** True when new entries may be opened. Resumes an expired pause as a side effect. */
    public boolean isTradingAllowed() {
        maybeResume();
        lock.lock();
        try {
            return !paused;
        } finally {
            lock.unlock();
        }
    }

    public String getPauseReason() {
        lock.lock();
        try {
            return paused ? pauseReason : null;
        } finally {
            lock.unlock();
        }
    }

    public Instant getPausedUntil() {
        lock.lock();
        try {
            return pausedUntil;
        } finally {
            lock.unlock();
        }
    }

    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // TRIGGERS
    // ========================

    public void recordSuccess() {
        lock.lock();
        try {
            consecutiveFailures = 0;
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure(String symbol, String reason) {
        lock.lock();
        try {
            consecutiveFailures++;
            log.warn("Execution failure {}/{} on {}: {}", consecutiveFailures, riskConfig.getMaxConsecutiveFailures(),
                    symbol, reason);
            if (consecutiveFailures < riskConfig.getMaxConsecutiveFailures() || paused) {
                return;
            }
            trip(symbol,
                    String.format("%d consecutive execution failures, last: %s", consecutiveFailures, reason),
                    clock.instant().plus(riskConfig.getFailureCooldown()),
                    null,
                    "circuit-breaker:failures");
        } finally {
            lock.unlock();
        }
    }

    /** Tracks peak equity and trips indefinitely when the drawdown reaches the configured limit. */
    public void checkDrawdown(BigDecimal equity) {
        if (equity == null || equity.signum() <= 0) {
            return;
        }
        lock.lock();
        try {
            if (peakEquity == null || equity.compareTo(peakEquity) > 0) {
                peakEquity = equity;
                return;
            }
            BigDecimal drawdown = peakEquity.subtract(equity).divide(peakEquity, MathContext.DECIMAL64);
            if (drawdown.compareTo(riskConfig.getMaxDrawdownPct()) >= 0 && !paused) {
                trip(null,
                        String.format("Equity drawdown %s from peak %s to %s", drawdown, peakEquity, equity),
                        null,
                        null,
                        "circuit-breaker:drawdown");
            }
        } finally {
            lock.unlock();
        }
    }

    @EventListener
    public void onBrokenHedge(BrokenHedgeDetectedEvent event) {
        lock.lock();
        try {
            Instant until = clock.instant().plus(riskConfig.getBrokenHedgeCooldown());
            if (paused && pausedUntil == null) {
                // already paused until acknowledged, only remember what to verify
                pendingVerificationSymbol = event.getSymbol();
                return;
            }
            trip(event.getSymbol(),
                    String.format("Broken hedge on %s: %s leg missing", event.getSymbol(), event.getMissingVenue()),
                    until,
                    event.getSymbol(),
                    "circuit-breaker:broken-hedge:" + event.getSymbol());
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // RESUME
    // ========================

    /** Manual acknowledgement: clears every pause and the failure counter. */
    public void acknowledge() {
        lock.lock();
        try {
            if (paused) {
                log.info("Circuit breaker acknowledged, trading resumed (was: {})", pauseReason);
            }
            reset();
            consecutiveFailures = 0;
        } finally {
            lock.unlock();
        }
    }

    /** Resumes an expired timed pause, after verifying any broken-hedge symbol. */
    public void maybeResume() {
        String symbolToVerify;
        lock.lock();
        try {
            if (!paused || pausedUntil == null || clock.instant().isBefore(pausedUntil)) {
                return;
            }
            symbolToVerify = pendingVerificationSymbol;
        } finally {
            lock.unlock();
        }

        // venue reads happen outside the lock
        if (symbolToVerify != null && !isHedgedOrFlat(symbolToVerify)) {
            log.warn("Circuit breaker cooldown elapsed but {} is still unhedged, staying paused", symbolToVerify);
            return;
        }

        lock.lock();
        try {
            if (paused && pausedUntil != null && !clock.instant().isBefore(pausedUntil)) {
                log.info("Circuit breaker cooldown elapsed, trading resumed (was: {})", pauseReason);
                reset();
                consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // INTERNALS
    // ========================

    private void trip(String symbol, String reason, Instant until, String verifySymbol, String incidentKey) {
        paused = true;
        pauseReason = reason;
        pausedUntil = until;
        if (verifySymbol != null) {
            pendingVerificationSymbol = verifySymbol;
        }
        log.error("CIRCUIT BREAKER TRIPPED: {} (resume after {})", reason, until != null ? until : "acknowledgement");
        eventBus.publish(new CircuitBreakerTrippedEvent(this, symbol, reason, until));
        eventBus.publish(new AlertEvent(this, AlertLevel.CRITICAL, symbol, "Circuit breaker tripped: " + reason,
                incidentKey));
    }

    private void reset() {
        paused = false;
        pauseReason = null;
        pausedUntil = null;
        pendingVerificationSymbol = null;
    }

    /** Net signed quantity across both venues within the position threshold. */
    private boolean isHedgedOrFlat(String symbol) {
        BigDecimal net = BigDecimal.ZERO;
        BigDecimal gross = BigDecimal.ZERO;
        for (ExchangePort exchange : exchangeRegistry.all()) {
            try {
                BigDecimal signed = exchange.getPosition(symbol).map(Position::signedQty).orElse(BigDecimal.ZERO);
                net = net.add(signed);
                gross = gross.max(signed.abs());
            } catch (RuntimeException e) {
                log.warn("Could not verify {} on {}: {}", symbol, exchange.getVenue(), e.getMessage());
                return false;
            }
        }
        if (gross.compareTo(positionConfig.getPositionQtyThreshold()) <= 0) {
            return true;
        }
        BigDecimal imbalance = net.abs().divide(gross, MathContext.DECIMAL64);
        return imbalance.compareTo(positionConfig.getRebalanceMinDelta()) <= 0;
    }
}
