package com.fundingarb.recovery;

import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.model.ReconciliationResult;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.port.TradeStorePort;
import com.fundingarb.reconciliation.Reconciler;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Startup sequence run by the supervisor before any loop starts.
 *
 * <ol>
 *   <li>Warm the market-data cache</li>
 *   <li>Report trades left mid-entry or mid-close by the previous process</li>
 *   <li>Reconcile with {@code startup=true}, so every OPENING trade is treated as stale</li>
 * </ol>
 *
 * <p>A failed step is logged and alerted but never blocks the loops: the scheduled
 * reconciliation retries on its own timer.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final MarketDataService marketDataService;
    private final TradeStorePort tradeStore;
    private final Reconciler reconciler;
    private final EventBusPort eventBus;

    public StartupRecoveryService(
            MarketDataService marketDataService,
            TradeStorePort tradeStore,
            Reconciler reconciler,
            EventBusPort eventBus) {
        this.marketDataService = marketDataService;
        this.tradeStore = tradeStore;
        this.reconciler = reconciler;
        this.eventBus = eventBus;
    }

    public ReconciliationResult recover() {
        log.info("Starting recovery sequence...");
        long start = System.currentTimeMillis();

        try {
            marketDataService.refresh();
        } catch (RuntimeException e) {
            log.warn("Initial market data refresh failed: {}", e.getMessage());
        }

        List<Trade> interrupted = tradeStore.listOpenTrades().stream()
                .filter(t -> t.getStatus() == TradeStatus.OPENING || t.getStatus() == TradeStatus.CLOSING)
                .toList();
        if (!interrupted.isEmpty()) {
            log.warn("Found {} trades interrupted mid-entry or mid-close", interrupted.size());
            interrupted.forEach(t -> log.warn("  {} {} status={} state={}", t.getId(), t.getSymbol(), t.getStatus(),
                    t.getExecutionState()));
        }

        ReconciliationResult result;
        try {
            result = reconciler.reconcile("startup", true);
        } catch (RuntimeException e) {
            log.error("Startup reconciliation failed", e);
            eventBus.publish(new AlertEvent(this, AlertLevel.ERROR, null,
                    "Startup reconciliation failed: " + e.getMessage(), "startup-reconciliation"));
            return null;
        }
        if (!result.getErrors().isEmpty()) {
            eventBus.publish(new AlertEvent(this, AlertLevel.ERROR, null,
                    "Startup reconciliation finished with errors: " + result.getErrors(), "startup-reconciliation"));
        }
        log.info("Recovery sequence completed in {}ms: {} findings", System.currentTimeMillis() - start,
                result.getFindings().size());
        return result;
    }
}
