package com.fundingarb.observability;

import com.fundingarb.event.BrokenHedgeDetectedEvent;
import com.fundingarb.event.CircuitBreakerTrippedEvent;
import com.fundingarb.event.PositionReconciledEvent;
import com.fundingarb.event.RollbackCompletedEvent;
import com.fundingarb.event.TradeClosedEvent;
import com.fundingarb.event.TradeOpenedEvent;
import com.fundingarb.port.TradeStorePort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters driven by domain events.
 *
 * <ul>
 *   <li><b>trades.opened</b>, <b>trades.closed</b> (counters)</li>
 *   <li><b>trades.rollbacks</b> (counter, tagged {@code result=success|failure})</li>
 *   <li><b>reconciliation.actions</b> (counter, tagged with the action code)</li>
 *   <li><b>circuit.breaker.trips</b>, <b>broken.hedges</b> (counters)</li>
 *   <li><b>trades.open</b> (gauge): trades not yet terminal</li>
 * </ul>
 */
@Service
public class TradingMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter tradesOpened;
    private final Counter tradesClosed;
    private final Counter circuitBreakerTrips;
    private final Counter brokenHedges;

    public TradingMetrics(MeterRegistry meterRegistry, TradeStorePort tradeStore) {
        this.meterRegistry = meterRegistry;
        this.tradesOpened = Counter.builder("trades.opened")
                .description("Hedged trades fully opened")
                .register(meterRegistry);
        this.tradesClosed = Counter.builder("trades.closed")
                .description("Hedged trades closed")
                .register(meterRegistry);
        this.circuitBreakerTrips = Counter.builder("circuit.breaker.trips")
                .description("Times new entries were paused")
                .register(meterRegistry);
        this.brokenHedges = Counter.builder("broken.hedges")
                .description("Confirmed broken hedges")
                .register(meterRegistry);

        meterRegistry.gauge("trades.open", tradeStore, store -> store.listOpenTrades().size());
    }

    @EventListener
    public void onTradeOpened(TradeOpenedEvent event) {
        tradesOpened.increment();
    }

    @EventListener
    public void onTradeClosed(TradeClosedEvent event) {
        tradesClosed.increment();
    }

    @EventListener
    public void onRollbackCompleted(RollbackCompletedEvent event) {
        meterRegistry.counter("trades.rollbacks", "result", event.isSuccess() ? "success" : "failure").increment();
    }

    @EventListener
    public void onPositionReconciled(PositionReconciledEvent event) {
        meterRegistry.counter("reconciliation.actions", "action", event.getAction().getCode()).increment();
    }

    @EventListener
    public void onCircuitBreakerTripped(CircuitBreakerTrippedEvent event) {
        circuitBreakerTrips.increment();
    }

    @EventListener
    public void onBrokenHedge(BrokenHedgeDetectedEvent event) {
        brokenHedges.increment();
    }
}
