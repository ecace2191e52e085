package com.fundingarb.api.controller;

import com.fundingarb.api.dto.request.CloseTradeRequest;
import com.fundingarb.api.dto.response.ApiResponse;
import com.fundingarb.api.dto.response.EngineStatusResponse;
import com.fundingarb.domain.model.CloseResult;
import com.fundingarb.domain.model.Opportunity;
import com.fundingarb.domain.model.ReconciliationResult;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeEventRecord;
import com.fundingarb.exception.TradeNotFoundException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.opportunity.OpportunityEngine;
import com.fundingarb.port.TradeStorePort;
import com.fundingarb.position.PositionManager;
import com.fundingarb.reconciliation.Reconciler;
import com.fundingarb.risk.CircuitBreaker;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints.
 *
 * <ul>
 *   <li>GET /api/trades -- trades not yet terminal</li>
 *   <li>GET /api/trades/{id} -- one trade</li>
 *   <li>GET /api/trades/{id}/events -- the trade's event journal</li>
 *   <li>POST /api/trades/{id}/close -- manual close</li>
 *   <li>GET /api/status -- pause state, market data health, stats</li>
 *   <li>POST /api/trading/resume -- acknowledge a pause and resume entries</li>
 *   <li>GET /api/opportunities -- latest scan</li>
 *   <li>POST /api/reconciliation/run -- manual reconciliation pass</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class TradingController {

    private static final Logger log = LoggerFactory.getLogger(TradingController.class);

    private final TradeStorePort tradeStore;
    private final PositionManager positionManager;
    private final CircuitBreaker circuitBreaker;
    private final MarketDataService marketDataService;
    private final OpportunityEngine opportunityEngine;
    private final Reconciler reconciler;
    private final Clock clock;

    public TradingController(
            TradeStorePort tradeStore,
            PositionManager positionManager,
            CircuitBreaker circuitBreaker,
            MarketDataService marketDataService,
            OpportunityEngine opportunityEngine,
            Reconciler reconciler,
            Clock clock) {
        this.tradeStore = tradeStore;
        this.positionManager = positionManager;
        this.circuitBreaker = circuitBreaker;
        this.marketDataService = marketDataService;
        this.opportunityEngine = opportunityEngine;
        this.reconciler = reconciler;
        this.clock = clock;
    }

    @GetMapping("/trades")
    public ResponseEntity<ApiResponse<List<Trade>>> getOpenTrades() {
        return ResponseEntity.ok(ApiResponse.of(tradeStore.listOpenTrades(), clock));
    }

    @GetMapping("/trades/{id}")
    public ResponseEntity<ApiResponse<Trade>> getTrade(@PathVariable String id) {
        Trade trade = tradeStore.getTrade(id).orElseThrow(() -> new TradeNotFoundException(id));
        return ResponseEntity.ok(ApiResponse.of(trade, clock));
    }

    @GetMapping("/trades/{id}/events")
    public ResponseEntity<ApiResponse<List<TradeEventRecord>>> getTradeEvents(@PathVariable String id) {
        tradeStore.getTrade(id).orElseThrow(() -> new TradeNotFoundException(id));
        return ResponseEntity.ok(ApiResponse.of(tradeStore.getEvents(id), clock));
    }

    @PostMapping("/trades/{id}/close")
    public ResponseEntity<ApiResponse<CloseResult>> closeTrade(
            @PathVariable String id, @RequestBody(required = false) CloseTradeRequest request) {
        String reason = request != null && request.getReason() != null ? request.getReason() : "MANUAL";
        boolean emergency = request != null && request.isEmergency();
        log.info("Manual close requested for {}: reason={}, emergency={}", id, reason, emergency);
        return ResponseEntity.ok(ApiResponse.of(positionManager.closeTrade(id, reason, emergency), clock));
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<EngineStatusResponse>> getStatus() {
        Map<String, Instant> refresh = new LinkedHashMap<>();
        marketDataService.getLastSuccessfulRefresh().forEach((venue, at) -> refresh.put(venue.name(), at));
        EngineStatusResponse status = EngineStatusResponse.builder()
                .tradingAllowed(circuitBreaker.isTradingAllowed())
                .pauseReason(circuitBreaker.getPauseReason())
                .pausedUntil(circuitBreaker.getPausedUntil())
                .consecutiveFailures(circuitBreaker.getConsecutiveFailures())
                .marketDataHealthy(marketDataService.isHealthy())
                .lastMarketDataRefresh(refresh)
                .openTrades(tradeStore.listOpenTrades().size())
                .stats(tradeStore.getStats())
                .build();
        return ResponseEntity.ok(ApiResponse.of(status, clock));
    }

    @PostMapping("/trading/resume")
    public ResponseEntity<ApiResponse<EngineStatusResponse>> resumeTrading() {
        log.warn("Trading pause acknowledged via API");
        circuitBreaker.acknowledge();
        return getStatus();
    }

    @GetMapping("/opportunities")
    public ResponseEntity<ApiResponse<List<Opportunity>>> getOpportunities() {
        return ResponseEntity.ok(ApiResponse.of(opportunityEngine.getLastScan(), clock));
    }

    @PostMapping("/reconciliation/run")
    public ResponseEntity<ApiResponse<ReconciliationResult>> runReconciliation() {
        return ResponseEntity.ok(ApiResponse.of(reconciler.reconcile("manual", false), clock));
    }
}
