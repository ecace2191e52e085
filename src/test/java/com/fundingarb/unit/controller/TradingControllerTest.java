package com.fundingarb.unit.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fundingarb.adapter.InMemoryTradeStore;
import com.fundingarb.api.controller.TradingController;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.CloseResult;
import com.fundingarb.domain.model.Opportunity;
import com.fundingarb.domain.model.ReconciliationResult;
import com.fundingarb.exception.GlobalExceptionHandler;
import com.fundingarb.exception.PreflightCheckException;
import com.fundingarb.exception.RollbackException;
import com.fundingarb.exception.TradeNotFoundException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.opportunity.OpportunityEngine;
import com.fundingarb.position.PositionManager;
import com.fundingarb.reconciliation.Reconciler;
import com.fundingarb.risk.CircuitBreaker;
import com.fundingarb.unit.support.MutableClock;
import com.fundingarb.unit.support.TestTrades;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for TradingController.
 *
 * <p>Verifies: trade queries against the store, manual close delegation with and without a body,
 * status assembly, resume, opportunities, reconciliation and error mapping.
 */
class TradingControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MockMvc mockMvc;
    private InMemoryTradeStore tradeStore;

    @Mock
    private PositionManager positionManager;

    @Mock
    private CircuitBreaker circuitBreaker;

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private OpportunityEngine opportunityEngine;

    @Mock
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        MutableClock clock = new MutableClock(NOW);
        tradeStore = new InMemoryTradeStore(clock);
        TradingController controller = new TradingController(
                tradeStore, positionManager, circuitBreaker, marketDataService, opportunityEngine, reconciler, clock);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getOpenTrades_returnsStoredTrades() throws Exception {
        tradeStore.createTrade(TestTrades.openTrade("BTC", BigDecimal.ONE, new BigDecimal("100"), NOW));

        mockMvc.perform(get("/api/trades"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.asOf").value("2026-03-01T12:00:00Z"))
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].symbol").value("BTC"))
                .andExpect(jsonPath("$.data[0].status").value("OPEN"));
    }

    @Test
    void getTrade_unknown_returns404() throws Exception {
        mockMvc.perform(get("/api/trades/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("TRADE_NOT_FOUND"))
                .andExpect(jsonPath("$.error.details.tradeId").value("missing"))
                .andExpect(jsonPath("$.error.details.retryable").value(false))
                .andExpect(jsonPath("$.error.path").value("/api/trades/missing"));
    }

    @Test
    void getTradeEvents_returnsJournal() throws Exception {
        tradeStore.createTrade(TestTrades.openTrade("BTC", BigDecimal.ONE, new BigDecimal("100"), NOW));
        tradeStore.appendEvent("trade-BTC", "OPENED", Map.of("qty", "1"));

        mockMvc.perform(get("/api/trades/trade-BTC/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].eventType").value("OPENED"));
    }

    @Test
    void closeTrade_withBody_passesReasonAndEmergency() throws Exception {
        when(positionManager.closeTrade("trade-BTC", "OPERATOR", true))
                .thenReturn(CloseResult.builder().tradeId("trade-BTC").success(true).reason("OPERATOR").build());

        mockMvc.perform(post("/api/trades/trade-BTC/close")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"reason":"OPERATOR","emergency":true}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.tradeId").value("trade-BTC"));

        verify(positionManager).closeTrade("trade-BTC", "OPERATOR", true);
    }

    @Test
    void closeTrade_withoutBody_defaultsToManual() throws Exception {
        when(positionManager.closeTrade("trade-BTC", "MANUAL", false))
                .thenReturn(CloseResult.builder().tradeId("trade-BTC").success(true).reason("MANUAL").build());

        mockMvc.perform(post("/api/trades/trade-BTC/close"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.reason").value("MANUAL"));

        verify(positionManager).closeTrade("trade-BTC", "MANUAL", false);
    }

    @Test
    void closeTrade_unknown_returns404() throws Exception {
        when(positionManager.closeTrade("nope", "MANUAL", false))
                .thenThrow(new TradeNotFoundException("nope"));

        mockMvc.perform(post("/api/trades/nope/close"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("TRADE_NOT_FOUND"));
    }

    @Test
    void closeTrade_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/api/trades/trade-BTC/close")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void closeTrade_failedRollback_flagsManualIntervention() throws Exception {
        when(positionManager.closeTrade("trade-BTC", "MANUAL", false))
                .thenThrow(new RollbackException(
                        "BTC", Venue.X10, new BigDecimal("0.4"), "reduce-only rejected", null));

        mockMvc.perform(post("/api/trades/trade-BTC/close"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("ROLLBACK_FAILED"))
                .andExpect(jsonPath("$.error.details.manualInterventionRequired").value(true))
                .andExpect(jsonPath("$.error.details.symbol").value("BTC"))
                .andExpect(jsonPath("$.error.details.venue").value("X10"));
    }

    @Test
    void closeTrade_executionFailure_carriesSymbolAndRetryable() throws Exception {
        when(positionManager.closeTrade("trade-BTC", "MANUAL", false))
                .thenThrow(new PreflightCheckException("BTC", "execution already in progress"));

        mockMvc.perform(post("/api/trades/trade-BTC/close"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("PREFLIGHT_FAILED"))
                .andExpect(jsonPath("$.error.details.symbol").value("BTC"))
                .andExpect(jsonPath("$.error.details.retryable").value(false));
    }

    @Test
    void getStatus_assemblesBreakerMarketDataAndStats() throws Exception {
        tradeStore.createTrade(TestTrades.openTrade("BTC", BigDecimal.ONE, new BigDecimal("100"), NOW));
        when(circuitBreaker.isTradingAllowed()).thenReturn(false);
        when(circuitBreaker.getPauseReason()).thenReturn("drawdown");
        when(circuitBreaker.getConsecutiveFailures()).thenReturn(2);
        when(marketDataService.isHealthy()).thenReturn(true);
        when(marketDataService.getLastSuccessfulRefresh()).thenReturn(Map.of(Venue.LIGHTER, NOW));

        mockMvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tradingAllowed").value(false))
                .andExpect(jsonPath("$.data.pauseReason").value("drawdown"))
                .andExpect(jsonPath("$.data.consecutiveFailures").value(2))
                .andExpect(jsonPath("$.data.marketDataHealthy").value(true))
                .andExpect(jsonPath("$.data.openTrades").value(1));
    }

    @Test
    void resumeTrading_acknowledgesPause() throws Exception {
        when(circuitBreaker.isTradingAllowed()).thenReturn(true);
        when(marketDataService.getLastSuccessfulRefresh()).thenReturn(Map.of());

        mockMvc.perform(post("/api/trading/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tradingAllowed").value(true));

        verify(circuitBreaker).acknowledge();
    }

    @Test
    void getOpportunities_returnsLastScan() throws Exception {
        when(opportunityEngine.getLastScan()).thenReturn(List.of(Opportunity.builder()
                .symbol("ETH")
                .apy(new BigDecimal("0.42"))
                .longVenue(Venue.LIGHTER)
                .shortVenue(Venue.X10)
                .build()));

        mockMvc.perform(get("/api/opportunities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].symbol").value("ETH"))
                .andExpect(jsonPath("$.data[0].longVenue").value("LIGHTER"));
    }

    @Test
    void runReconciliation_runsManualPass() throws Exception {
        when(reconciler.reconcile("manual", false))
                .thenReturn(ReconciliationResult.builder().trigger("manual").tradesChecked(3).build());

        mockMvc.perform(post("/api/reconciliation/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.trigger").value("manual"))
                .andExpect(jsonPath("$.data.tradesChecked").value(3));

        verify(reconciler).reconcile("manual", false);
    }
}
