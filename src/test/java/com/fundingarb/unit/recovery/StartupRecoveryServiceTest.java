package com.fundingarb.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fundingarb.adapter.InMemoryTradeStore;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.ReconciliationResult;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.DomainEvent;
import com.fundingarb.exception.ExchangeConnectionException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.reconciliation.Reconciler;
import com.fundingarb.recovery.StartupRecoveryService;
import com.fundingarb.unit.support.MutableClock;
import com.fundingarb.unit.support.TestTrades;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StartupRecoveryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private Reconciler reconciler;

    @Mock
    private EventBusPort eventBus;

    private InMemoryTradeStore store;
    private StartupRecoveryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryTradeStore(new MutableClock(NOW));
        service = new StartupRecoveryService(marketDataService, store, reconciler, eventBus);
    }

    @Test
    @DisplayName("Runs a startup reconciliation after warming market data")
    void cleanRecovery() {
        Trade opening = TestTrades.openTrade("BTC", BigDecimal.ONE, new BigDecimal("100"), NOW);
        opening.setStatus(TradeStatus.OPENING);
        store.createTrade(opening);
        ReconciliationResult result = ReconciliationResult.builder().trigger("startup").tradesChecked(1).build();
        when(reconciler.reconcile("startup", true)).thenReturn(result);

        assertThat(service.recover()).isSameAs(result);

        verify(marketDataService).refresh();
        verify(eventBus, never()).publish(any());
    }

    @Test
    @DisplayName("A failed market data warm-up does not stop reconciliation")
    void refreshFailure() {
        doThrow(new ExchangeConnectionException(Venue.X10, "down")).when(marketDataService).refresh();
        when(reconciler.reconcile("startup", true)).thenReturn(ReconciliationResult.builder().build());

        assertThat(service.recover()).isNotNull();

        verify(reconciler).reconcile("startup", true);
    }

    @Test
    @DisplayName("A reconciliation that throws raises an error alert and returns nothing")
    void reconcileThrows() {
        when(reconciler.reconcile("startup", true)).thenThrow(new IllegalStateException("store offline"));

        assertThat(service.recover()).isNull();

        ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(eventBus).publish(captor.capture());
        AlertEvent alert = (AlertEvent) captor.getValue();
        assertThat(alert.getLevel()).isEqualTo(AlertLevel.ERROR);
        assertThat(alert.getIncidentKey()).isEqualTo("startup-reconciliation");
        assertThat(alert.getMessage()).contains("store offline");
    }

    @Test
    @DisplayName("Errors inside the pass are alerted but the result is still returned")
    void resultWithErrors() {
        ReconciliationResult result = ReconciliationResult.builder()
                .trigger("startup")
                .errors(List.of("flatten BTC on LIGHTER failed"))
                .build();
        when(reconciler.reconcile("startup", true)).thenReturn(result);

        assertThat(service.recover()).isSameAs(result);

        ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(eventBus).publish(captor.capture());
        assertThat(((AlertEvent) captor.getValue()).getMessage()).contains("flatten BTC on LIGHTER failed");
    }
}
