package com.fundingarb.unit.supervisor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fundingarb.config.MarketDataConfig;
import com.fundingarb.config.ReconciliationConfig;
import com.fundingarb.config.SupervisorConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.DomainEvent;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.opportunity.OpportunityEngine;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.port.TradeStorePort;
import com.fundingarb.position.PositionManager;
import com.fundingarb.reconciliation.Reconciler;
import com.fundingarb.recovery.StartupRecoveryService;
import com.fundingarb.risk.CircuitBreaker;
import com.fundingarb.supervisor.SupervisedLoop;
import com.fundingarb.supervisor.Supervisor;
import com.fundingarb.unit.support.PaperVenues;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SupervisorTest {

    @Nested
    @DisplayName("Restart backoff")
    class Backoff {

        private final Duration initial = Duration.ofSeconds(2);
        private final Duration max = Duration.ofSeconds(60);

        @Test
        @DisplayName("Doubles per consecutive failure starting from the initial delay")
        void doubles() {
            assertThat(Supervisor.computeBackoff(1, initial, max)).isEqualTo(Duration.ofSeconds(2));
            assertThat(Supervisor.computeBackoff(2, initial, max)).isEqualTo(Duration.ofSeconds(4));
            assertThat(Supervisor.computeBackoff(3, initial, max)).isEqualTo(Duration.ofSeconds(8));
            assertThat(Supervisor.computeBackoff(5, initial, max)).isEqualTo(Duration.ofSeconds(32));
        }

        @Test
        @DisplayName("Caps at the maximum delay")
        void capped() {
            assertThat(Supervisor.computeBackoff(6, initial, max)).isEqualTo(max);
            assertThat(Supervisor.computeBackoff(100, initial, max)).isEqualTo(max);
        }
    }

    @Nested
    @DisplayName("Loop iterations")
    class Iterations {

        @Mock
        private MarketDataService marketDataService;

        @Mock
        private OpportunityEngine opportunityEngine;

        @Mock
        private PositionManager positionManager;

        @Mock
        private Reconciler reconciler;

        @Mock
        private StartupRecoveryService startupRecoveryService;

        @Mock
        private CircuitBreaker circuitBreaker;

        @Mock
        private TradeStorePort tradeStore;

        @Mock
        private EventBusPort eventBus;

        private Supervisor supervisor;

        @BeforeEach
        void setUp() {
            supervisor = new Supervisor(marketDataService, opportunityEngine, positionManager, reconciler,
                    startupRecoveryService, circuitBreaker, new PaperVenues(Clock.systemUTC()).registry(), tradeStore,
                    eventBus, new SupervisorConfig(), new MarketDataConfig(), new ReconciliationConfig());
        }

        @Test
        @DisplayName("A failing iteration counts the failure and raises an ERROR alert")
        void failureAlerts() {
            SupervisedLoop loop = new SupervisedLoop("market-data", Duration.ofSeconds(1), () -> {
                throw new IllegalStateException("boom");
            });

            assertThat(supervisor.runOnce(loop)).isFalse();
            assertThat(supervisor.runOnce(loop)).isFalse();

            assertThat(loop.getFailures()).isEqualTo(2);
            ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
            verify(eventBus, times(2)).publish(captor.capture());
            AlertEvent alert = (AlertEvent) captor.getValue();
            assertThat(alert.getLevel()).isEqualTo(AlertLevel.ERROR);
            assertThat(alert.getIncidentKey()).isEqualTo("loop-restart:market-data");
            assertThat(alert.getMessage()).contains("#2").contains("boom");
        }

        @Test
        @DisplayName("A successful iteration resets the failure count")
        void successResets() {
            AtomicInteger calls = new AtomicInteger();
            SupervisedLoop loop = new SupervisedLoop("heartbeat", Duration.ofSeconds(1), () -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("first call fails");
                }
            });

            supervisor.runOnce(loop);
            assertThat(loop.getFailures()).isEqualTo(1);

            assertThat(supervisor.runOnce(loop)).isTrue();
            assertThat(loop.getFailures()).isZero();
        }

        @Test
        @DisplayName("A clean iteration publishes nothing")
        void cleanIterationQuiet() {
            SupervisedLoop loop = new SupervisedLoop("opportunity-scan", Duration.ofSeconds(1), () -> { });

            assertThat(supervisor.runOnce(loop)).isTrue();
            verify(eventBus, never()).publish(any());
        }
    }
}
