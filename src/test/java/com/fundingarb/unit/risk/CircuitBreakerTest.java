package com.fundingarb.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fundingarb.config.PositionConfig;
import com.fundingarb.config.RiskConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.BrokenHedgeDetectedEvent;
import com.fundingarb.event.CircuitBreakerTrippedEvent;
import com.fundingarb.event.DomainEvent;
import com.fundingarb.port.EventBusPort;
import com.fundingarb.risk.CircuitBreaker;
import com.fundingarb.unit.support.MutableClock;
import com.fundingarb.unit.support.PaperVenues;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CircuitBreakerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private EventBusPort eventBus;

    private MutableClock clock;
    private PaperVenues venues;
    private RiskConfig riskConfig;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        venues = new PaperVenues(clock, "BTC");
        riskConfig = new RiskConfig();
        riskConfig.setMaxConsecutiveFailures(3);
        breaker = new CircuitBreaker(riskConfig, new PositionConfig(), venues.registry(), eventBus, clock);
    }

    @Nested
    @DisplayName("Consecutive failures")
    class Failures {

        @Test
        @DisplayName("Trips at the configured count and publishes a CRITICAL alert")
        void tripsAtThreshold() {
            breaker.recordFailure("BTC", "leg1 timeout");
            breaker.recordFailure("BTC", "leg1 timeout");
            assertThat(breaker.isTradingAllowed()).isTrue();

            breaker.recordFailure("BTC", "hedge rejected");

            assertThat(breaker.isTradingAllowed()).isFalse();
            assertThat(breaker.getPauseReason()).contains("3 consecutive").contains("hedge rejected");
            assertThat(breaker.getPausedUntil()).isEqualTo(NOW.plus(riskConfig.getFailureCooldown()));
            ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
            verify(eventBus, atLeastOnce()).publish(captor.capture());
            assertThat(captor.getAllValues()).hasAtLeastOneElementOfType(CircuitBreakerTrippedEvent.class);
            assertThat(captor.getAllValues())
                    .filteredOn(e -> e instanceof AlertEvent)
                    .extracting(e -> ((AlertEvent) e).getLevel())
                    .containsExactly(AlertLevel.CRITICAL);
        }

        @Test
        @DisplayName("A success resets the counter")
        void successResets() {
            breaker.recordFailure("BTC", "x");
            breaker.recordFailure("BTC", "x");
            breaker.recordSuccess();
            breaker.recordFailure("BTC", "x");

            assertThat(breaker.isTradingAllowed()).isTrue();
            assertThat(breaker.getConsecutiveFailures()).isEqualTo(1);
            verify(eventBus, never()).publish(any());
        }

        @Test
        @DisplayName("Resumes automatically once the cooldown elapses")
        void resumesAfterCooldown() {
            for (int i = 0; i < 3; i++) {
                breaker.recordFailure("BTC", "x");
            }
            clock.advance(riskConfig.getFailureCooldown().minusSeconds(1));
            assertThat(breaker.isTradingAllowed()).isFalse();

            clock.advance(Duration.ofSeconds(1));

            assertThat(breaker.isTradingAllowed()).isTrue();
            assertThat(breaker.getConsecutiveFailures()).isZero();
        }
    }

    @Nested
    @DisplayName("Drawdown")
    class Drawdown {

        @Test
        @DisplayName("Trips indefinitely at the drawdown limit and needs acknowledgement")
        void tripsUntilAcknowledged() {
            breaker.checkDrawdown(new BigDecimal("20000"));
            breaker.checkDrawdown(new BigDecimal("17000"));
            assertThat(breaker.isTradingAllowed()).isTrue();

            breaker.checkDrawdown(new BigDecimal("16000"));

            assertThat(breaker.isTradingAllowed()).isFalse();
            assertThat(breaker.getPausedUntil()).isNull();
            clock.advance(Duration.ofDays(1));
            assertThat(breaker.isTradingAllowed()).isFalse();

            breaker.acknowledge();
            assertThat(breaker.isTradingAllowed()).isTrue();
        }

        @Test
        @DisplayName("Drawdown is measured from the highest equity seen")
        void peakTracking() {
            breaker.checkDrawdown(new BigDecimal("10000"));
            breaker.checkDrawdown(new BigDecimal("12000"));
            breaker.checkDrawdown(new BigDecimal("9700"));

            assertThat(breaker.isTradingAllowed()).isTrue();

            breaker.checkDrawdown(new BigDecimal("9600"));
            assertThat(breaker.isTradingAllowed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Broken hedge")
    class BrokenHedge {

        private BrokenHedgeDetectedEvent event() {
            return new BrokenHedgeDetectedEvent(this, "BTC", "t-1", Venue.X10, Venue.LIGHTER, BigDecimal.ONE);
        }

        @Test
        @DisplayName("Stays paused after the cooldown while the symbol is still one-sided")
        void staysPausedWhileUnhedged() {
            venues.lighter().setPosition("BTC", BigDecimal.ONE, new BigDecimal("100"));
            breaker.onBrokenHedge(event());

            clock.advance(riskConfig.getBrokenHedgeCooldown());

            assertThat(breaker.isTradingAllowed()).isFalse();
        }

        @Test
        @DisplayName("Resumes after the cooldown once both venues are balanced")
        void resumesWhenBalanced() {
            venues.lighter().setPosition("BTC", BigDecimal.ONE, new BigDecimal("100"));
            breaker.onBrokenHedge(event());
            venues.x10().setPosition("BTC", BigDecimal.ONE.negate(), new BigDecimal("100"));

            clock.advance(riskConfig.getBrokenHedgeCooldown());

            assertThat(breaker.isTradingAllowed()).isTrue();
        }

        @Test
        @DisplayName("Resumes after the cooldown once the symbol is flat")
        void resumesWhenFlat() {
            breaker.onBrokenHedge(event());
            assertThat(breaker.isTradingAllowed()).isFalse();

            clock.advance(riskConfig.getBrokenHedgeCooldown());

            assertThat(breaker.isTradingAllowed()).isTrue();
        }
    }
}
