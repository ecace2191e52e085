package com.fundingarb.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fundingarb.config.RiskConfig;
import com.fundingarb.domain.enums.AlertLevel;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.event.AlertEvent;
import com.fundingarb.event.TradeClosedEvent;
import com.fundingarb.event.TradeOpenedEvent;
import com.fundingarb.notification.NotificationService;
import com.fundingarb.notification.TelegramConfig;
import com.fundingarb.notification.TelegramNotifier;
import com.fundingarb.port.NotificationPort;
import com.fundingarb.unit.support.MutableClock;
import com.fundingarb.unit.support.TestTrades;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private NotificationPort notificationPort;

    private MutableClock clock;
    private NotificationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        service = new NotificationService(notificationPort, new RiskConfig(), clock);
    }

    private AlertEvent alert(AlertLevel level, String message, String key) {
        return new AlertEvent(this, level, "BTC", message, key);
    }

    @Nested
    @DisplayName("Alerts")
    class Alerts {

        @Test
        @DisplayName("INFO alerts are only logged")
        void infoLoggedOnly() {
            boolean sent = service.handleAlert(alert(AlertLevel.INFO, "scan done", "scan"));

            assertThat(sent).isFalse();
            verifyNoInteractions(notificationPort);
        }

        @Test
        @DisplayName("Warnings are sent with their level")
        void warningSent() {
            boolean sent = service.handleAlert(alert(AlertLevel.WARNING, "qty mismatch", "mismatch:1"));

            assertThat(sent).isTrue();
            verify(notificationPort).sendMessage("WARNING: qty mismatch");
        }

        @Test
        @DisplayName("Repeats of an incident are suppressed until the throttle expires")
        void throttled() {
            service.handleAlert(alert(AlertLevel.ERROR, "loop failed", "loop:md"));
            assertThat(service.handleAlert(alert(AlertLevel.ERROR, "loop failed again", "loop:md"))).isFalse();

            clock.advance(Duration.ofMinutes(5));
            assertThat(service.handleAlert(alert(AlertLevel.ERROR, "still failing", "loop:md"))).isTrue();

            verify(notificationPort, times(2)).sendMessage(anyString());
        }

        @Test
        @DisplayName("Different incidents are throttled independently")
        void independentIncidents() {
            assertThat(service.handleAlert(alert(AlertLevel.CRITICAL, "broken hedge", "hedge:BTC"))).isTrue();
            assertThat(service.handleAlert(alert(AlertLevel.CRITICAL, "broken hedge", "hedge:ETH"))).isTrue();
        }

        @Test
        @DisplayName("A disabled Telegram channel drops the message without failing")
        void telegramDisabled() {
            TelegramNotifier telegram = new TelegramNotifier(new TelegramConfig());
            NotificationService viaTelegram = new NotificationService(telegram, new RiskConfig(), clock);

            assertThat(telegram.send("hello", AlertLevel.CRITICAL)).isFalse();
            assertThat(viaTelegram.handleAlert(alert(AlertLevel.WARNING, "hello", "k"))).isTrue();
        }
    }

    @Nested
    @DisplayName("Trade lifecycle")
    class TradeLifecycle {

        private Trade trade;

        @BeforeEach
        void setUp() {
            trade = TestTrades.openTrade("BTC", new BigDecimal("1.5"), new BigDecimal("100"), NOW);
        }

        @Test
        @DisplayName("Opening names both legs and the entry APY")
        void opened() {
            service.onTradeOpened(new TradeOpenedEvent(this, trade));

            verify(notificationPort).sendMessage(argThat(text -> text.startsWith("Opened BTC")
                    && text.contains("LIGHTER")
                    && text.contains("X10")
                    && text.contains("0.50")));
        }

        @Test
        @DisplayName("Closing reports the reason and the result")
        void closed() {
            trade.setRealizedPnl(new BigDecimal("0.42"));

            service.onTradeClosed(new TradeClosedEvent(this, trade, "FUNDING_FLIP"));

            verify(notificationPort).sendMessage(argThat(text -> text.startsWith("Closed BTC (FUNDING_FLIP)")
                    && text.contains("realized 0.42")));
        }
    }
}
