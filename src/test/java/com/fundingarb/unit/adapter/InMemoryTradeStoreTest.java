package com.fundingarb.unit.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fundingarb.adapter.InMemoryTradeStore;
import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeStats;
import com.fundingarb.exception.TradeNotFoundException;
import com.fundingarb.exception.ValidationException;
import com.fundingarb.unit.support.MutableClock;
import com.fundingarb.unit.support.TestTrades;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryTradeStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryTradeStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryTradeStore(clock);
    }

    private Trade pending(String symbol) {
        Trade trade = TestTrades.openTrade(symbol, BigDecimal.ONE, new BigDecimal("100"), null);
        trade.setId(null);
        trade.setStatus(TradeStatus.PENDING);
        return trade;
    }

    @Nested
    @DisplayName("One active trade per symbol")
    class ActivePerSymbol {

        @Test
        @DisplayName("Creating a second active trade for a symbol is rejected")
        void duplicateRejected() {
            store.createTrade(pending("BTC"));

            assertThatThrownBy(() -> store.createTrade(pending("BTC")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("BTC");
        }

        @Test
        @DisplayName("A terminal trade no longer blocks the symbol")
        void terminalReleasesSymbol() {
            Trade first = store.createTrade(pending("BTC"));
            first.setStatus(TradeStatus.ABORTED);
            store.updateTrade(first);

            Trade second = store.createTrade(pending("BTC"));

            assertThat(second.getId()).isNotEqualTo(first.getId());
            assertThat(store.findActiveBySymbol("BTC")).map(Trade::getId).contains(second.getId());
        }

        @Test
        @DisplayName("Different symbols are independent")
        void otherSymbolsAllowed() {
            store.createTrade(pending("BTC"));
            store.createTrade(pending("ETH"));

            assertThat(store.listOpenTrades()).hasSize(2);
        }

        @Test
        @DisplayName("Reactivating a terminal trade while another is active is rejected")
        void reactivationRejected() {
            Trade first = store.createTrade(pending("BTC"));
            first.setStatus(TradeStatus.ABORTED);
            store.updateTrade(first);
            store.createTrade(pending("BTC"));

            first.setStatus(TradeStatus.OPEN);
            assertThatThrownBy(() -> store.updateTrade(first)).isInstanceOf(ValidationException.class);
        }
    }

    @Test
    @DisplayName("Created trades get an id and a creation time")
    void assignsIdAndCreatedAt() {
        Trade created = store.createTrade(pending("BTC"));

        assertThat(created.getId()).isNotBlank();
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Callers work on copies until they write back")
    void returnsCopies() {
        Trade created = store.createTrade(pending("BTC"));
        created.getLeg1().setFees(new BigDecimal("99"));

        assertThat(store.getTrade(created.getId()).orElseThrow().getLeg1().getFees())
                .isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Updating an unknown trade fails")
    void updateUnknown() {
        Trade trade = TestTrades.openTrade("BTC", BigDecimal.ONE, BigDecimal.TEN, NOW);

        assertThatThrownBy(() -> store.updateTrade(trade)).isInstanceOf(TradeNotFoundException.class);
    }

    @Test
    @DisplayName("Stats fees equal the sum of both legs' fees across trades")
    void statsTotalFees() {
        Trade btc = pending("BTC");
        btc.getLeg1().setFees(new BigDecimal("0.40"));
        btc.getLeg2().setFees(new BigDecimal("0.60"));
        Trade eth = pending("ETH");
        eth.getLeg1().setFees(new BigDecimal("0.25"));
        store.createTrade(btc);
        Trade closed = store.createTrade(eth);
        closed.setStatus(TradeStatus.CLOSED);
        closed.setRealizedPnl(new BigDecimal("3"));
        closed.setClosedAt(NOW);
        store.updateTrade(closed);

        TradeStats stats = store.getStats();

        assertThat(stats.getTotalFees()).isEqualByComparingTo("1.25");
        assertThat(stats.getOpenTrades()).isEqualTo(1);
        assertThat(stats.getClosedTrades()).isEqualTo(1);
        assertThat(stats.getWinningTrades()).isEqualTo(1);
        assertThat(stats.getTotalRealizedPnl()).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("Journal entries are kept per trade in order")
    void journal() {
        Trade created = store.createTrade(pending("BTC"));
        store.appendEvent(created.getId(), "CREATED", Map.of("qty", "1"));
        clock.advance(Duration.ofSeconds(5));
        store.appendEvent(created.getId(), "OPENED", null);

        assertThat(store.getEvents(created.getId()))
                .extracting(r -> r.getEventType())
                .containsExactly("CREATED", "OPENED");
        assertThat(store.getEvents(created.getId()).get(1).getTimestamp()).isEqualTo(NOW.plusSeconds(5));
    }

    @Test
    @DisplayName("Cleanup removes only terminal trades that ended before the cutoff")
    void cleanup() {
        Trade old = store.createTrade(pending("BTC"));
        old.setStatus(TradeStatus.CLOSED);
        old.setClosedAt(NOW.minus(Duration.ofDays(10)));
        store.updateTrade(old);
        store.createTrade(pending("ETH"));

        int removed = store.cleanupBefore(NOW.minus(Duration.ofDays(7)));

        assertThat(removed).isEqualTo(1);
        assertThat(store.getTrade(old.getId())).isEmpty();
        assertThat(store.listOpenTrades()).hasSize(1);
    }

    @Test
    @DisplayName("Last close time is the latest CLOSED trade for the symbol")
    void lastClosedAt() {
        Trade first = store.createTrade(pending("BTC"));
        first.setStatus(TradeStatus.CLOSED);
        first.setClosedAt(NOW.minusSeconds(100));
        store.updateTrade(first);
        Trade second = store.createTrade(pending("BTC"));
        second.setStatus(TradeStatus.CLOSED);
        second.setClosedAt(NOW.minusSeconds(10));
        store.updateTrade(second);

        assertThat(store.lastClosedAt("BTC")).contains(NOW.minusSeconds(10));
        assertThat(store.lastClosedAt("ETH")).isEmpty();
    }
}
