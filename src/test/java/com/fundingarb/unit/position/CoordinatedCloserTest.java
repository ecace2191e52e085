package com.fundingarb.unit.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.enums.OrderType;
import com.fundingarb.domain.enums.TimeInForce;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.CloseResult;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.exception.OrderbookDataException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.oms.FillWaiter;
import com.fundingarb.position.CoordinatedCloser;
import com.fundingarb.simulator.PaperExchange;
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
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CoordinatedCloserTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private MarketDataService marketDataService;

    private PaperExchange lighter;
    private PaperExchange x10;
    private ExchangeRegistry registry;
    private CoordinatedCloser closer;
    private Trade trade;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        // zero resting delay: maker orders fill on the next poll
        lighter = new PaperExchange(Venue.LIGHTER, clock, new BigDecimal("10000"), new BigDecimal("0.0002"),
                new BigDecimal("0.0005"), Duration.ZERO);
        x10 = new PaperExchange(Venue.X10, clock, new BigDecimal("10000"), new BigDecimal("0.0002"),
                new BigDecimal("0.0005"), Duration.ZERO);
        lighter.setBook("BTC", new BigDecimal("99.9"), new BigDecimal("100.1"), new BigDecimal("1000"));
        registry = new ExchangeRegistry(Map.of(Venue.LIGHTER, lighter, Venue.X10, x10));

        ExecutionConfig executionConfig = new ExecutionConfig();
        executionConfig.setFillPollInterval(Duration.ofMillis(10));
        PositionConfig positionConfig = new PositionConfig();
        positionConfig.setCloseMakerTimeout(Duration.ofSeconds(2));
        positionConfig.setCloseIocTimeout(Duration.ofSeconds(1));
        closer = new CoordinatedCloser(registry, marketDataService, new FillWaiter(registry, executionConfig),
                positionConfig);

        // long Lighter, short X10
        trade = TestTrades.openTrade("BTC", BigDecimal.ONE, new BigDecimal("100"), NOW);
        lighter.setPosition("BTC", BigDecimal.ONE, new BigDecimal("100"));
        x10.setPosition("BTC", BigDecimal.ONE.negate(), new BigDecimal("100"));
    }

    private void booksFromVenues() {
        when(marketDataService.getFreshOrderbook(eq("BTC"), any()))
                .thenAnswer(inv -> registry.get(inv.getArgument(1)).getOrderbookL1("BTC"));
    }

    @Nested
    @DisplayName("Full close")
    class FullClose {

        @BeforeEach
        void setUp() {
            x10.setBook("BTC", new BigDecimal("99.9"), new BigDecimal("100.1"), new BigDecimal("1000"));
        }

        @Test
        @DisplayName("Closes both legs with resting reduce-only maker orders")
        void makerClose() {
            booksFromVenues();

            CloseResult result = closer.close(trade, false);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).isEqualTo("closed");
            assertThat(lighter.getPosition("BTC")).isEmpty();
            assertThat(x10.getPosition("BTC")).isEmpty();
            assertThat(lighter.getAllOrders()).singleElement().satisfies(order -> {
                assertThat(order.getTimeInForce()).isEqualTo(TimeInForce.POST_ONLY);
                assertThat(order.isReduceOnly()).isTrue();
            });
            assertThat(trade.getLeg1().getClosedQty()).isEqualByComparingTo("1");
            assertThat(trade.getLeg1().getExitPrice()).isEqualByComparingTo("100");
            assertThat(trade.getLeg2().getExitPrice()).isEqualByComparingTo("100");
            assertThat(trade.getLeg1().getFees()).isEqualByComparingTo("0.02");
        }

        @Test
        @DisplayName("An emergency close goes straight through the book")
        void emergency() {
            booksFromVenues();

            CloseResult result = closer.close(trade, true);

            assertThat(result.isSuccess()).isTrue();
            assertThat(lighter.getAllOrders()).singleElement()
                    .satisfies(order -> assertThat(order.getTimeInForce()).isEqualTo(TimeInForce.IOC));
            assertThat(trade.getLeg1().getExitPrice()).isEqualByComparingTo("99.9");
            assertThat(trade.getLeg2().getExitPrice()).isEqualByComparingTo("100.1");
        }

        @Test
        @DisplayName("Sizes from the live position, not the recorded fill")
        void liveQuantity() {
            booksFromVenues();
            lighter.setPosition("BTC", new BigDecimal("0.4"), new BigDecimal("100"));

            closer.close(trade, true);

            assertThat(lighter.getAllOrders()).singleElement()
                    .satisfies(order -> assertThat(order.getQuantity()).isEqualByComparingTo("0.4"));
        }

        @Test
        @DisplayName("Falls back to a market order when the IOC cannot be priced")
        void marketFallback() {
            when(marketDataService.getFreshOrderbook(eq("BTC"), any())).thenAnswer(inv -> {
                Venue venue = inv.getArgument(1);
                if (venue == Venue.X10) {
                    throw new OrderbookDataException("BTC", venue, "stale");
                }
                return lighter.getOrderbookL1("BTC");
            });

            CloseResult result = closer.close(trade, true);

            assertThat(result.isSuccess()).isTrue();
            assertThat(x10.getAllOrders()).extracting(Order::getType).containsExactly(OrderType.MARKET);
        }

        @Test
        @DisplayName("Leg-by-leg close flattens both venues")
        void sequential() {
            booksFromVenues();

            CloseResult result = closer.closeSequentially(trade);

            assertThat(result.isSuccess()).isTrue();
            assertThat(lighter.listPositions()).isEmpty();
            assertThat(x10.listPositions()).isEmpty();
        }

        @Test
        @DisplayName("Reduce trims a leg without closing it")
        void reduce() {
            booksFromVenues();

            BigDecimal reduced = closer.reduce(trade, trade.getLeg1(), new BigDecimal("0.3"), null, true);

            assertThat(reduced).isEqualByComparingTo("0.3");
            assertThat(lighter.getPosition("BTC").orElseThrow().getQty()).isEqualByComparingTo("0.7");
        }
    }

    @Test
    @DisplayName("Reports the residual when a venue refuses every close order")
    void residual() {
        // X10 has no book for the symbol, so nothing can be placed there
        when(marketDataService.getFreshOrderbook(eq("BTC"), eq(Venue.LIGHTER)))
                .thenReturn(lighter.getOrderbookL1("BTC"));

        CloseResult result = closer.close(trade, true);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getResidualLeg1()).isEqualByComparingTo("0");
        assertThat(result.getResidualLeg2()).isEqualByComparingTo("1");
        assertThat(result.getMessage()).startsWith("residual");
    }
}
