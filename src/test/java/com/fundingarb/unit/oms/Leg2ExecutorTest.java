package com.fundingarb.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.config.FeeConfig;
import com.fundingarb.domain.enums.OrderType;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TimeInForce;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.Position;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import com.fundingarb.exception.ExchangeConnectionException;
import com.fundingarb.exception.Leg2FailedException;
import com.fundingarb.exception.OrderTimeoutException;
import com.fundingarb.exception.OrderbookDataException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.oms.FillWaiter;
import com.fundingarb.oms.Leg2Executor;
import com.fundingarb.simulator.PaperExchange;
import com.fundingarb.unit.support.MutableClock;
import com.fundingarb.unit.support.PaperVenues;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class Leg2ExecutorTest {

    @Mock
    private MarketDataService marketDataService;

    private MutableClock clock;
    private PaperVenues venues;
    private Leg2Executor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        venues = new PaperVenues(clock, "BTC");
        executor = executorOn(venues.registry());
    }

    private Leg2Executor executorOn(ExchangeRegistry registry) {
        ExecutionConfig config = new ExecutionConfig();
        config.setFillPollInterval(Duration.ofMillis(10));
        config.setHedgeRetryDelay(Duration.ZERO);
        return new Leg2Executor(registry, marketDataService, new FillWaiter(registry, config), config,
                new FeeConfig());
    }

    private Leg2Executor executorWithHedgeVenue(PaperExchange x10) {
        x10.setBook("BTC", new BigDecimal("99.9"), new BigDecimal("100.1"), new BigDecimal("1000"));
        return executorOn(new ExchangeRegistry(Map.of(Venue.LIGHTER, venues.lighter(), Venue.X10, x10)));
    }

    private Trade trade() {
        return Trade.builder()
                .id("t-1")
                .symbol("BTC")
                .leg1(TradeLeg.builder()
                        .venue(Venue.LIGHTER)
                        .side(Side.BUY)
                        .qty(BigDecimal.ONE)
                        .filledQty(BigDecimal.ONE)
                        .entryPrice(new BigDecimal("100"))
                        .build())
                .leg2(TradeLeg.builder().venue(Venue.X10).side(Side.SELL).qty(BigDecimal.ONE).build())
                .targetQty(BigDecimal.ONE)
                .build();
    }

    @Test
    @DisplayName("Hedges with a crossing IOC order and records price and fees")
    void hedges() {
        when(marketDataService.getMarkPrice("BTC", Venue.X10)).thenReturn(new BigDecimal("100"));
        when(marketDataService.getFreshOrderbook("BTC", Venue.X10)).thenReturn(venues.x10().getOrderbookL1("BTC"));
        Trade trade = trade();

        executor.execute(trade, BigDecimal.ONE);

        TradeLeg leg = trade.getLeg2();
        assertThat(leg.getFilledQty()).isEqualByComparingTo("1");
        assertThat(leg.getEntryPrice()).isEqualByComparingTo("99.9");
        assertThat(leg.getFees()).isEqualByComparingTo("0.04995");
        assertThat(leg.getOrderId()).isNotNull();

        List<Order> orders = venues.x10().getAllOrders();
        assertThat(orders).hasSize(1);
        assertThat(orders.get(0).getType()).isEqualTo(OrderType.LIMIT);
        assertThat(orders.get(0).getTimeInForce()).isEqualTo(TimeInForce.IOC);
        assertThat(orders.get(0).getPrice()).isLessThan(new BigDecimal("99.9"));
    }

    @Test
    @DisplayName("Adds to a partially hedged leg")
    void addsToExistingFill() {
        when(marketDataService.getMarkPrice("BTC", Venue.X10)).thenReturn(new BigDecimal("100"));
        when(marketDataService.getFreshOrderbook("BTC", Venue.X10)).thenReturn(venues.x10().getOrderbookL1("BTC"));
        Trade trade = trade();
        trade.getLeg2().setFilledQty(new BigDecimal("0.5"));
        trade.getLeg2().setEntryPrice(new BigDecimal("100.1"));

        executor.execute(trade, new BigDecimal("0.5"));

        assertThat(trade.getLeg2().getFilledQty()).isEqualByComparingTo("1");
        assertThat(trade.getLeg2().getEntryPrice()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("A leftover below the unhedged dust limit needs no order")
    void microLeftover() {
        when(marketDataService.getMarkPrice("BTC", Venue.X10)).thenReturn(new BigDecimal("100"));
        Trade trade = trade();

        executor.execute(trade, new BigDecimal("0.04"));

        assertThat(venues.x10().getAllOrders()).isEmpty();
        assertThat(trade.getLeg2().getFilledQty()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("An empty hedge account fails at once with what was hedged")
    void insufficientBalance() {
        when(marketDataService.getMarkPrice("BTC", Venue.X10)).thenReturn(new BigDecimal("100"));
        when(marketDataService.getFreshOrderbook("BTC", Venue.X10)).thenReturn(venues.x10().getOrderbookL1("BTC"));
        venues.x10().setBalance(BigDecimal.ZERO);
        Trade trade = trade();

        assertThatThrownBy(() -> executor.execute(trade, BigDecimal.ONE))
                .isInstanceOf(Leg2FailedException.class)
                .hasMessageContaining("hedged 0 of 1");
        assertThat(trade.getLeg2().getFilledQty()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Fails after every attempt errors")
    void allAttemptsFail() {
        when(marketDataService.getMarkPrice("BTC", Venue.X10)).thenReturn(new BigDecimal("100"));
        when(marketDataService.getFreshOrderbook("BTC", Venue.X10))
                .thenThrow(new OrderbookDataException("BTC", Venue.X10, "crossed book"));

        assertThatThrownBy(() -> executor.execute(trade(), BigDecimal.ONE))
                .isInstanceOf(Leg2FailedException.class)
                .hasMessageContaining("crossed book");
        assertThat(venues.x10().getAllOrders()).isEmpty();
    }
    @Test
    @DisplayName("A timed-out placement that filled is credited from the position, not placed again")
    void timedOutPlacementThatFilled() {
        PaperExchange x10 = new PaperExchange(Venue.X10, clock, PaperVenues.BALANCE, PaperVenues.MAKER_FEE,
                PaperVenues.TAKER_FEE, Duration.ofSeconds(2)) {
            @Override
            public synchronized Order placeOrder(OrderRequest request) {
                Order placed = super.placeOrder(request);
                throw new OrderTimeoutException(request.getSymbol(), Venue.X10, placed.getId(),
                        "placeOrder did not complete within 5000ms");
            }
        };
        Leg2Executor hedger = executorWithHedgeVenue(x10);
        when(marketDataService.getMarkPrice("BTC", Venue.X10)).thenReturn(new BigDecimal("100"));
        when(marketDataService.getFreshOrderbook("BTC", Venue.X10)).thenReturn(x10.getOrderbookL1("BTC"));
        Trade trade = trade();

        hedger.execute(trade, BigDecimal.ONE);

        assertThat(trade.getLeg2().getFilledQty()).isEqualByComparingTo("1");
        assertThat(trade.getLeg2().getEntryPrice()).isEqualByComparingTo("99.9");
        assertThat(x10.getAllOrders()).hasSize(1);
        assertThat(x10.getPosition("BTC").orElseThrow().signedQty()).isEqualByComparingTo("-1");
    }

    @Test
    @DisplayName("A timed-out placement with an unreadable position fails instead of placing again")
    void timedOutPlacementUnknownOutcome() {
        PaperExchange x10 = new PaperExchange(Venue.X10, clock, PaperVenues.BALANCE, PaperVenues.MAKER_FEE,
                PaperVenues.TAKER_FEE, Duration.ofSeconds(2)) {
            @Override
            public synchronized Order placeOrder(OrderRequest request) {
                throw new OrderTimeoutException(request.getSymbol(), Venue.X10, null,
                        "placeOrder did not complete within 5000ms");
            }

            @Override
            public synchronized Optional<Position> getPosition(String symbol) {
                throw new ExchangeConnectionException(Venue.X10, "getPosition timed out");
            }
        };
        Leg2Executor hedger = executorWithHedgeVenue(x10);
        when(marketDataService.getMarkPrice("BTC", Venue.X10)).thenReturn(new BigDecimal("100"));
        when(marketDataService.getFreshOrderbook("BTC", Venue.X10)).thenReturn(x10.getOrderbookL1("BTC"));
        Trade trade = trade();

        assertThatThrownBy(() -> hedger.execute(trade, BigDecimal.ONE))
                .isInstanceOf(Leg2FailedException.class)
                .hasMessageContaining("placement outcome unknown");
        assertThat(trade.getLeg2().getFilledQty()).isEqualByComparingTo("0");
        verify(marketDataService, times(1)).getFreshOrderbook("BTC", Venue.X10);
    }
}
