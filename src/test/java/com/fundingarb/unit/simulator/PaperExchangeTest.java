package com.fundingarb.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fundingarb.domain.enums.OrderStatus;
import com.fundingarb.domain.enums.OrderType;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TimeInForce;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.OrderbookDepthSnapshot;
import com.fundingarb.domain.model.PriceLevel;
import com.fundingarb.domain.model.Position;
import com.fundingarb.exception.InsufficientBalanceException;
import com.fundingarb.exception.OrderNotFoundException;
import com.fundingarb.exception.OrderRejectedException;
import com.fundingarb.exception.ValidationException;
import com.fundingarb.simulator.PaperExchange;
import com.fundingarb.unit.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PaperExchangeTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private PaperExchange exchange;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        exchange = new PaperExchange(Venue.LIGHTER, clock, new BigDecimal("10000"), new BigDecimal("0.0002"),
                new BigDecimal("0.0005"), Duration.ofSeconds(2));
        exchange.setBook("BTC", new BigDecimal("99.9"), new BigDecimal("100.1"), new BigDecimal("10"));
    }

    private Order market(Side side, String qty) {
        return exchange.placeOrder(OrderRequest.builder()
                .symbol("BTC")
                .side(side)
                .type(OrderType.MARKET)
                .timeInForce(TimeInForce.IOC)
                .quantity(new BigDecimal(qty))
                .build());
    }

    @Nested
    @DisplayName("Taker fills")
    class TakerFills {

        @Test
        @DisplayName("A market buy fills at the ask and pays the taker fee")
        void marketBuy() {
            Order order = market(Side.BUY, "2");

            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(order.getAvgFillPrice()).isEqualByComparingTo("100.1");
            assertThat(order.getFee()).isEqualByComparingTo("0.1001");
            assertThat(exchange.getAvailableBalance().getAvailable()).isEqualByComparingTo("9999.8999");

            Position position = exchange.getPosition("BTC").orElseThrow();
            assertThat(position.getSide()).isEqualTo(Side.BUY);
            assertThat(position.getQty()).isEqualByComparingTo("2");
        }

        @Test
        @DisplayName("A crossing limit order fills immediately at the opposite price")
        void crossingLimit() {
            Order order = exchange.placeOrder(
                    OrderRequest.limit("BTC", Side.SELL, BigDecimal.ONE, new BigDecimal("99"), TimeInForce.GTC));

            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(order.getAvgFillPrice()).isEqualByComparingTo("99.9");
            assertThat(exchange.getPosition("BTC").orElseThrow().getSide()).isEqualTo(Side.SELL);
        }

        @Test
        @DisplayName("Reducing a position realises PnL on the closed part")
        void netting() {
            market(Side.BUY, "2");
            market(Side.SELL, "1");

            assertThat(exchange.getPosition("BTC").orElseThrow().getQty()).isEqualByComparingTo("1");
            assertThat(exchange.getRealizedPnl()).isEqualByComparingTo("-0.2");
        }
    }

    @Nested
    @DisplayName("Resting orders")
    class RestingOrders {

        @Test
        @DisplayName("A post-only order that would cross is rejected")
        void postOnlyCross() {
            assertThatThrownBy(() -> exchange.placeOrder(
                    OrderRequest.limit("BTC", Side.BUY, BigDecimal.ONE, new BigDecimal("100.1"), TimeInForce.POST_ONLY)))
                    .isInstanceOf(OrderRejectedException.class);
            assertThat(exchange.getAllOrders()).isEmpty();
        }

        @Test
        @DisplayName("A resting maker order fills at its limit once the delay has passed")
        void restingFill() {
            Order placed = exchange.placeOrder(
                    OrderRequest.limit("BTC", Side.BUY, BigDecimal.ONE, new BigDecimal("100"), TimeInForce.POST_ONLY));
            assertThat(placed.getStatus()).isEqualTo(OrderStatus.OPEN);

            clock.advance(Duration.ofSeconds(1));
            assertThat(exchange.getOrder("BTC", placed.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.OPEN);

            clock.advance(Duration.ofSeconds(1));
            Order filled = exchange.getOrder("BTC", placed.getId()).orElseThrow();
            assertThat(filled.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(filled.getAvgFillPrice()).isEqualByComparingTo("100");
            assertThat(filled.getFee()).isEqualByComparingTo("0.02");
        }

        @Test
        @DisplayName("An IOC order that does not cross expires")
        void iocExpires() {
            Order order = exchange.placeOrder(
                    OrderRequest.limit("BTC", Side.BUY, BigDecimal.ONE, new BigDecimal("100"), TimeInForce.IOC));

            assertThat(order.getStatus()).isEqualTo(OrderStatus.EXPIRED);
            assertThat(exchange.getPosition("BTC")).isEmpty();
        }

        @Test
        @DisplayName("Cancelling stops a resting order from filling")
        void cancel() {
            Order placed = exchange.placeOrder(
                    OrderRequest.limit("BTC", Side.BUY, BigDecimal.ONE, new BigDecimal("100"), TimeInForce.GTC));

            exchange.cancelOrder("BTC", placed.getId());
            clock.advance(Duration.ofSeconds(5));

            assertThat(exchange.getOrder("BTC", placed.getId()).orElseThrow().getStatus())
                    .isEqualTo(OrderStatus.CANCELLED);
            assertThat(exchange.getOpenOrders("BTC")).isEmpty();
            assertThat(exchange.getPosition("BTC")).isEmpty();
        }

        @Test
        @DisplayName("Cancelling an unknown order fails")
        void cancelUnknown() {
            assertThatThrownBy(() -> exchange.cancelOrder("BTC", "nope"))
                    .isInstanceOf(OrderNotFoundException.class);
        }

        @Test
        @DisplayName("Listeners see every order update")
        void listeners() {
            List<OrderStatus> seen = new ArrayList<>();
            exchange.subscribeOrders(order -> seen.add(order.getStatus()));

            Order placed = exchange.placeOrder(
                    OrderRequest.limit("BTC", Side.BUY, BigDecimal.ONE, new BigDecimal("100"), TimeInForce.GTC));
            clock.advance(Duration.ofSeconds(2));
            exchange.getOrder("BTC", placed.getId());

            assertThat(seen).containsExactly(OrderStatus.OPEN, OrderStatus.FILLED);
        }
    }

    @Nested
    @DisplayName("Reduce-only")
    class ReduceOnly {

        @Test
        @DisplayName("Nothing to reduce is rejected")
        void nothingToReduce() {
            assertThatThrownBy(() -> exchange.placeOrder(OrderRequest.reduceOnlyMarket("BTC", Side.SELL, BigDecimal.ONE)))
                    .isInstanceOf(OrderRejectedException.class);
        }

        @Test
        @DisplayName("The quantity is clamped to the open position")
        void clamped() {
            exchange.setPosition("BTC", BigDecimal.ONE, new BigDecimal("100"));

            Order order = exchange.placeOrder(OrderRequest.reduceOnlyMarket("BTC", Side.SELL, new BigDecimal("3")));

            assertThat(order.getFilledQty()).isEqualByComparingTo("1");
            assertThat(exchange.getPosition("BTC")).isEmpty();
            assertThat(exchange.getRealizedPnl()).isEqualByComparingTo("-0.1");
        }

        @Test
        @DisplayName("Reduce-only orders are accepted with no balance")
        void noBalanceNeeded() {
            exchange.setPosition("BTC", new BigDecimal("-1"), new BigDecimal("100"));
            exchange.setBalance(BigDecimal.ZERO);

            Order order = exchange.placeOrder(OrderRequest.reduceOnlyMarket("BTC", Side.BUY, BigDecimal.ONE));

            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
        }
    }

    @Nested
    @DisplayName("Validation and market data")
    class ValidationAndMarketData {

        @Test
        @DisplayName("Opening orders need a balance")
        void insufficientBalance() {
            exchange.setBalance(BigDecimal.ZERO);

            assertThatThrownBy(() -> market(Side.BUY, "1")).isInstanceOf(InsufficientBalanceException.class);
        }

        @Test
        @DisplayName("Orders on unknown symbols are rejected")
        void unknownSymbol() {
            assertThatThrownBy(() -> exchange.placeOrder(OrderRequest.reduceOnlyMarket("ETH", Side.SELL, BigDecimal.ONE)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> exchange.getMarketInfo("ETH")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("A limit order without a price is rejected")
        void limitWithoutPrice() {
            assertThatThrownBy(() -> exchange.placeOrder(
                    OrderRequest.limit("BTC", Side.BUY, BigDecimal.ONE, null, TimeInForce.GTC)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Depth steps away from L1 by one tick per level")
        void depth() {
            OrderbookDepthSnapshot depth = exchange.getOrderbookDepth("BTC", 3);

            assertThat(depth.getBids()).extracting(PriceLevel::getPrice)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("99.9"), new BigDecimal("99.89"), new BigDecimal("99.88"));
            assertThat(depth.getAsks()).extracting(PriceLevel::getPrice)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("100.1"), new BigDecimal("100.11"), new BigDecimal("100.12"));
        }

        @Test
        @DisplayName("Mark price is the book mid")
        void markPrice() {
            assertThat(exchange.getMarkPrice("BTC")).isEqualByComparingTo("100");
            assertThat(exchange.getMarkPrice("ETH")).isEqualByComparingTo("0");
            assertThat(exchange.listSymbols()).containsExactly("BTC");
        }
    }
}
