package com.fundingarb.simulator;

import com.fundingarb.domain.enums.OrderStatus;
import com.fundingarb.domain.enums.OrderType;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TimeInForce;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Balance;
import com.fundingarb.domain.model.FundingRate;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.OrderbookDepthSnapshot;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.domain.model.Position;
import com.fundingarb.domain.model.PriceLevel;
import com.fundingarb.exception.InsufficientBalanceException;
import com.fundingarb.exception.OrderNotFoundException;
import com.fundingarb.exception.OrderRejectedException;
import com.fundingarb.exception.ValidationException;
import com.fundingarb.port.ExchangePort;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory venue for paper trading and tests.
 *
 * <p>Books are static until changed with {@link #setBook}. Marketable orders fill immediately
 * at the opposite best price; POST_ONLY orders that would cross are rejected; resting orders fill
 * in full at their limit price once they have rested for {@code restingFillDelay} and the
 * venue is next queried. IOC orders that do not cross expire unfilled.
 *
 * <p>Positions are netted per symbol with signed quantity (positive = long). Every order change
 * is pushed to subscribers registered with {@link #subscribeOrders}.
 */
public class PaperExchange implements ExchangePort {

    private static final Logger log = LoggerFactory.getLogger(PaperExchange.class);

    private final Venue venue;
    private final Clock clock;
    private final BigDecimal makerFee;
    private final BigDecimal takerFee;
    private final Duration restingFillDelay;

    private final Map<String, OrderbookSnapshot> books = new LinkedHashMap<>();
    private final Map<String, BigDecimal> fundingRates = new LinkedHashMap<>();
    private final Map<String, MarketInfo> marketInfo = new LinkedHashMap<>();
    private final Map<String, Order> orders = new LinkedHashMap<>();
    private final Map<String, BigDecimal> netQty = new LinkedHashMap<>();
    private final Map<String, BigDecimal> avgEntry = new LinkedHashMap<>();
    private final List<Consumer<Order>> listeners = new CopyOnWriteArrayList<>();

    private BigDecimal balance;
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    public PaperExchange(
            Venue venue,
            Clock clock,
            BigDecimal startingBalance,
            BigDecimal makerFee,
            BigDecimal takerFee,
            Duration restingFillDelay) {
        this.venue = venue;
        this.clock = clock;
        this.balance = startingBalance;
        this.makerFee = makerFee;
        this.takerFee = takerFee;
        this.restingFillDelay = restingFillDelay;
    }

    // ==============================
    // SIMULATION CONTROL
    // ==============================

    public synchronized void setBook(String symbol, BigDecimal bid, BigDecimal ask, BigDecimal qty) {
        books.put(symbol, OrderbookSnapshot.builder()
                .symbol(symbol)
                .venue(venue)
                .bestBid(bid)
                .bestBidQty(qty)
                .bestAsk(ask)
                .bestAskQty(qty)
                .updatedAt(clock.instant())
                .build());
        marketInfo.putIfAbsent(symbol, MarketInfo.builder().symbol(symbol).build());
    }

    public synchronized void setFundingRate(String symbol, BigDecimal hourlyRate) {
        fundingRates.put(symbol, hourlyRate);
    }

    public synchronized void setMarketInfo(MarketInfo info) {
        marketInfo.put(info.getSymbol(), info);
    }

    /** Sets a position directly, as if it had been opened outside the engine. Zero removes it. */
    public synchronized void setPosition(String symbol, BigDecimal signedQty, BigDecimal entryPrice) {
        if (signedQty.signum() == 0) {
            netQty.remove(symbol);
            avgEntry.remove(symbol);
        } else {
            netQty.put(symbol, signedQty);
            avgEntry.put(symbol, entryPrice);
        }
    }

    public synchronized void setBalance(BigDecimal balance) {
        this.balance = balance;
    }

    public synchronized BigDecimal getRealizedPnl() {
        return realizedPnl;
    }

    public synchronized List<Order> getAllOrders() {
        return orders.values().stream().map(o -> o.toBuilder().build()).collect(Collectors.toList());
    }

    // ==============================
    // EXCHANGE PORT
    // ==============================

    @Override
    public Venue getVenue() {
        return venue;
    }

    @Override
    public synchronized List<String> listSymbols() {
        return new ArrayList<>(books.keySet());
    }

    @Override
    public synchronized Order placeOrder(OrderRequest request) {
        OrderbookSnapshot book = books.get(request.getSymbol());
        if (book == null) {
            throw new ValidationException("Unknown symbol " + request.getSymbol() + " on " + venue, request.getSymbol());
        }
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new ValidationException("Quantity must be positive", request.getSymbol());
        }
        if (request.getType() == OrderType.LIMIT && request.getPrice() == null) {
            throw new ValidationException("LIMIT order requires a price", request.getSymbol());
        }
        BigDecimal qty = request.getQuantity();
        if (request.isReduceOnly()) {
            BigDecimal reducible = reducibleQty(request.getSymbol(), request.getSide());
            if (reducible.signum() == 0) {
                throw new OrderRejectedException(request.getSymbol(), venue, "reduce-only order would increase position");
            }
            qty = qty.min(reducible);
        } else if (balance.signum() <= 0) {
            throw new InsufficientBalanceException(venue, "No available balance on " + venue);
        }

        Instant now = clock.instant();
        Order order = Order.builder()
                .id(venue.name().toLowerCase() + "-" + UUID.randomUUID())
                .clientOrderId(request.getClientOrderId())
                .symbol(request.getSymbol())
                .venue(venue)
                .side(request.getSide())
                .type(request.getType())
                .timeInForce(request.getTimeInForce())
                .price(request.getPrice())
                .quantity(qty)
                .status(OrderStatus.OPEN)
                .reduceOnly(request.isReduceOnly())
                .createdAt(now)
                .updatedAt(now)
                .build();

        BigDecimal opposite = request.getSide() == Side.BUY ? book.getBestAsk() : book.getBestBid();
        boolean crosses = request.getType() == OrderType.MARKET
                || (request.getSide() == Side.BUY
                        ? request.getPrice().compareTo(opposite) >= 0
                        : request.getPrice().compareTo(opposite) <= 0);

        if (crosses && request.getTimeInForce() == TimeInForce.POST_ONLY) {
            throw new OrderRejectedException(request.getSymbol(), venue, "post-only order would cross the book");
        }
        orders.put(order.getId(), order);
        if (crosses) {
            fill(order, opposite, takerFee);
        } else if (request.getTimeInForce() == TimeInForce.IOC || request.getTimeInForce() == TimeInForce.FOK) {
            order.setStatus(OrderStatus.EXPIRED);
            notifyListeners(order);
        } else {
            notifyListeners(order);
        }
        log.debug("{} placed {} {} {} @ {} -> {}", venue, order.getSide(), order.getQuantity(), order.getSymbol(),
                order.getPrice(), order.getStatus());
        return order.toBuilder().build();
    }

    @Override
    public synchronized void cancelOrder(String symbol, String orderId) {
        processRestingFills();
        Order order = orders.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException(symbol, venue, orderId);
        }
        if (order.getStatus().isActive()) {
            order.setStatus(OrderStatus.CANCELLED);
            order.setUpdatedAt(clock.instant());
            notifyListeners(order);
        }
    }

    @Override
    public synchronized Optional<Order> getOrder(String symbol, String orderId) {
        processRestingFills();
        return Optional.ofNullable(orders.get(orderId)).map(o -> o.toBuilder().build());
    }

    @Override
    public synchronized List<Order> getOpenOrders(String symbol) {
        processRestingFills();
        return orders.values().stream()
                .filter(o -> o.getSymbol().equals(symbol) && o.getStatus().isActive())
                .map(o -> o.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<Position> getPosition(String symbol) {
        processRestingFills();
        return Optional.ofNullable(toPosition(symbol));
    }

    @Override
    public synchronized List<Position> listPositions() {
        processRestingFills();
        List<Position> positions = new ArrayList<>();
        for (String symbol : netQty.keySet()) {
            positions.add(toPosition(symbol));
        }
        return positions;
    }

    @Override
    public synchronized Balance getAvailableBalance() {
        return Balance.builder().venue(venue).available(balance).total(balance.add(realizedPnl)).build();
    }

    @Override
    public synchronized OrderbookSnapshot getOrderbookL1(String symbol) {
        OrderbookSnapshot book = books.get(symbol);
        if (book == null) {
            return OrderbookSnapshot.builder().symbol(symbol).venue(venue).updatedAt(clock.instant()).build();
        }
        return book.toBuilder().updatedAt(clock.instant()).build();
    }

    @Override
    public synchronized OrderbookDepthSnapshot getOrderbookDepth(String symbol, int levels) {
        OrderbookSnapshot book = getOrderbookL1(symbol);
        List<PriceLevel> bids = new ArrayList<>();
        List<PriceLevel> asks = new ArrayList<>();
        if (book.hasDepth()) {
            BigDecimal tick = marketInfo.get(symbol).getTickSize();
            for (int i = 0; i < levels; i++) {
                BigDecimal offset = tick.multiply(BigDecimal.valueOf(i));
                bids.add(new PriceLevel(book.getBestBid().subtract(offset), book.getBestBidQty()));
                asks.add(new PriceLevel(book.getBestAsk().add(offset), book.getBestAskQty()));
            }
        }
        return OrderbookDepthSnapshot.builder()
                .symbol(symbol)
                .venue(venue)
                .bids(bids)
                .asks(asks)
                .updatedAt(book.getUpdatedAt())
                .build();
    }

    @Override
    public synchronized FundingRate getFundingRate(String symbol) {
        return FundingRate.builder()
                .symbol(symbol)
                .venue(venue)
                .hourlyRate(fundingRates.getOrDefault(symbol, BigDecimal.ZERO))
                .updatedAt(clock.instant())
                .build();
    }

    @Override
    public synchronized BigDecimal getMarkPrice(String symbol) {
        OrderbookSnapshot book = books.get(symbol);
        return book != null && book.hasDepth() ? book.mid() : BigDecimal.ZERO;
    }

    @Override
    public synchronized MarketInfo getMarketInfo(String symbol) {
        MarketInfo info = marketInfo.get(symbol);
        if (info == null) {
            throw new ValidationException("Unknown symbol " + symbol + " on " + venue, symbol);
        }
        return info;
    }

    @Override
    public void subscribeOrders(Consumer<Order> listener) {
        listeners.add(listener);
    }

    // ==============================
    // MATCHING
    // ==============================

    private void processRestingFills() {
        Instant now = clock.instant();
        for (Order order : orders.values()) {
            if (order.getStatus() == OrderStatus.OPEN
                    && order.getType() == OrderType.LIMIT
                    && !order.getCreatedAt().plus(restingFillDelay).isAfter(now)) {
                BigDecimal qty = order.getQuantity();
                if (order.isReduceOnly()) {
                    qty = qty.min(reducibleQty(order.getSymbol(), order.getSide()));
                    if (qty.signum() == 0) {
                        order.setStatus(OrderStatus.CANCELLED);
                        notifyListeners(order);
                        continue;
                    }
                    order.setQuantity(qty);
                }
                fill(order, order.getPrice(), makerFee);
            }
        }
    }

    private void fill(Order order, BigDecimal price, BigDecimal feeRate) {
        BigDecimal qty = order.getQuantity();
        BigDecimal fee = qty.multiply(price).multiply(feeRate);
        applyFill(order.getSymbol(), order.getSide(), qty, price);
        balance = balance.subtract(fee);
        order.setFilledQty(qty);
        order.setAvgFillPrice(price);
        order.setFee(fee);
        order.setStatus(OrderStatus.FILLED);
        order.setUpdatedAt(clock.instant());
        notifyListeners(order);
    }

    /** Nets a fill into the symbol's position, realising PnL on the reduced part. */
    private void applyFill(String symbol, Side side, BigDecimal qty, BigDecimal price) {
        BigDecimal current = netQty.getOrDefault(symbol, BigDecimal.ZERO);
        BigDecimal signed = side == Side.BUY ? qty : qty.negate();
        BigDecimal next = current.add(signed);
        BigDecimal entry = avgEntry.getOrDefault(symbol, price);

        if (current.signum() == 0 || current.signum() == signed.signum()) {
            BigDecimal notional = current.abs().multiply(entry).add(qty.multiply(price));
            avgEntry.put(symbol, notional.divide(next.abs(), 10, RoundingMode.HALF_UP));
        } else {
            BigDecimal closed = qty.min(current.abs());
            BigDecimal pnl = price.subtract(entry).multiply(closed);
            realizedPnl = realizedPnl.add(current.signum() > 0 ? pnl : pnl.negate());
            if (next.signum() != 0 && next.signum() != current.signum()) {
                avgEntry.put(symbol, price);
            }
        }
        if (next.signum() == 0) {
            netQty.remove(symbol);
            avgEntry.remove(symbol);
        } else {
            netQty.put(symbol, next);
        }
    }

    private BigDecimal reducibleQty(String symbol, Side side) {
        BigDecimal current = netQty.getOrDefault(symbol, BigDecimal.ZERO);
        if (side == Side.SELL && current.signum() > 0) {
            return current;
        }
        if (side == Side.BUY && current.signum() < 0) {
            return current.abs();
        }
        return BigDecimal.ZERO;
    }

    private Position toPosition(String symbol) {
        BigDecimal qty = netQty.get(symbol);
        if (qty == null || qty.signum() == 0) {
            return null;
        }
        BigDecimal mark = getMarkPrice(symbol);
        BigDecimal entry = avgEntry.get(symbol);
        BigDecimal move = mark.signum() > 0 ? mark.subtract(entry).multiply(qty) : BigDecimal.ZERO;
        return Position.builder()
                .symbol(symbol)
                .venue(venue)
                .side(qty.signum() > 0 ? Side.BUY : Side.SELL)
                .qty(qty.abs())
                .entryPrice(entry)
                .markPrice(mark)
                .unrealizedPnl(move)
                .build();
    }

    private void notifyListeners(Order order) {
        Order snapshot = order.toBuilder().build();
        for (Consumer<Order> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.warn("{} order listener failed for {}: {}", venue, order.getId(), e.getMessage());
            }
        }
    }
}
