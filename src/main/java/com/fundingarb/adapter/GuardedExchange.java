package com.fundingarb.adapter;

import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Balance;
import com.fundingarb.domain.model.FundingRate;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.OrderbookDepthSnapshot;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.domain.model.Position;
import com.fundingarb.exception.BaseException;
import com.fundingarb.exception.ExchangeConnectionException;
import com.fundingarb.exception.ExchangeException;
import com.fundingarb.exception.OrderCancelFailedException;
import com.fundingarb.exception.OrderTimeoutException;
import com.fundingarb.port.ExchangePort;
import io.github.resilience4j.retry.Retry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a venue adapter with a per-call timeout and, for idempotent calls, a bounded retry.
 *
 * <p>Reads and cancels go through the resilience4j {@code venue} retry. Order placement is bounded
 * by the timeout but never retried: a placement that timed out may still have reached the venue,
 * and the caller reconciles through positions instead.
 */
public class GuardedExchange implements ExchangePort {

    private static final Logger log = LoggerFactory.getLogger(GuardedExchange.class);

    private final ExchangePort delegate;
    private final Retry retry;
    private final Duration callTimeout;
    private final ExecutorService callExecutor;

    public GuardedExchange(ExchangePort delegate, Retry retry, Duration callTimeout, ExecutorService callExecutor) {
        this.delegate = delegate;
        this.retry = retry;
        this.callTimeout = callTimeout;
        this.callExecutor = callExecutor;
    }

    @Override
    public Venue getVenue() {
        return delegate.getVenue();
    }

    @Override
    public List<String> listSymbols() {
        return read("listSymbols", delegate::listSymbols);
    }

    @Override
    public Order placeOrder(OrderRequest request) {
        try {
            return timed("placeOrder", () -> delegate.placeOrder(request));
        } catch (ExchangeConnectionException e) {
            throw new OrderTimeoutException(request.getSymbol(), getVenue(), null,
                    "placeOrder did not complete within " + callTimeout.toMillis() + "ms: " + e.getMessage());
        }
    }

    @Override
    public void cancelOrder(String symbol, String orderId) {
        try {
            read("cancelOrder", () -> {
                delegate.cancelOrder(symbol, orderId);
                return null;
            });
        } catch (ExchangeException e) {
            throw new OrderCancelFailedException(symbol, getVenue(), orderId, e);
        }
    }

    @Override
    public Optional<Order> getOrder(String symbol, String orderId) {
        return read("getOrder", () -> delegate.getOrder(symbol, orderId));
    }

    @Override
    public List<Order> getOpenOrders(String symbol) {
        return read("getOpenOrders", () -> delegate.getOpenOrders(symbol));
    }

    @Override
    public Optional<Position> getPosition(String symbol) {
        return read("getPosition", () -> delegate.getPosition(symbol));
    }

    @Override
    public List<Position> listPositions() {
        return read("listPositions", delegate::listPositions);
    }

    @Override
    public Balance getAvailableBalance() {
        return read("getAvailableBalance", delegate::getAvailableBalance);
    }

    @Override
    public OrderbookSnapshot getOrderbookL1(String symbol) {
        return read("getOrderbookL1", () -> delegate.getOrderbookL1(symbol));
    }

    @Override
    public OrderbookDepthSnapshot getOrderbookDepth(String symbol, int levels) {
        return read("getOrderbookDepth", () -> delegate.getOrderbookDepth(symbol, levels));
    }

    @Override
    public FundingRate getFundingRate(String symbol) {
        return read("getFundingRate", () -> delegate.getFundingRate(symbol));
    }

    @Override
    public BigDecimal getMarkPrice(String symbol) {
        return read("getMarkPrice", () -> delegate.getMarkPrice(symbol));
    }

    @Override
    public MarketInfo getMarketInfo(String symbol) {
        return read("getMarketInfo", () -> delegate.getMarketInfo(symbol));
    }

    @Override
    public void subscribeOrders(Consumer<Order> listener) {
        delegate.subscribeOrders(listener);
    }

    private <T> T read(String operation, Supplier<T> call) {
        return Retry.decorateSupplier(retry, () -> timed(operation, call)).get();
    }

    private <T> T timed(String operation, Supplier<T> call) {
        Future<T> future = callExecutor.submit(call::get);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} {} timed out after {}ms", getVenue(), operation, callTimeout.toMillis());
            throw new ExchangeConnectionException(getVenue(), operation + " timed out", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExchangeConnectionException(getVenue(), operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BaseException) {
                throw (BaseException) cause;
            }
            throw new ExchangeException(getVenue(), operation + " failed: " + cause.getMessage(), cause);
        }
    }
}
