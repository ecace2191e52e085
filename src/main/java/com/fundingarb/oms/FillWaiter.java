package com.fundingarb.oms;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.domain.model.Order;
import com.fundingarb.port.ExchangePort;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Waits for venue orders to reach a terminal status.
 *
 * <p>Order updates pushed by the venues complete a per-order future. Because a push may be missed
 * (or arrive before the waiter registers), every wait also polls {@code getOrder} at
 * {@code fillPollInterval}. Terminal updates that arrive before anyone waits are kept in a small
 * bounded cache. All waits end at their deadline; the caller decides whether to cancel.
 *
 * <p>An interrupted wait returns the last known order and leaves the interrupt flag set.
 */
@Component
public class FillWaiter {

    private static final Logger log = LoggerFactory.getLogger(FillWaiter.class);

    private static final int RECENT_CAPACITY = 1000;

    private final ExecutionConfig executionConfig;
    private final ConcurrentHashMap<String, CompletableFuture<Order>> pending = new ConcurrentHashMap<>();
    private final Map<String, Order> recentTerminal = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Order> eldest) {
            return size() > RECENT_CAPACITY;
        }
    };

    public FillWaiter(ExchangeRegistry exchangeRegistry, ExecutionConfig executionConfig) {
        this.executionConfig = executionConfig;
        exchangeRegistry.all().forEach(exchange -> exchange.subscribeOrders(this::onOrderUpdate));
    }

    /** Called from venue threads; must not block. */
    void onOrderUpdate(Order order) {
        if (order == null || order.getId() == null || order.getStatus() == null || !order.getStatus().isTerminal()) {
            return;
        }
        synchronized (recentTerminal) {
            recentTerminal.put(order.getId(), order);
        }
        CompletableFuture<Order> future = pending.get(order.getId());
        if (future != null) {
            future.complete(order);
        }
    }

    /**
     * Waits up to {@code timeout} for the order to become terminal.
     *
     * @return the terminal order, or the latest known snapshot if the deadline passed first
     */
    public Order awaitTerminal(ExchangePort exchange, Order placed, Duration timeout) {
        if (placed.getStatus() != null && placed.getStatus().isTerminal()) {
            return placed;
        }
        String orderId = placed.getId();
        CompletableFuture<Order> future = pending.computeIfAbsent(orderId, id -> new CompletableFuture<>());
        Order latest = placed;
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollMillis = Math.max(1, executionConfig.getFillPollInterval().toMillis());
        try {
            Order early = takeRecent(orderId);
            if (early != null) {
                return early;
            }
            while (true) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    log.debug("Fill wait for {} on {} reached its deadline in status {}", orderId, exchange.getVenue(),
                            latest.getStatus());
                    return latest;
                }
                try {
                    return future.get(Math.min(pollMillis, remainingMillis), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    Optional<Order> polled = poll(exchange, placed);
                    if (polled.isPresent()) {
                        latest = polled.get();
                        if (latest.getStatus() != null && latest.getStatus().isTerminal()) {
                            return latest;
                        }
                    }
                } catch (ExecutionException e) {
                    log.warn("Fill future for {} failed: {}", orderId, e.getMessage());
                    return latest;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Fill wait for {} on {} interrupted", orderId, exchange.getVenue());
                    return latest;
                }
            }
        } finally {
            pending.remove(orderId);
            takeRecent(orderId);
        }
    }

    /**
     * Cancels a working order and returns its final state, so fills that landed before the cancel
     * are not lost. A failed cancel is logged; the order is re-read either way.
     *
     * <p>An interrupted caller still gets its order cancelled: the flag is cleared for the venue
     * calls and restored afterwards.
     */
    public Order cancelAndFetch(ExchangePort exchange, Order order) {
        if (order.getStatus() != null && order.getStatus().isTerminal()) {
            return order;
        }
        boolean interrupted = Thread.interrupted();
        try {
            try {
                exchange.cancelOrder(order.getSymbol(), order.getId());
            } catch (RuntimeException e) {
                log.warn("Cancel of {} on {} failed: {}", order.getId(), exchange.getVenue(), e.getMessage());
            }
            return poll(exchange, order).orElse(order);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Optional<Order> poll(ExchangePort exchange, Order order) {
        try {
            return exchange.getOrder(order.getSymbol(), order.getId());
        } catch (RuntimeException e) {
            log.debug("getOrder for {} on {} failed: {}", order.getId(), exchange.getVenue(), e.getMessage());
            return Optional.empty();
        }
    }

    private Order takeRecent(String orderId) {
        synchronized (recentTerminal) {
            return recentTerminal.remove(orderId);
        }
    }
}
