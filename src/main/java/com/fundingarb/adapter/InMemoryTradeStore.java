package com.fundingarb.adapter;

import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeEventRecord;
import com.fundingarb.domain.model.TradeStats;
import com.fundingarb.exception.TradeNotFoundException;
import com.fundingarb.exception.ValidationException;
import com.fundingarb.port.TradeStorePort;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link TradeStorePort}.
 *
 * <p>All writes run under one lock, which makes the one-active-trade-per-symbol check and the
 * write atomic. Trades are stored and returned as copies.
 */
@Component
public class InMemoryTradeStore implements TradeStorePort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTradeStore.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Trade> trades = new LinkedHashMap<>();
    private final Map<String, List<TradeEventRecord>> events = new HashMap<>();

    public InMemoryTradeStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Trade createTrade(Trade trade) {
        lock.lock();
        try {
            Optional<Trade> existing = findBlocking(trade.getSymbol(), null);
            if (existing.isPresent()) {
                throw new ValidationException(
                        "Active trade " + existing.get().getId() + " already exists for " + trade.getSymbol(),
                        trade.getSymbol());
            }
            Trade stored = trade.copy();
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            if (stored.getCreatedAt() == null) {
                stored.setCreatedAt(clock.instant());
            }
            trades.put(stored.getId(), stored);
            log.debug("Created trade {} for {}", stored.getId(), stored.getSymbol());
            return stored.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Trade updateTrade(Trade trade) {
        lock.lock();
        try {
            if (!trades.containsKey(trade.getId())) {
                throw new TradeNotFoundException(trade.getId());
            }
            if (!trade.getStatus().isTerminal()) {
                Optional<Trade> other = findBlocking(trade.getSymbol(), trade.getId());
                if (other.isPresent()) {
                    throw new ValidationException(
                            "Trade " + other.get().getId() + " is already active for " + trade.getSymbol(),
                            trade.getSymbol());
                }
            }
            Trade stored = trade.copy();
            trades.put(stored.getId(), stored);
            return stored.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Trade> getTrade(String tradeId) {
        lock.lock();
        try {
            return Optional.ofNullable(trades.get(tradeId)).map(Trade::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Trade> findActiveBySymbol(String symbol) {
        lock.lock();
        try {
            return findBlocking(symbol, null).map(Trade::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Trade> listOpenTrades() {
        lock.lock();
        try {
            return trades.values().stream()
                    .filter(t -> !t.getStatus().isTerminal())
                    .map(Trade::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Trade> listByStatus(TradeStatus status) {
        lock.lock();
        try {
            return trades.values().stream()
                    .filter(t -> t.getStatus() == status)
                    .map(Trade::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendEvent(String tradeId, String eventType, Map<String, Object> payload) {
        lock.lock();
        try {
            events.computeIfAbsent(tradeId, id -> new ArrayList<>())
                    .add(TradeEventRecord.builder()
                            .tradeId(tradeId)
                            .eventType(eventType)
                            .payload(payload != null ? new HashMap<>(payload) : Map.of())
                            .timestamp(clock.instant())
                            .build());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<TradeEventRecord> getEvents(String tradeId) {
        lock.lock();
        try {
            return new ArrayList<>(events.getOrDefault(tradeId, List.of()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Instant> lastClosedAt(String symbol) {
        lock.lock();
        try {
            return trades.values().stream()
                    .filter(t -> t.getSymbol().equals(symbol) && t.getStatus() == TradeStatus.CLOSED)
                    .map(Trade::getClosedAt)
                    .filter(Objects::nonNull)
                    .max(Comparator.naturalOrder());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TradeStats getStats() {
        lock.lock();
        try {
            int open = 0;
            int closed = 0;
            int aborted = 0;
            int winners = 0;
            BigDecimal pnl = BigDecimal.ZERO;
            BigDecimal fees = BigDecimal.ZERO;
            BigDecimal funding = BigDecimal.ZERO;
            for (Trade trade : trades.values()) {
                if (trade.getStatus() == TradeStatus.CLOSED) {
                    closed++;
                    BigDecimal realized = trade.getRealizedPnl() != null ? trade.getRealizedPnl() : BigDecimal.ZERO;
                    pnl = pnl.add(realized);
                    if (realized.signum() > 0) {
                        winners++;
                    }
                } else if (trade.getStatus() == TradeStatus.ABORTED) {
                    aborted++;
                } else if (!trade.getStatus().isTerminal()) {
                    open++;
                }
                fees = fees.add(trade.totalFees());
                funding = funding.add(trade.getFundingCollected());
            }
            return TradeStats.builder()
                    .openTrades(open)
                    .closedTrades(closed)
                    .abortedTrades(aborted)
                    .winningTrades(winners)
                    .totalRealizedPnl(pnl)
                    .totalFees(fees)
                    .totalFundingCollected(funding)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanupBefore(Instant cutoff) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<Trade> it = trades.values().iterator();
            while (it.hasNext()) {
                Trade trade = it.next();
                Instant ended = trade.getClosedAt() != null ? trade.getClosedAt() : trade.getCreatedAt();
                if (trade.getStatus().isTerminal() && ended != null && ended.isBefore(cutoff)) {
                    it.remove();
                    events.remove(trade.getId());
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Removed {} terminal trades older than {}", removed, cutoff);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** A non-terminal trade for the symbol, other than {@code excludeId}. Caller holds the lock. */
    private Optional<Trade> findBlocking(String symbol, String excludeId) {
        return trades.values().stream()
                .filter(t -> t.getSymbol().equals(symbol))
                .filter(t -> !t.getStatus().isTerminal())
                .filter(t -> excludeId == null || !t.getId().equals(excludeId))
                .findFirst();
    }
}
