package com.fundingarb.marketdata;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.MarketDataConfig;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.FundingRate;
import com.fundingarb.domain.model.FundingSnapshot;
import com.fundingarb.domain.model.OrderbookDepthSnapshot;
import com.fundingarb.domain.model.OrderbookPair;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.exception.OrderbookDataException;
import com.fundingarb.port.ExchangePort;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cached funding, price and top-of-book state per symbol and venue.
 *
 * <p>The cache is hydrated by {@link #refresh()}, which the supervisor's market-data loop calls
 * periodically. Execution paths that need current prices call {@link #getFreshOrderbook}, which
 * retries the venue a bounded number of times and falls back to a recent cached snapshot rather
 * than blocking.
 *
 * <p>The service counts as healthy while at least one venue refreshed successfully within
 * {@code healthStaleMultiple} health-check intervals.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final ExchangeRegistry exchangeRegistry;
    private final MarketDataConfig marketDataConfig;
    private final Clock clock;

    private final Map<String, FundingSnapshot> fundingSnapshots = new ConcurrentHashMap<>();
    private final Map<Venue, Map<String, OrderbookSnapshot>> orderbooks = new EnumMap<>(Venue.class);
    private final Map<Venue, Instant> lastSuccessfulRefresh = new ConcurrentHashMap<>();
    private volatile List<String> symbols = List.of();

    public MarketDataService(ExchangeRegistry exchangeRegistry, MarketDataConfig marketDataConfig, Clock clock) {
        this.exchangeRegistry = exchangeRegistry;
        this.marketDataConfig = marketDataConfig;
        this.clock = clock;
        for (Venue venue : Venue.values()) {
            orderbooks.put(venue, new ConcurrentHashMap<>());
        }
    }

    // ========================
    // REFRESH
    // ========================

    /**
     * Reloads symbols, funding rates, mark prices and L1 books from both venues. A venue that fails
     * keeps its previous snapshots and does not update its refresh timestamp.
     */
    public void refresh() {
        refreshSymbols();
        Map<String, BigDecimal[]> rates = new ConcurrentHashMap<>();
        Map<String, BigDecimal[]> prices = new ConcurrentHashMap<>();

        for (Venue venue : Venue.values()) {
            ExchangePort exchange = exchangeRegistry.get(venue);
            int index = venue == Venue.LIGHTER ? 0 : 1;
            int failures = 0;
            for (String symbol : symbols) {
                try {
                    FundingRate rate = exchange.getFundingRate(symbol);
                    BigDecimal mark = exchange.getMarkPrice(symbol);
                    OrderbookSnapshot book = exchange.getOrderbookL1(symbol);
                    rates.computeIfAbsent(symbol, s -> new BigDecimal[2])[index] = rate.getHourlyRate();
                    prices.computeIfAbsent(symbol, s -> new BigDecimal[2])[index] = mark;
                    storeOrderbook(venue, symbol, book);
                } catch (RuntimeException e) {
                    failures++;
                    log.warn("Market data refresh failed for {} on {}: {}", symbol, venue, e.getMessage());
                }
            }
            if (failures < symbols.size() || symbols.isEmpty()) {
                lastSuccessfulRefresh.put(venue, clock.instant());
            }
        }

        Instant now = clock.instant();
        for (String symbol : symbols) {
            FundingSnapshot previous = fundingSnapshots.get(symbol);
            BigDecimal[] r = rates.getOrDefault(symbol, new BigDecimal[2]);
            BigDecimal[] p = prices.getOrDefault(symbol, new BigDecimal[2]);
            if (r[0] == null && r[1] == null && p[0] == null && p[1] == null) {
                continue;
            }
            fundingSnapshots.put(symbol, FundingSnapshot.builder()
                    .symbol(symbol)
                    .lighterRate(pick(r[0], previous != null ? previous.getLighterRate() : null))
                    .x10Rate(pick(r[1], previous != null ? previous.getX10Rate() : null))
                    .lighterPrice(pick(p[0], previous != null ? previous.getLighterPrice() : null))
                    .x10Price(pick(p[1], previous != null ? previous.getX10Price() : null))
                    .updatedAt(now)
                    .build());
        }
        log.debug("Market data refreshed for {} symbols", symbols.size());
    }

    private void refreshSymbols() {
        try {
            Set<String> common = new HashSet<>(exchangeRegistry.lighter().listSymbols());
            common.retainAll(exchangeRegistry.x10().listSymbols());
            List<String> sorted = new ArrayList<>(common);
            sorted.sort(String::compareTo);
            symbols = List.copyOf(sorted);
        } catch (RuntimeException e) {
            log.warn("Symbol list refresh failed, keeping {} known symbols: {}", symbols.size(), e.getMessage());
        }
    }

    // ========================
    // QUERIES
    // ========================

    public List<String> getSymbols() {
        return symbols;
    }

    public Optional<FundingSnapshot> getFundingSnapshot(String symbol) {
        return Optional.ofNullable(fundingSnapshots.get(symbol));
    }

    public Optional<OrderbookSnapshot> getCachedOrderbook(String symbol, Venue venue) {
        return Optional.ofNullable(orderbooks.get(venue).get(symbol));
    }

    public Optional<OrderbookPair> getCachedOrderbookPair(String symbol) {
        OrderbookSnapshot lighter = orderbooks.get(Venue.LIGHTER).get(symbol);
        OrderbookSnapshot x10 = orderbooks.get(Venue.X10).get(symbol);
        if (lighter == null || x10 == null) {
            return Optional.empty();
        }
        return Optional.of(new OrderbookPair(lighter, x10));
    }

    /** Mark price from the cache, falling back to a direct venue call. */
    public BigDecimal getMarkPrice(String symbol, Venue venue) {
        FundingSnapshot snapshot = fundingSnapshots.get(symbol);
        if (snapshot != null) {
            BigDecimal cached = venue == Venue.LIGHTER ? snapshot.getLighterPrice() : snapshot.getX10Price();
            if (cached != null && cached.signum() > 0) {
                return cached;
            }
        }
        return exchangeRegistry.get(venue).getMarkPrice(symbol);
    }

    public OrderbookDepthSnapshot getDepth(String symbol, Venue venue) {
        return exchangeRegistry.get(venue).getOrderbookDepth(symbol, marketDataConfig.getDepthLevels());
    }

    public boolean isHealthy() {
        Duration window = marketDataConfig.getHealthCheckInterval().multipliedBy(marketDataConfig.getHealthStaleMultiple());
        Instant cutoff = clock.instant().minus(window);
        return lastSuccessfulRefresh.values().stream().anyMatch(t -> t.isAfter(cutoff));
    }

    public Map<Venue, Instant> getLastSuccessfulRefresh() {
        return Map.copyOf(lastSuccessfulRefresh);
    }

    // ========================
    // FRESH ORDERBOOK
    // ========================

    /**
     * Fetches a current L1 book with depth on both sides.
     *
     * <p>Retries up to {@code freshOrderbookAttempts} times with a linearly growing delay. When no
     * attempt yields a usable book, returns the cached snapshot if it is younger than
     * {@code fallbackMaxAge}.
     *
     * @throws OrderbookDataException if neither a fresh nor a recent cached book is usable
     */
    public OrderbookSnapshot getFreshOrderbook(String symbol, Venue venue) {
        ExchangePort exchange = exchangeRegistry.get(venue);
        int attempts = Math.max(1, marketDataConfig.getFreshOrderbookAttempts());
        String lastProblem = "no data";

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                OrderbookSnapshot fresh = exchange.getOrderbookL1(symbol);
                OrderbookSnapshot merged = storeOrderbook(venue, symbol, fresh);
                if (merged.hasDepth()
                        && !merged.isOlderThan(marketDataConfig.getFallbackMaxAge(), clock.instant())) {
                    return merged;
                }
                lastProblem = "book without depth (bid=" + merged.getBestBid() + ", ask=" + merged.getBestAsk() + ")";
            } catch (RuntimeException e) {
                lastProblem = e.getMessage();
                log.debug("Fresh orderbook attempt {}/{} failed for {} on {}: {}", attempt, attempts, symbol, venue,
                        e.getMessage());
            }
            if (attempt < attempts && !sleep(marketDataConfig.getFreshOrderbookBaseDelay().multipliedBy(attempt))) {
                break;
            }
        }

        OrderbookSnapshot cached = orderbooks.get(venue).get(symbol);
        if (cached != null
                && cached.hasDepth()
                && !cached.isOlderThan(marketDataConfig.getFallbackMaxAge(), clock.instant())) {
            log.warn("Using cached orderbook for {} on {} after failed refresh: {}", symbol, venue, lastProblem);
            return cached;
        }
        throw new OrderbookDataException(symbol, venue, lastProblem);
    }

    /**
     * Merges a fresh snapshot over the cached one: a side that is zero in the fresh data keeps the
     * previous value, and a merged book that ends up crossed is discarded in favour of the fresh one.
     */
    static OrderbookSnapshot merge(OrderbookSnapshot previous, OrderbookSnapshot fresh) {
        if (previous == null) {
            return fresh;
        }
        boolean freshBid = fresh.getBestBid().signum() > 0 && fresh.getBestBidQty().signum() > 0;
        boolean freshAsk = fresh.getBestAsk().signum() > 0 && fresh.getBestAskQty().signum() > 0;
        if (freshBid && freshAsk) {
            return fresh;
        }
        OrderbookSnapshot merged = fresh.toBuilder()
                .bestBid(freshBid ? fresh.getBestBid() : previous.getBestBid())
                .bestBidQty(freshBid ? fresh.getBestBidQty() : previous.getBestBidQty())
                .bestAsk(freshAsk ? fresh.getBestAsk() : previous.getBestAsk())
                .bestAskQty(freshAsk ? fresh.getBestAskQty() : previous.getBestAskQty())
                .updatedAt(previous.getUpdatedAt())
                .build();
        if (merged.getBestBid().signum() > 0
                && merged.getBestAsk().signum() > 0
                && merged.getBestBid().compareTo(merged.getBestAsk()) >= 0) {
            return fresh;
        }
        return merged;
    }

    private OrderbookSnapshot storeOrderbook(Venue venue, String symbol, OrderbookSnapshot fresh) {
        if (fresh.getUpdatedAt() == null) {
            fresh = fresh.toBuilder().updatedAt(clock.instant()).build();
        }
        OrderbookSnapshot merged = merge(orderbooks.get(venue).get(symbol), fresh);
        orderbooks.get(venue).put(symbol, merged);
        return merged;
    }

    private static BigDecimal pick(BigDecimal fresh, BigDecimal previous) {
        return fresh != null ? fresh : previous;
    }

    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
