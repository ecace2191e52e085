package com.fundingarb.port;

import com.fundingarb.domain.enums.TradeStatus;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeEventRecord;
import com.fundingarb.domain.model.TradeStats;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of trades: the single source of truth for what the engine intends to hold.
 *
 * <p>Writes are serialised. Reads return copies, so a caller holding a trade never sees another
 * writer's changes until it reads again.
 */
public interface TradeStorePort {

    /**
     * Stores a new trade.
     *
     * @throws com.fundingarb.exception.ValidationException if another active trade exists for the symbol
     */
    Trade createTrade(Trade trade);

    /**
     * Replaces the stored trade with the given copy.
     *
     * @throws com.fundingarb.exception.TradeNotFoundException if the trade is unknown
     */
    Trade updateTrade(Trade trade);

    Optional<Trade> getTrade(String tradeId);

    Optional<Trade> findActiveBySymbol(String symbol);

    /** Trades that are not yet terminal: PENDING, OPENING, OPEN and CLOSING. */
    List<Trade> listOpenTrades();

    List<Trade> listByStatus(TradeStatus status);

    void appendEvent(String tradeId, String eventType, Map<String, Object> payload);

    List<TradeEventRecord> getEvents(String tradeId);

    /** Close time of the most recently closed trade for the symbol. */
    Optional<Instant> lastClosedAt(String symbol);

    TradeStats getStats();

    /** Deletes terminal trades (and their events) that ended before the cutoff. */
    int cleanupBefore(Instant cutoff);
}
