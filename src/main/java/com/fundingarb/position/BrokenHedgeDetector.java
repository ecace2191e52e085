package com.fundingarb.position;

import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Trade;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Debounces "one leg present, the other gone" observations.
 *
 * <p>A hedge is reported broken only after {@code broken-hedge-confirmations} observations of the
 * same missing venue, each at least {@code broken-hedge-min-spacing} after the previous one.
 * Observations closer together than that are ignored; a hit older than
 * {@code broken-hedge-hit-expiry}, a different missing venue, or a healthy observation starts over.
 */
@Component
public class BrokenHedgeDetector {

    private static final Logger log = LoggerFactory.getLogger(BrokenHedgeDetector.class);

    private final PositionConfig positionConfig;
    private final Map<String, Hit> hits = new ConcurrentHashMap<>();

    public BrokenHedgeDetector(PositionConfig positionConfig) {
        this.positionConfig = positionConfig;
    }

    /**
     * Records one observation of the trade's live legs.
     *
     * @return the venue whose leg is confirmed missing, or empty
     */
    public Optional<Venue> observe(Trade trade, BigDecimal leg1LiveQty, BigDecimal leg2LiveQty, Instant now) {
        Instant openedAt = trade.getOpenedAt() != null ? trade.getOpenedAt() : trade.getCreatedAt();
        if (openedAt != null && Duration.between(openedAt, now).compareTo(positionConfig.getBrokenHedgeMinTradeAge()) < 0) {
            return Optional.empty();
        }
        BigDecimal threshold = positionConfig.getPositionQtyThreshold();
        boolean leg1Present = leg1LiveQty.abs().compareTo(threshold) > 0;
        boolean leg2Present = leg2LiveQty.abs().compareTo(threshold) > 0;
        if (leg1Present == leg2Present) {
            clear(trade.getId());
            return Optional.empty();
        }
        Venue missing = leg1Present ? trade.getLeg2().getVenue() : trade.getLeg1().getVenue();

        Hit hit = hits.get(trade.getId());
        if (hit == null
                || hit.missing != missing
                || Duration.between(hit.lastAt, now).compareTo(positionConfig.getBrokenHedgeHitExpiry()) > 0) {
            hits.put(trade.getId(), new Hit(missing, 1, now));
            log.warn("Potential broken hedge on {} (trade {}): {} leg missing, awaiting confirmation",
                    trade.getSymbol(), trade.getId(), missing);
            return confirmedIfEnough(trade, 1, missing);
        }
        if (Duration.between(hit.lastAt, now).compareTo(positionConfig.getBrokenHedgeMinSpacing()) < 0) {
            return Optional.empty();
        }
        int count = hit.count + 1;
        hits.put(trade.getId(), new Hit(missing, count, now));
        log.warn("Broken hedge observation {}/{} on {}: {} leg missing", count,
                positionConfig.getBrokenHedgeConfirmations(), trade.getSymbol(), missing);
        return confirmedIfEnough(trade, count, missing);
    }

    public void clear(String tradeId) {
        hits.remove(tradeId);
    }

    private Optional<Venue> confirmedIfEnough(Trade trade, int count, Venue missing) {
        if (count < positionConfig.getBrokenHedgeConfirmations()) {
            return Optional.empty();
        }
        hits.remove(trade.getId());
        return Optional.of(missing);
    }

    private static final class Hit {

        private final Venue missing;
        private final int count;
        private final Instant lastAt;

        private Hit(Venue missing, int count, Instant lastAt) {
            this.missing = missing;
            this.count = count;
            this.lastAt = lastAt;
        }
    }
}
