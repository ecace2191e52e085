package com.fundingarb.oms;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.config.FeeConfig;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TimeInForce;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.domain.model.Position;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import com.fundingarb.exception.InsufficientBalanceException;
import com.fundingarb.exception.OrderRejectedException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.port.ExchangePort;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Leg 1: chases a maker fill for the trade's target quantity.
 *
 * <p>The total timeout is split across attempts. Each attempt re-reads the book, prices a
 * POST_ONLY order according to its aggressiveness (GTC on the final attempt unless
 * {@code makerForcePostOnly}), waits for its share of the budget and cancels what is left.
 *
 * <p>Fills are accumulated as notional, so the leg's entry price is the fill-weighted average, and
 * fees are pro-rated to the quantity credited. Before each re-attempt the live position is read:
 * quantity the order channel never reported ("ghost fills") is credited at the last known price,
 * and reported fills are clamped to what the position actually shows.
 *
 * <p>The executor only fills the leg. Deciding whether the fill is enough, and rolling back if
 * not, is the caller's job.
 */
@Component
public class Leg1Executor {

    private static final Logger log = LoggerFactory.getLogger(Leg1Executor.class);

    private static final BigDecimal QTY_EPSILON = new BigDecimal("0.00000001");

    private final ExchangeRegistry exchangeRegistry;
    private final MarketDataService marketDataService;
    private final FillWaiter fillWaiter;
    private final ExecutionConfig executionConfig;
    private final FeeConfig feeConfig;

    public Leg1Executor(
            ExchangeRegistry exchangeRegistry,
            MarketDataService marketDataService,
            FillWaiter fillWaiter,
            ExecutionConfig executionConfig,
            FeeConfig feeConfig) {
        this.exchangeRegistry = exchangeRegistry;
        this.marketDataService = marketDataService;
        this.fillWaiter = fillWaiter;
        this.executionConfig = executionConfig;
        this.feeConfig = feeConfig;
    }

    /**
     * Fills {@code trade.leg1} as far as possible within the timeout budget.
     *
     * @throws InsufficientBalanceException immediately; fills from earlier attempts are still
     *     written to the leg
     */
    public void execute(Trade trade) {
        TradeLeg leg = trade.getLeg1();
        String symbol = trade.getSymbol();
        ExchangePort exchange = exchangeRegistry.get(leg.getVenue());
        MarketInfo info = exchange.getMarketInfo(symbol);

        FillAccumulator fills = new FillAccumulator(leg);
        try {
            chase(exchange, trade, info, fills);
        } finally {
            fills.writeTo(leg);
        }
    }

    private void chase(ExchangePort exchange, Trade trade, MarketInfo info, FillAccumulator fills) {
        TradeLeg leg = trade.getLeg1();
        String symbol = trade.getSymbol();
        BigDecimal target = leg.getQty();
        BigDecimal successQty = target.multiply(executionConfig.getFillSuccessRatio());
        BigDecimal baseline = signedPosition(exchange, symbol).orElse(BigDecimal.ZERO);

        int maxAttempts = executionConfig.getLeg1MaxAttempts();
        List<Duration> timeouts = MakerPricing.attemptTimeouts(
                executionConfig.getLeg1TotalTimeout(),
                maxAttempts,
                executionConfig.getLeg1MinAttemptTimeout(),
                executionConfig.getLeg1AttemptSchedule());

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Leg1 for {} interrupted after {} filled", symbol, fills.filled);
                break;
            }
            if (attempt > 0) {
                absorbGhostFills(exchange, trade, fills, baseline);
            }
            if (fills.filled.compareTo(successQty) >= 0) {
                break;
            }
            BigDecimal remaining = info.roundQty(target.subtract(fills.filled));
            if (remaining.compareTo(info.getMinQty()) < 0) {
                break;
            }

            OrderbookSnapshot book = marketDataService.getFreshOrderbook(symbol, leg.getVenue());
            BigDecimal oppositeQty = leg.getSide() == Side.BUY ? book.getBestAskQty() : book.getBestBidQty();
            BigDecimal aggressiveness =
                    MakerPricing.aggressiveness(attempt, maxAttempts, remaining, oppositeQty, executionConfig);
            BigDecimal price = MakerPricing.makerPrice(leg.getSide(), book, aggressiveness, info);
            boolean lastAttempt = attempt == maxAttempts - 1;
            TimeInForce tif = lastAttempt && !executionConfig.isMakerForcePostOnly() ? TimeInForce.GTC : TimeInForce.POST_ONLY;

            Order placed;
            try {
                placed = exchange.placeOrder(OrderRequest.limit(symbol, leg.getSide(), remaining, price, tif));
            } catch (InsufficientBalanceException e) {
                log.error("Leg1 {} {} aborted on {}: {}", leg.getSide(), symbol, leg.getVenue(), e.getMessage());
                throw e;
            } catch (OrderRejectedException e) {
                log.info("Leg1 attempt {}/{} for {} rejected: {}", attempt + 1, maxAttempts, symbol, e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.warn("Leg1 attempt {}/{} for {} failed: {}", attempt + 1, maxAttempts, symbol, e.getMessage());
                sleep(executionConfig.getGenericErrorRetryDelay());
                continue;
            }
            leg.setOrderId(placed.getId());
            log.info("Leg1 attempt {}/{}: {} {} {} @ {} ({}, aggressiveness {})", attempt + 1, maxAttempts,
                    leg.getSide(), remaining, symbol, price, tif, aggressiveness);

            Order result = fillWaiter.awaitTerminal(exchange, placed, timeouts.get(attempt));
            if (result.getStatus() == null || !result.getStatus().isTerminal()) {
                result = fillWaiter.cancelAndFetch(exchange, result);
            }
            BigDecimal reported = result.getFilledQty() != null ? result.getFilledQty() : BigDecimal.ZERO;
            BigDecimal credited = clampToPosition(exchange, symbol, leg.getSide(), baseline, fills, reported);
            if (credited.signum() > 0) {
                BigDecimal fillPrice = result.getAvgFillPrice() != null ? result.getAvgFillPrice() : price;
                BigDecimal fee = proRatedFee(result, reported, credited, fillPrice, feeConfig.makerFee(leg.getVenue()));
                fills.add(credited, fillPrice, fee);
                log.info("Leg1 {} filled {} @ {} (total {}/{})", symbol, credited, fillPrice, fills.filled, target);
            }
        }

        if (executionConfig.isLeg1EscalateToTaker() && !Thread.currentThread().isInterrupted()) {
            escalateToTaker(exchange, trade, info, fills, successQty);
        }
    }

    // ========================
    // GHOST FILLS
    // ========================

    private void absorbGhostFills(ExchangePort exchange, Trade trade, FillAccumulator fills, BigDecimal baseline) {
        TradeLeg leg = trade.getLeg1();
        Optional<BigDecimal> observed = observedFill(exchange, trade.getSymbol(), leg.getSide(), baseline);
        if (observed.isEmpty()) {
            return;
        }
        BigDecimal ghost = observed.get().subtract(fills.filled).min(leg.getQty().subtract(fills.filled));
        if (ghost.compareTo(QTY_EPSILON) <= 0) {
            return;
        }
        BigDecimal price = fills.lastPrice != null
                ? fills.lastPrice
                : marketDataService.getMarkPrice(trade.getSymbol(), leg.getVenue());
        BigDecimal fee = ghost.multiply(price).multiply(feeConfig.makerFee(leg.getVenue()));
        fills.add(ghost, price, fee);
        log.warn("Leg1 {} absorbed ghost fill of {} @ {} seen on {} position", trade.getSymbol(), ghost, price,
                leg.getVenue());
    }

    /** Reported fill limited to what the position moved beyond fills already credited. */
    private BigDecimal clampToPosition(
            ExchangePort exchange,
            String symbol,
            Side side,
            BigDecimal baseline,
            FillAccumulator fills,
            BigDecimal reported) {
        if (reported.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        Optional<BigDecimal> observed = observedFill(exchange, symbol, side, baseline);
        if (observed.isEmpty()) {
            return reported;
        }
        BigDecimal room = observed.get().subtract(fills.filled).max(BigDecimal.ZERO);
        if (reported.compareTo(room.add(QTY_EPSILON)) > 0) {
            log.warn("Leg1 {} reported fill {} exceeds position change {}, crediting {}", symbol, reported, room, room);
            return room;
        }
        return reported;
    }

    /** Position change since the leg started, in the leg's direction. */
    private Optional<BigDecimal> observedFill(ExchangePort exchange, String symbol, Side side, BigDecimal baseline) {
        return signedPosition(exchange, symbol).map(current -> {
            BigDecimal delta = current.subtract(baseline);
            return side == Side.BUY ? delta : delta.negate();
        });
    }

    private Optional<BigDecimal> signedPosition(ExchangePort exchange, String symbol) {
        try {
            return Optional.of(exchange.getPosition(symbol).map(Position::signedQty).orElse(BigDecimal.ZERO));
        } catch (RuntimeException e) {
            log.debug("Position read for {} on {} failed: {}", symbol, exchange.getVenue(), e.getMessage());
            return Optional.empty();
        }
    }

    // ========================
    // TAKER ESCALATION
    // ========================

    private void escalateToTaker(
            ExchangePort exchange, Trade trade, MarketInfo info, FillAccumulator fills, BigDecimal successQty) {
        TradeLeg leg = trade.getLeg1();
        BigDecimal remaining = info.roundQty(leg.getQty().subtract(fills.filled));
        if (fills.filled.compareTo(successQty) >= 0 || remaining.compareTo(info.getMinQty()) < 0) {
            return;
        }
        try {
            OrderbookSnapshot book = marketDataService.getFreshOrderbook(trade.getSymbol(), leg.getVenue());
            BigDecimal base = leg.getSide() == Side.BUY ? book.getBestAsk() : book.getBestBid();
            BigDecimal price = MakerPricing.crossingPrice(leg.getSide(), base, executionConfig.getLeg1TakerSlippage(), info);
            Order placed = exchange.placeOrder(
                    OrderRequest.limit(trade.getSymbol(), leg.getSide(), remaining, price, TimeInForce.IOC));
            Order result = fillWaiter.awaitTerminal(exchange, placed, executionConfig.getHedgeFillTimeout());
            if (!result.getStatus().isTerminal()) {
                result = fillWaiter.cancelAndFetch(exchange, result);
            }
            if (result.hasFill()) {
                BigDecimal fillPrice = result.getAvgFillPrice() != null ? result.getAvgFillPrice() : price;
                BigDecimal fee = proRatedFee(result, result.getFilledQty(), result.getFilledQty(), fillPrice,
                        feeConfig.takerFee(leg.getVenue()));
                fills.add(result.getFilledQty(), fillPrice, fee);
                log.info("Leg1 {} taker escalation filled {} @ {}", trade.getSymbol(), result.getFilledQty(), fillPrice);
            }
        } catch (InsufficientBalanceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Leg1 {} taker escalation failed: {}", trade.getSymbol(), e.getMessage());
        }
    }

    // ========================
    // INTERNALS
    // ========================

    /** Venue fee scaled to the credited share of the fill, or the configured rate when none was reported. */
    static BigDecimal proRatedFee(
            Order result, BigDecimal reported, BigDecimal credited, BigDecimal price, BigDecimal feeRate) {
        if (result.getFee() != null && result.getFee().signum() > 0 && reported.signum() > 0) {
            return result.getFee().multiply(credited).divide(reported, MathContext.DECIMAL64);
        }
        return credited.multiply(price).multiply(feeRate);
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Running totals for one leg; entry price is notional / filled. */
    public static final class FillAccumulator {

        private BigDecimal filled;
        private BigDecimal notional;
        private BigDecimal fees;
        private BigDecimal lastPrice;

        public FillAccumulator(TradeLeg leg) {
            this.filled = leg.getFilledQty();
            this.notional = leg.getEntryPrice() != null ? leg.getFilledQty().multiply(leg.getEntryPrice()) : BigDecimal.ZERO;
            this.fees = leg.getFees();
            this.lastPrice = leg.getEntryPrice();
        }

        public void add(BigDecimal qty, BigDecimal price, BigDecimal fee) {
            filled = filled.add(qty);
            notional = notional.add(qty.multiply(price));
            fees = fees.add(fee);
            lastPrice = price;
        }

        public BigDecimal filled() {
            return filled;
        }

        public void writeTo(TradeLeg leg) {
            leg.setFilledQty(filled);
            leg.setFees(fees);
            if (filled.signum() > 0) {
                leg.setEntryPrice(notional.divide(filled, MathContext.DECIMAL64));
            }
        }
    }
}
