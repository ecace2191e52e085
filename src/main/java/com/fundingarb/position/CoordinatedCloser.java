package com.fundingarb.position;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TimeInForce;
import com.fundingarb.domain.model.CloseResult;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.domain.model.Position;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.oms.FillWaiter;
import com.fundingarb.oms.MakerPricing;
import com.fundingarb.port.ExchangePort;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Places the orders that take a trade's legs flat. Does not touch trade status; the caller owns
 * the CLOSING/CLOSED transitions and the idempotency guard.
 *
 * <p>Coordinated close: reduce-only POST_ONLY orders on both legs at once, sharing one timeout.
 * Whatever is still open afterwards escalates, per leg, to a reduce-only IOC through the book and
 * then to a reduce-only MARKET order. Emergency closes skip the maker phase.
 *
 * <p>Quantities come from the live venue position when it can be read, so a close never sends
 * more than the venue holds.
 */
@Component
public class CoordinatedCloser {

    private static final Logger log = LoggerFactory.getLogger(CoordinatedCloser.class);

    private final ExchangeRegistry exchangeRegistry;
    private final MarketDataService marketDataService;
    private final FillWaiter fillWaiter;
    private final PositionConfig positionConfig;

    public CoordinatedCloser(
            ExchangeRegistry exchangeRegistry,
            MarketDataService marketDataService,
            FillWaiter fillWaiter,
            PositionConfig positionConfig) {
        this.exchangeRegistry = exchangeRegistry;
        this.marketDataService = marketDataService;
        this.fillWaiter = fillWaiter;
        this.positionConfig = positionConfig;
    }

    /** Closes both legs, maker first unless {@code emergency}. */
    public CloseResult close(Trade trade, boolean emergency) {
        List<TradeLeg> legs = List.of(trade.getLeg1(), trade.getLeg2());
        if (!emergency) {
            makerPhase(trade, legs);
        }
        for (TradeLeg leg : legs) {
            takerClose(trade, leg);
        }
        return result(trade);
    }

    /** Fallback when the coordinated path fails: one leg at a time, taker only. */
    public CloseResult closeSequentially(Trade trade) {
        log.warn("Closing {} (trade {}) leg by leg", trade.getSymbol(), trade.getId());
        for (TradeLeg leg : List.of(trade.getLeg1(), trade.getLeg2())) {
            try {
                takerClose(trade, leg);
            } catch (RuntimeException e) {
                log.error("Sequential close of {} on {} failed: {}", trade.getSymbol(), leg.getVenue(),
                        e.getMessage());
            }
        }
        return result(trade);
    }

    // ========================
    // MAKER PHASE
    // ========================

    private void makerPhase(Trade trade, List<TradeLeg> legs) {
        Map<TradeLeg, Order> resting = new LinkedHashMap<>();
        for (TradeLeg leg : legs) {
            BigDecimal open = openQty(trade, leg);
            if (open.compareTo(positionConfig.getPositionQtyThreshold()) <= 0) {
                continue;
            }
            try {
                ExchangePort exchange = exchangeRegistry.get(leg.getVenue());
                MarketInfo info = exchange.getMarketInfo(trade.getSymbol());
                Side closeSide = leg.getSide().inverse();
                OrderbookSnapshot book = marketDataService.getFreshOrderbook(trade.getSymbol(), leg.getVenue());
                BigDecimal price = MakerPricing.makerPrice(closeSide, book,
                        positionConfig.getCloseMakerAggressiveness(), info);
                Order placed = exchange.placeOrder(
                        OrderRequest.reduceOnlyLimit(trade.getSymbol(), closeSide, open, price, TimeInForce.POST_ONLY));
                resting.put(leg, placed);
                log.info("Close maker {} {} {} @ {} on {}", closeSide, open, trade.getSymbol(), price, leg.getVenue());
            } catch (RuntimeException e) {
                log.warn("Close maker order for {} on {} not placed: {}", trade.getSymbol(), leg.getVenue(),
                        e.getMessage());
            }
        }

        long deadline = System.nanoTime() + positionConfig.getCloseMakerTimeout().toNanos();
        for (Map.Entry<TradeLeg, Order> entry : resting.entrySet()) {
            TradeLeg leg = entry.getKey();
            ExchangePort exchange = exchangeRegistry.get(leg.getVenue());
            Duration left = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            Order result = fillWaiter.awaitTerminal(exchange, entry.getValue(), left);
            if (result.getStatus() == null || !result.getStatus().isTerminal()) {
                result = fillWaiter.cancelAndFetch(exchange, result);
            }
            recordExit(leg, result);
        }
    }

    // ========================
    // TAKER PHASE
    // ========================

    /** IOC through the book, then MARKET for any remainder. Returns the quantity closed. */
    public BigDecimal takerClose(Trade trade, TradeLeg leg) {
        BigDecimal closed = BigDecimal.ZERO;
        BigDecimal open = openQty(trade, leg);
        if (open.compareTo(positionConfig.getPositionQtyThreshold()) <= 0) {
            return closed;
        }
        ExchangePort exchange = exchangeRegistry.get(leg.getVenue());
        Side closeSide = leg.getSide().inverse();
        try {
            MarketInfo info = exchange.getMarketInfo(trade.getSymbol());
            OrderbookSnapshot book = marketDataService.getFreshOrderbook(trade.getSymbol(), leg.getVenue());
            BigDecimal base = closeSide == Side.BUY ? book.getBestAsk() : book.getBestBid();
            BigDecimal price = MakerPricing.crossingPrice(closeSide, base, positionConfig.getCloseIocSlippage(), info);
            closed = closed.add(submit(exchange, leg,
                    OrderRequest.reduceOnlyLimit(trade.getSymbol(), closeSide, open, price, TimeInForce.IOC)));
        } catch (RuntimeException e) {
            log.warn("Close IOC for {} on {} failed: {}", trade.getSymbol(), leg.getVenue(), e.getMessage());
        }

        open = openQty(trade, leg);
        if (open.compareTo(positionConfig.getPositionQtyThreshold()) > 0) {
            log.warn("Close of {} on {} still has {} open, sending MARKET", trade.getSymbol(), leg.getVenue(), open);
            closed = closed.add(submit(exchange, leg, OrderRequest.reduceOnlyMarket(trade.getSymbol(), closeSide, open)));
        }
        return closed;
    }

    /**
     * Reduces a leg by {@code qty} without closing it, maker first when {@code makerTimeout} is
     * set. Used by the rebalancer.
     */
    public BigDecimal reduce(Trade trade, TradeLeg leg, BigDecimal qty, Duration makerTimeout, boolean takerFallback) {
        ExchangePort exchange = exchangeRegistry.get(leg.getVenue());
        MarketInfo info = exchange.getMarketInfo(trade.getSymbol());
        Side side = leg.getSide().inverse();
        BigDecimal remaining = info.roundQty(qty);
        BigDecimal reduced = BigDecimal.ZERO;
        if (remaining.compareTo(info.getMinQty()) < 0) {
            return reduced;
        }
        OrderbookSnapshot book = marketDataService.getFreshOrderbook(trade.getSymbol(), leg.getVenue());
        if (makerTimeout != null && !makerTimeout.isZero()) {
            BigDecimal price = MakerPricing.makerPrice(side, book, positionConfig.getCloseMakerAggressiveness(), info);
            Order placed = exchange.placeOrder(
                    OrderRequest.reduceOnlyLimit(trade.getSymbol(), side, remaining, price, TimeInForce.POST_ONLY));
            Order result = fillWaiter.awaitTerminal(exchange, placed, makerTimeout);
            if (result.getStatus() == null || !result.getStatus().isTerminal()) {
                result = fillWaiter.cancelAndFetch(exchange, result);
            }
            reduced = reduced.add(filledOf(result));
            leg.addFees(result.getFee());
        }
        remaining = info.roundQty(qty.subtract(reduced));
        if (takerFallback && remaining.compareTo(info.getMinQty()) >= 0) {
            BigDecimal base = side == Side.BUY ? book.getBestAsk() : book.getBestBid();
            BigDecimal price = MakerPricing.crossingPrice(side, base, positionConfig.getCloseIocSlippage(), info);
            Order placed = exchange.placeOrder(
                    OrderRequest.reduceOnlyLimit(trade.getSymbol(), side, remaining, price, TimeInForce.IOC));
            Order result = fillWaiter.awaitTerminal(exchange, placed, positionConfig.getCloseIocTimeout());
            if (result.getStatus() == null || !result.getStatus().isTerminal()) {
                result = fillWaiter.cancelAndFetch(exchange, result);
            }
            reduced = reduced.add(filledOf(result));
            leg.addFees(result.getFee());
        }
        return reduced;
    }

    // ========================
    // INTERNALS
    // ========================

    private BigDecimal submit(ExchangePort exchange, TradeLeg leg, OrderRequest request) {
        try {
            Order placed = exchange.placeOrder(request);
            Order result = fillWaiter.awaitTerminal(exchange, placed, positionConfig.getCloseIocTimeout());
            if (result.getStatus() == null || !result.getStatus().isTerminal()) {
                result = fillWaiter.cancelAndFetch(exchange, result);
            }
            recordExit(leg, result);
            return filledOf(result);
        } catch (RuntimeException e) {
            log.error("Close order {} {} on {} failed: {}", request.getSide(), request.getQuantity(), leg.getVenue(),
                    e.getMessage());
            return BigDecimal.ZERO;
        }
    }

    private void recordExit(TradeLeg leg, Order result) {
        BigDecimal qty = filledOf(result);
        if (qty.signum() == 0) {
            return;
        }
        BigDecimal price = result.getAvgFillPrice() != null ? result.getAvgFillPrice() : result.getPrice();
        BigDecimal previousNotional = leg.getExitPrice() != null
                ? leg.getClosedQty().multiply(leg.getExitPrice())
                : BigDecimal.ZERO;
        BigDecimal closed = leg.getClosedQty().add(qty);
        if (price != null) {
            leg.setExitPrice(previousNotional.add(qty.multiply(price)).divide(closed, MathContext.DECIMAL64));
        }
        leg.setClosedQty(closed);
        leg.addFees(result.getFee());
        leg.setExitOrderId(result.getId());
    }

    /** Live quantity still open on the leg's side; falls back to the tracked remainder. */
    BigDecimal openQty(Trade trade, TradeLeg leg) {
        return liveQty(trade.getSymbol(), leg)
                .orElseGet(() -> leg.getFilledQty().subtract(leg.getClosedQty()).max(BigDecimal.ZERO));
    }

    private Optional<BigDecimal> liveQty(String symbol, TradeLeg leg) {
        try {
            return Optional.of(exchangeRegistry.get(leg.getVenue()).getPosition(symbol)
                    .filter(p -> p.getSide() == leg.getSide())
                    .map(Position::getQty)
                    .orElse(BigDecimal.ZERO));
        } catch (RuntimeException e) {
            log.warn("Position read for {} on {} failed: {}", symbol, leg.getVenue(), e.getMessage());
            return Optional.empty();
        }
    }

    private CloseResult result(Trade trade) {
        BigDecimal residual1 = openQty(trade, trade.getLeg1());
        BigDecimal residual2 = openQty(trade, trade.getLeg2());
        BigDecimal threshold = positionConfig.getPositionQtyThreshold();
        boolean flat = residual1.compareTo(threshold) <= 0 && residual2.compareTo(threshold) <= 0;
        return CloseResult.builder()
                .tradeId(trade.getId())
                .success(flat)
                .residualLeg1(residual1)
                .residualLeg2(residual2)
                .message(flat ? "closed" : String.format("residual %s / %s", residual1, residual2))
                .build();
    }

    private static BigDecimal filledOf(Order order) {
        return order.getFilledQty() != null ? order.getFilledQty() : BigDecimal.ZERO;
    }
}
