package com.fundingarb.oms;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.config.FeeConfig;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TimeInForce;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.OrderbookDepthSnapshot;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.domain.model.Position;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import com.fundingarb.exception.InsufficientBalanceException;
import com.fundingarb.exception.Leg2FailedException;
import com.fundingarb.exception.OrderTimeoutException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.port.ExchangePort;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Leg 2: hedges leg 1 with IOC limit orders on the taker venue.
 *
 * <p>Each attempt prices off the impact VWAP of the depth needed for the remaining size (or the
 * best opposite price when L1 alone covers it) and widens the slippage allowance by one step.
 * A leftover below the micro-fill threshold or the venue minimum is accepted as hedged.
 *
 * <p>A placement that timed out may still have filled, so before the next attempt the hedge venue
 * position is compared with its value at the start and any unreported fill is credited. When the
 * position cannot be read the leg fails rather than risk a second hedge.
 */
@Component
public class Leg2Executor {

    private static final Logger log = LoggerFactory.getLogger(Leg2Executor.class);

    private final ExchangeRegistry exchangeRegistry;
    private final MarketDataService marketDataService;
    private final FillWaiter fillWaiter;
    private final ExecutionConfig executionConfig;
    private final FeeConfig feeConfig;

    public Leg2Executor(
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
     * Adds {@code qtyToHedge} to {@code trade.leg2}, on top of whatever it already holds.
     *
     * @throws Leg2FailedException when the hedge cannot be completed; the leg reflects what did fill
     */
    public void execute(Trade trade, BigDecimal qtyToHedge) {
        TradeLeg leg = trade.getLeg2();
        String symbol = trade.getSymbol();
        ExchangePort exchange = exchangeRegistry.get(leg.getVenue());
        MarketInfo info = exchange.getMarketInfo(symbol);

        BigDecimal hedged = BigDecimal.ZERO;
        BigDecimal notional = leg.getEntryPrice() != null
                ? leg.getFilledQty().multiply(leg.getEntryPrice())
                : BigDecimal.ZERO;
        BigDecimal startFilled = leg.getFilledQty();
        BigDecimal lastPrice = null;
        String lastError = "no fill";
        Optional<BigDecimal> baseline = signedPosition(exchange, symbol);

        int maxAttempts = executionConfig.getHedgeIocMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Leg2 for {} interrupted after hedging {}", symbol, hedged);
                break;
            }
            BigDecimal remaining = info.roundQty(qtyToHedge.subtract(hedged));
            if (isNegligible(remaining, lastPrice, info, symbol, leg)) {
                break;
            }
            try {
                OrderbookSnapshot book = marketDataService.getFreshOrderbook(symbol, leg.getVenue());
                BigDecimal base = basePrice(symbol, leg, book, remaining);
                BigDecimal price = MakerPricing.hedgeLimitPrice(leg.getSide(), base, attempt, executionConfig, info);
                lastPrice = base;

                Order placed;
                try {
                    placed = exchange.placeOrder(
                            OrderRequest.limit(symbol, leg.getSide(), remaining, price, TimeInForce.IOC));
                } catch (OrderTimeoutException e) {
                    // the order may still have reached the venue: settle from the position first
                    Optional<BigDecimal> landed = unreportedFill(exchange, symbol, leg.getSide(), baseline, hedged);
                    if (landed.isEmpty()) {
                        writeFills(leg, startFilled.add(hedged), notional);
                        throw new Leg2FailedException(symbol, leg.getVenue(), hedged, qtyToHedge,
                                "placement outcome unknown: " + e.getMessage());
                    }
                    BigDecimal qty = landed.get().min(remaining);
                    if (qty.signum() > 0) {
                        hedged = hedged.add(qty);
                        notional = notional.add(qty.multiply(base));
                        leg.addFees(qty.multiply(base).multiply(feeConfig.takerFee(leg.getVenue())));
                        log.warn("Leg2 {} placement timed out but position moved {}, crediting @ {}", symbol, qty,
                                base);
                    }
                    throw e;
                }
                leg.setOrderId(placed.getId());
                log.info("Leg2 attempt {}/{}: {} {} {} IOC @ {} (base {})", attempt + 1, maxAttempts, leg.getSide(),
                        remaining, symbol, price, base);

                Order result = fillWaiter.awaitTerminal(exchange, placed, executionConfig.getHedgeFillTimeout());
                if (result.getStatus() == null || !result.getStatus().isTerminal()) {
                    result = fillWaiter.cancelAndFetch(exchange, result);
                }
                if (result.hasFill()) {
                    BigDecimal qty = result.getFilledQty();
                    BigDecimal fillPrice = result.getAvgFillPrice() != null ? result.getAvgFillPrice() : price;
                    BigDecimal fee = result.getFee() != null && result.getFee().signum() > 0
                            ? result.getFee()
                            : qty.multiply(fillPrice).multiply(feeConfig.takerFee(leg.getVenue()));
                    hedged = hedged.add(qty);
                    notional = notional.add(qty.multiply(fillPrice));
                    leg.addFees(fee);
                    lastPrice = fillPrice;
                    log.info("Leg2 {} filled {} @ {} (hedged {}/{})", symbol, qty, fillPrice, hedged, qtyToHedge);
                } else {
                    lastError = "IOC " + result.getStatus();
                }
            } catch (InsufficientBalanceException e) {
                writeFills(leg, startFilled.add(hedged), notional);
                throw new Leg2FailedException(symbol, leg.getVenue(), hedged, qtyToHedge, e.getMessage());
            } catch (Leg2FailedException e) {
                throw e;
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn("Leg2 attempt {}/{} for {} failed: {}", attempt + 1, maxAttempts, symbol, e.getMessage());
            }
            if (attempt < maxAttempts - 1) {
                sleep(executionConfig.getHedgeRetryDelay());
            }
        }

        writeFills(leg, startFilled.add(hedged), notional);
        BigDecimal remaining = info.roundQty(qtyToHedge.subtract(hedged));
        if (!isNegligible(remaining, lastPrice, info, symbol, leg)) {
            throw new Leg2FailedException(symbol, leg.getVenue(), hedged, qtyToHedge, lastError);
        }
    }

    /** Best opposite price when L1 covers the size, otherwise the impact VWAP through depth. */
    private BigDecimal basePrice(String symbol, TradeLeg leg, OrderbookSnapshot book, BigDecimal qty) {
        boolean buy = leg.getSide() == Side.BUY;
        BigDecimal best = buy ? book.getBestAsk() : book.getBestBid();
        BigDecimal l1Qty = buy ? book.getBestAskQty() : book.getBestBidQty();
        if (l1Qty.compareTo(qty) >= 0) {
            return best;
        }
        try {
            OrderbookDepthSnapshot depth = marketDataService.getDepth(symbol, leg.getVenue());
            Optional<BigDecimal> vwap = ImpactVwap.vwap(
                    buy ? depth.getAsks() : depth.getBids(), qty, executionConfig.getSmartPricingMaxPriceImpact());
            return vwap.orElse(best);
        } catch (RuntimeException e) {
            log.debug("Depth for {} on {} unavailable: {}", symbol, leg.getVenue(), e.getMessage());
            return best;
        }
    }

    private boolean isNegligible(BigDecimal remaining, BigDecimal price, MarketInfo info, String symbol, TradeLeg leg) {
        if (remaining.compareTo(info.getMinQty()) < 0) {
            return true;
        }
        BigDecimal reference = price != null ? price : marketDataService.getMarkPrice(symbol, leg.getVenue());
        return reference != null
                && reference.signum() > 0
                && remaining.multiply(reference).compareTo(executionConfig.getMicrofillMaxUnhedgedUsd()) < 0;
    }

    /** Position change in the leg's direction since the hedge started, beyond what was credited. */
    private Optional<BigDecimal> unreportedFill(
            ExchangePort exchange, String symbol, Side side, Optional<BigDecimal> baseline, BigDecimal credited) {
        if (baseline.isEmpty()) {
            return Optional.empty();
        }
        return signedPosition(exchange, symbol).map(current -> {
            BigDecimal delta = current.subtract(baseline.get());
            BigDecimal moved = side == Side.BUY ? delta : delta.negate();
            return moved.subtract(credited).max(BigDecimal.ZERO);
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

    private void writeFills(TradeLeg leg, BigDecimal filled, BigDecimal notional) {
        leg.setFilledQty(filled);
        if (filled.signum() > 0) {
            leg.setEntryPrice(notional.divide(filled, MathContext.DECIMAL64));
        }
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
