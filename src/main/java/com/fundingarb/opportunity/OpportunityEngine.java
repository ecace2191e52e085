package com.fundingarb.opportunity;

import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.config.FeeConfig;
import com.fundingarb.config.OpportunityConfig;
import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.ExecutionResult;
import com.fundingarb.domain.model.FundingRate;
import com.fundingarb.domain.model.FundingSnapshot;
import com.fundingarb.domain.model.Opportunity;
import com.fundingarb.domain.model.OrderbookPair;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.exception.PreflightCheckException;
import com.fundingarb.marketdata.MarketDataService;
import com.fundingarb.oms.ExecutionEngine;
import com.fundingarb.port.TradeStorePort;
import com.fundingarb.risk.CircuitBreaker;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores funding spreads and hands the best one to the execution engine.
 *
 * <p>A symbol is an opportunity when it passes, in order: blacklist, symbol failure cooldown,
 * entry cooldown after its last close, no active trade, fresh rates and prices, minimum APY,
 * orderbooks on both venues, hedge-side L1 liquidity, maximum entry spread, minimum expected
 * value and maximum breakeven time.
 *
 * <p>Expected value over the hold horizon is funding income minus entry fees, exit fees weighted
 * by the venue's maker fill probability, and the entry spread cost.
 */
@Service
public class OpportunityEngine {

    private static final Logger log = LoggerFactory.getLogger(OpportunityEngine.class);

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private final MarketDataService marketDataService;
    private final TradeStorePort tradeStore;
    private final ExecutionEngine executionEngine;
    private final CircuitBreaker circuitBreaker;
    private final OpportunityConfig opportunityConfig;
    private final ExecutionConfig executionConfig;
    private final PositionConfig positionConfig;
    private final FeeConfig feeConfig;
    private final Clock clock;

    private final Map<String, Integer> symbolFailures = new ConcurrentHashMap<>();
    private final Map<String, Instant> symbolCooldownUntil = new ConcurrentHashMap<>();
    private volatile List<Opportunity> lastScan = List.of();

    public OpportunityEngine(
            MarketDataService marketDataService,
            TradeStorePort tradeStore,
            ExecutionEngine executionEngine,
            CircuitBreaker circuitBreaker,
            OpportunityConfig opportunityConfig,
            ExecutionConfig executionConfig,
            PositionConfig positionConfig,
            FeeConfig feeConfig,
            Clock clock) {
        this.marketDataService = marketDataService;
        this.tradeStore = tradeStore;
        this.executionEngine = executionEngine;
        this.circuitBreaker = circuitBreaker;
        this.opportunityConfig = opportunityConfig;
        this.executionConfig = executionConfig;
        this.positionConfig = positionConfig;
        this.feeConfig = feeConfig;
        this.clock = clock;
    }

    // ========================
    // ENTRY CYCLE
    // ========================

    /**
     * One entry cycle: scans, then executes the best opportunity if a slot is free and the
     * circuit breaker allows entries.
     *
     * @return the execution result, or empty when nothing was attempted
     */
    public Optional<ExecutionResult> scanAndExecute() {
        List<Opportunity> opportunities = scan();
        if (!circuitBreaker.isTradingAllowed()) {
            log.debug("Entries paused: {}", circuitBreaker.getPauseReason());
            return Optional.empty();
        }
        int open = tradeStore.listOpenTrades().size();
        if (open >= opportunityConfig.getMaxOpenTrades()) {
            log.debug("Max open trades reached ({}/{})", open, opportunityConfig.getMaxOpenTrades());
            return Optional.empty();
        }
        if (opportunities.isEmpty()) {
            return Optional.empty();
        }
        Opportunity best = opportunities.get(0);
        log.info("Best opportunity {}: APY {}, EV {}, breakeven {}h, long {} short {}", best.getSymbol(),
                best.getApy(), best.getExpectedValueUsd(), best.getBreakevenHours(), best.getLongVenue(),
                best.getShortVenue());
        ExecutionResult result = executionEngine.execute(best);
        if (result.isSuccess()) {
            recordSymbolSuccess(best.getSymbol());
        } else if (!(result.getError() instanceof PreflightCheckException)) {
            recordSymbolFailure(best.getSymbol());
        }
        return Optional.of(result);
    }

    // ========================
    // SCANNING
    // ========================

    /** Evaluates every known symbol; returns opportunities by expected value, best first. */
    public List<Opportunity> scan() {
        List<Opportunity> found = new ArrayList<>();
        for (String symbol : marketDataService.getSymbols()) {
            evaluate(symbol).ifPresent(found::add);
        }
        found.sort(Comparator.comparing(Opportunity::getExpectedValueUsd).reversed());
        lastScan = List.copyOf(found);
        return found;
    }

    /** Highest APY from the latest scan among other symbols. */
    public Optional<BigDecimal> bestApyExcluding(String symbol) {
        return lastScan.stream()
                .filter(o -> !o.getSymbol().equals(symbol))
                .map(Opportunity::getApy)
                .max(Comparator.naturalOrder());
    }

    public List<Opportunity> getLastScan() {
        return lastScan;
    }

    public Optional<Opportunity> evaluate(String symbol) {
        Instant now = clock.instant();
        String rejection = null;
        Opportunity opportunity = null;
        try {
            if (opportunityConfig.getBlacklist().contains(symbol)) {
                rejection = "blacklisted";
            } else if (isInFailureCooldown(symbol, now)) {
                rejection = "symbol failure cooldown";
            } else if (isInEntryCooldown(symbol, now)) {
                rejection = "entry cooldown after last close";
            } else if (tradeStore.findActiveBySymbol(symbol).isPresent()) {
                rejection = "active trade exists";
            } else {
                Scored scored = score(symbol, now);
                rejection = scored.rejection;
                opportunity = scored.opportunity;
            }
        } catch (RuntimeException e) {
            rejection = "evaluation error: " + e.getMessage();
        }
        if (rejection != null) {
            log.debug("{} rejected: {}", symbol, rejection);
            return Optional.empty();
        }
        return Optional.of(opportunity);
    }

    private Scored score(String symbol, Instant now) {
        Optional<FundingSnapshot> maybeFunding = marketDataService.getFundingSnapshot(symbol);
        if (maybeFunding.isEmpty() || !maybeFunding.get().hasRates() || !maybeFunding.get().hasPrices()) {
            return Scored.rejected("missing rates or prices");
        }
        FundingSnapshot funding = maybeFunding.get();
        if (funding.getUpdatedAt() == null
                || Duration.between(funding.getUpdatedAt(), now).compareTo(opportunityConfig.getMaxPriceAge()) > 0) {
            return Scored.rejected("stale price data");
        }

        // pay the lower rate, receive the higher one
        boolean shortLighter = funding.getLighterRate().compareTo(funding.getX10Rate()) > 0;
        Venue longVenue = shortLighter ? Venue.X10 : Venue.LIGHTER;
        Venue shortVenue = longVenue.other();
        BigDecimal netHourly = funding.getLighterRate().subtract(funding.getX10Rate()).abs();
        BigDecimal apy = netHourly.multiply(FundingRate.HOURS_PER_YEAR);
        if (apy.compareTo(opportunityConfig.getMinApy()) < 0) {
            return Scored.rejected("APY " + apy + " below minimum");
        }

        Optional<OrderbookPair> books = marketDataService.getCachedOrderbookPair(symbol);
        if (books.isEmpty() || !books.get().bothHaveDepth()) {
            recordSymbolFailure(symbol);
            return Scored.rejected("orderbook unavailable");
        }
        OrderbookSnapshot longBook = books.get().get(longVenue);
        OrderbookSnapshot shortBook = books.get().get(shortVenue);

        BigDecimal notional = opportunityConfig.getDesiredNotionalUsd();
        BigDecimal longAsk = longBook.getBestAsk();
        BigDecimal qty = notional.divide(longAsk, MathContext.DECIMAL64);

        Venue hedgeVenue = executionConfig.getMakerVenue().other();
        OrderbookSnapshot hedgeBook = books.get().get(hedgeVenue);
        BigDecimal hedgeL1 = hedgeVenue == longVenue ? hedgeBook.getBestAskQty() : hedgeBook.getBestBidQty();
        BigDecimal requiredHedge = qty.multiply(opportunityConfig.getHedgeLiquidityMultiple());
        if (hedgeL1.compareTo(requiredHedge) < 0) {
            return Scored.rejected("hedge L1 " + hedgeL1 + " below " + requiredHedge);
        }

        BigDecimal spreadPct = longAsk.subtract(shortBook.getBestBid()).divide(longAsk, MathContext.DECIMAL64);
        if (spreadPct.compareTo(opportunityConfig.getMaxSpreadPct()) > 0) {
            return Scored.rejected("spread " + spreadPct + " above maximum");
        }

        BigDecimal entryCost = entryAndExitFees(notional).add(notional.multiply(spreadPct));
        BigDecimal fundingPerHour = notional.multiply(netHourly);
        BigDecimal holdHours = holdHours();
        BigDecimal expectedValue = fundingPerHour.multiply(holdHours).subtract(entryCost);
        if (expectedValue.compareTo(opportunityConfig.getMinExpectedProfitUsd()) < 0) {
            return Scored.rejected("EV " + expectedValue + " below minimum");
        }
        BigDecimal breakeven = fundingPerHour.signum() > 0
                ? entryCost.max(BigDecimal.ZERO).divide(fundingPerHour, MathContext.DECIMAL64)
                : BigDecimal.valueOf(Long.MAX_VALUE);
        if (breakeven.compareTo(opportunityConfig.getMaxBreakevenHours()) > 0) {
            return Scored.rejected("breakeven " + breakeven + "h above maximum");
        }

        BigDecimal available = longBook.getBestAskQty().min(shortBook.getBestBidQty());
        BigDecimal liquidityScore = available.divide(requiredHedge, MathContext.DECIMAL64).min(BigDecimal.ONE);

        return Scored.of(Opportunity.builder()
                .symbol(symbol)
                .lighterRate(funding.getLighterRate())
                .x10Rate(funding.getX10Rate())
                .netFundingHourly(netHourly)
                .apy(apy)
                .lighterPrice(funding.getLighterPrice())
                .x10Price(funding.getX10Price())
                .suggestedQty(qty)
                .suggestedNotionalUsd(notional)
                .expectedValueUsd(expectedValue)
                .breakevenHours(breakeven)
                .liquidityScore(liquidityScore)
                .spreadPct(spreadPct)
                .longVenue(longVenue)
                .shortVenue(shortVenue)
                .detectedAt(now)
                .build());
    }

    /** Entry: maker on the maker venue, taker on the hedge venue. Exit: maker-probability weighted. */
    BigDecimal entryAndExitFees(BigDecimal notional) {
        Venue maker = executionConfig.getMakerVenue();
        Venue hedge = maker.other();
        BigDecimal entry = notional.multiply(feeConfig.makerFee(maker).add(feeConfig.takerFee(hedge)));
        BigDecimal exit = BigDecimal.ZERO;
        for (Venue venue : Venue.values()) {
            BigDecimal p = venue == Venue.LIGHTER
                    ? opportunityConfig.getLighterMakerFillProbability()
                    : opportunityConfig.getX10MakerFillProbability();
            BigDecimal weighted = p.multiply(feeConfig.makerFee(venue))
                    .add(BigDecimal.ONE.subtract(p).multiply(feeConfig.takerFee(venue)));
            exit = exit.add(notional.multiply(weighted));
        }
        return entry.add(exit);
    }

    /** Minimum hold, at least one hour and at most the maximum hold. */
    private BigDecimal holdHours() {
        BigDecimal min = BigDecimal.valueOf(positionConfig.getMinHold().getSeconds())
                .divide(SECONDS_PER_HOUR, MathContext.DECIMAL64);
        BigDecimal max = BigDecimal.valueOf(positionConfig.getMaxHold().getSeconds())
                .divide(SECONDS_PER_HOUR, MathContext.DECIMAL64);
        return min.max(BigDecimal.ONE).min(max);
    }

    // ========================
    // COOLDOWNS
    // ========================

    public void recordSymbolFailure(String symbol) {
        int failures = symbolFailures.merge(symbol, 1, Integer::sum);
        if (failures >= opportunityConfig.getSymbolFailureThreshold()) {
            Instant until = clock.instant().plus(opportunityConfig.getSymbolFailureCooldown());
            symbolCooldownUntil.put(symbol, until);
            symbolFailures.remove(symbol);
            log.warn("{} cooling down until {} after {} consecutive failures", symbol, until, failures);
        }
    }

    public void recordSymbolSuccess(String symbol) {
        symbolFailures.remove(symbol);
    }

    boolean isInFailureCooldown(String symbol, Instant now) {
        Instant until = symbolCooldownUntil.get(symbol);
        if (until == null) {
            return false;
        }
        if (now.isBefore(until)) {
            return true;
        }
        symbolCooldownUntil.remove(symbol);
        return false;
    }

    private boolean isInEntryCooldown(String symbol, Instant now) {
        return tradeStore.lastClosedAt(symbol)
                .map(closed -> now.isBefore(closed.plus(opportunityConfig.getEntryCooldown())))
                .orElse(false);
    }

    private static final class Scored {

        private final Opportunity opportunity;
        private final String rejection;

        private Scored(Opportunity opportunity, String rejection) {
            this.opportunity = opportunity;
            this.rejection = rejection;
        }

        static Scored of(Opportunity opportunity) {
            return new Scored(opportunity, null);
        }

        static Scored rejected(String reason) {
            return new Scored(null, reason);
        }
    }
}
