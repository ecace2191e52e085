package com.fundingarb.config;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.adapter.GuardedExchange;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.port.ExchangePort;
import com.fundingarb.simulator.PaperExchange;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the venue adapters. Every adapter is wrapped in a {@link GuardedExchange} so all venue
 * calls carry a timeout and idempotent calls a bounded retry.
 *
 * <p>Only the paper venue is bundled. Seeded paper markets quote a small price gap between venues
 * and opposite funding so the opportunity loop has something to trade.
 */
@Configuration
public class ExchangeConfig {

    private static final Logger log = LoggerFactory.getLogger(ExchangeConfig.class);

    private static final Map<String, BigDecimal> PAPER_PRICES = Map.of(
            "BTC", new BigDecimal("60000"),
            "ETH", new BigDecimal("3000"),
            "SOL", new BigDecimal("150"));

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService venueCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "venue-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ExchangeRegistry exchangeRegistry(
            ExchangeProperties exchangeProperties,
            FeeConfig feeConfig,
            Clock clock,
            RetryRegistry retryRegistry,
            ExecutorService venueCallExecutor) {
        if (!"paper".equalsIgnoreCase(exchangeProperties.getMode())) {
            throw new IllegalStateException("Unsupported funding.exchange.mode '" + exchangeProperties.getMode()
                    + "': only the paper venue is bundled");
        }
        Retry retry = retryRegistry.retry("venue");
        Map<Venue, ExchangePort> exchanges = new EnumMap<>(Venue.class);
        for (Venue venue : Venue.values()) {
            PaperExchange paper = new PaperExchange(
                    venue,
                    clock,
                    exchangeProperties.getPaper().getStartingBalanceUsd(),
                    feeConfig.makerFee(venue),
                    feeConfig.takerFee(venue),
                    exchangeProperties.getPaper().getRestingFillDelay());
            seedPaperMarkets(paper, exchangeProperties.getPaper().getSymbols());
            exchanges.put(
                    venue,
                    new GuardedExchange(paper, retry, exchangeProperties.getCallTimeout(), venueCallExecutor));
        }
        log.info("Paper venues ready for symbols {}", exchangeProperties.getPaper().getSymbols());
        return new ExchangeRegistry(exchanges);
    }

    private void seedPaperMarkets(PaperExchange paper, List<String> symbols) {
        boolean lighter = paper.getVenue() == Venue.LIGHTER;
        for (String symbol : symbols) {
            BigDecimal mid = PAPER_PRICES.getOrDefault(symbol, new BigDecimal("100"));
            BigDecimal halfSpread = mid.multiply(new BigDecimal("0.0001")).setScale(2, RoundingMode.UP);
            BigDecimal skew = lighter ? BigDecimal.ZERO : halfSpread;
            paper.setBook(symbol, mid.subtract(halfSpread).add(skew), mid.add(halfSpread).add(skew), new BigDecimal("50"));
            paper.setFundingRate(symbol, lighter ? new BigDecimal("0.0008") : new BigDecimal("-0.0002"));
        }
    }
}
