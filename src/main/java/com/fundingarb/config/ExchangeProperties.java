package com.fundingarb.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Venue access settings ({@code funding.exchange}). Retry policy lives under
 * {@code resilience4j.retry.instances.venue}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "funding.exchange")
public class ExchangeProperties {

    /** Only "paper" ships with this service; real adapters register their own ExchangePort beans. */
    private String mode = "paper";

    private Duration callTimeout = Duration.ofSeconds(10);

    private Paper paper = new Paper();

    @Data
    public static class Paper {
        private BigDecimal startingBalanceUsd = new BigDecimal("1000");
        private List<String> symbols = new ArrayList<>(List.of("BTC", "ETH", "SOL"));

        /** How long a resting paper order waits before it is filled at its limit price. */
        private Duration restingFillDelay = Duration.ofSeconds(2);
    }
}
