package com.fundingarb.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Candidate filtering and scoring ({@code funding.opportunity}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "funding.opportunity")
public class OpportunityConfig {

    private BigDecimal desiredNotionalUsd = new BigDecimal("150");
    private int maxOpenTrades = 2;
    private Duration entryCooldown = Duration.ofMinutes(60);
    private Set<String> blacklist = new HashSet<>();
    private Duration maxPriceAge = Duration.ofSeconds(60);
    private BigDecimal minApy = new BigDecimal("0.15");
    private BigDecimal maxSpreadPct = new BigDecimal("0.001");
    private BigDecimal minExpectedProfitUsd = new BigDecimal("0.10");
    private BigDecimal maxBreakevenHours = new BigDecimal("12");

    /** Hedge venue L1 must show at least this multiple of the target qty. */
    private BigDecimal hedgeLiquidityMultiple = new BigDecimal("1.0");

    private BigDecimal lighterMakerFillProbability = new BigDecimal("0.70");
    private BigDecimal x10MakerFillProbability = new BigDecimal("0.50");

    private int symbolFailureThreshold = 5;
    private Duration symbolFailureCooldown = Duration.ofMinutes(10);
}
