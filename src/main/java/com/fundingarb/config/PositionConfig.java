package com.fundingarb.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exit rules, close algorithms and hedge monitoring for open trades ({@code funding.position}).
 * APY values are annual fractions (-2.00 = -200 %); USD values are absolute amounts.
 */
@Data
@Component
@ConfigurationProperties(prefix = "funding.position")
public class PositionConfig {

    // ---- Hold gates ----
    private Duration minHold = Duration.ofHours(2);
    private Duration maxHold = Duration.ofHours(72);

    // ---- Emergency rules ----
    private boolean liquidationMonitoringEnabled = true;
    private BigDecimal liquidationDistanceMin = new BigDecimal("0.10");
    private boolean deltaBoundEnabled = true;
    private BigDecimal deltaBoundMax = new BigDecimal("0.03");
    private boolean rebalanceEnabled = true;
    private BigDecimal rebalanceMinDelta = new BigDecimal("0.01");
    private BigDecimal catastrophicFlipApy = new BigDecimal("-2.00");

    // ---- Early take profit ----
    private boolean earlyTakeProfitEnabled = true;
    private BigDecimal earlyTakeProfitBaseUsd = new BigDecimal("0.30");
    private BigDecimal earlyTakeProfitSlippageMultiple = new BigDecimal("1.5");
    private BigDecimal earlyTakeProfitMinBufferUsd = new BigDecimal("0.50");
    private BigDecimal earlyTakeProfitExecutionBufferUsd = BigDecimal.ZERO;

    // ---- Funding flip ----
    private BigDecimal fundingFlipApyThreshold = new BigDecimal("-0.05");
    private BigDecimal fundingFlipHorizonHours = new BigDecimal("4");

    // ---- Net EV ----
    private boolean netEvEnabled = true;
    private BigDecimal netEvHorizonHours = new BigDecimal("12");
    private BigDecimal netEvExitCostMultiple = new BigDecimal("1.2");
    /** When net EV holds on a good edge, the profit target and rotation rules are skipped. */
    private boolean netEvSkipProfitTargetWhenEdgeGood = true;
    private boolean netEvSkipOpportunityCostWhenEdgeGood = true;

    // ---- Profit target / rotation ----
    private BigDecimal profitTargetUsd = new BigDecimal("0.25");
    private BigDecimal opportunityCostApyDiff = new BigDecimal("0.40");
    /** Close plus re-open, as a multiple of the estimated exit cost. */
    private BigDecimal rotationRoundtripMultiple = new BigDecimal("2.0");
    private BigDecimal rotationLatencyPenaltyUsd = new BigDecimal("0.20");

    // ---- Close execution ----
    private Duration closeMakerTimeout = Duration.ofSeconds(6);
    private BigDecimal closeMakerAggressiveness = new BigDecimal("0.5");
    private Duration closeIocTimeout = Duration.ofSeconds(2);
    private BigDecimal closeIocSlippage = new BigDecimal("0.002");
    private Duration closeRetryCooldown = Duration.ofSeconds(60);
    private Duration rebalanceMakerTimeout = Duration.ofSeconds(6);
    private boolean rebalanceIocFallback = true;

    // ---- Hedge monitoring ----
    private Duration brokenHedgeMinTradeAge = Duration.ofSeconds(30);
    private int brokenHedgeConfirmations = 2;
    private Duration brokenHedgeMinSpacing = Duration.ofSeconds(30);
    private Duration brokenHedgeHitExpiry = Duration.ofSeconds(120);
    private BigDecimal positionQtyThreshold = new BigDecimal("0.0001");
    private Duration imbalanceMinTradeAge = Duration.ofSeconds(60);
    private BigDecimal imbalanceWarnPct = new BigDecimal("1.0");
    private BigDecimal deltaDriftLogPct = new BigDecimal("3.0");
}
