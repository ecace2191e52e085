package com.fundingarb.config;

import com.fundingarb.domain.enums.AttemptSchedule;
import com.fundingarb.domain.enums.ExecutionMode;
import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Entry execution tuning: leg 1 maker chase, leg 2 hedge and rollback.
 *
 * <p>Reads from application.yml under {@code funding.execution}. Ratios are fractions
 * (0.003 = 0.3 %).
 */
@Data
@Component
@ConfigurationProperties(prefix = "funding.execution")
public class ExecutionConfig {

    private ExecutionMode mode = ExecutionMode.SEQUENTIAL;

    /** Venue that takes the maker leg; the other venue is hedged with IOC orders. */
    private Venue makerVenue = Venue.LIGHTER;

    // ---- Pre-flight ----
    private BigDecimal minVenueBalanceUsd = new BigDecimal("5");
    private boolean hedgeDepthGuardEnabled = false;
    private BigDecimal hedgeDepthMultiplier = new BigDecimal("1.0");

    // ---- Leg 1 (maker chase) ----
    private Duration leg1TotalTimeout = Duration.ofSeconds(45);
    private int leg1MaxAttempts = 3;
    private Duration leg1MinAttemptTimeout = Duration.ofSeconds(5);
    private AttemptSchedule leg1AttemptSchedule = AttemptSchedule.EQUAL;
    private BigDecimal makerMaxAggressiveness = new BigDecimal("0.5");
    private boolean makerForcePostOnly = false;
    private boolean smartPricingEnabled = true;
    private BigDecimal smartPricingL1UtilTrigger = new BigDecimal("0.7");
    private BigDecimal smartPricingMakerFloor = new BigDecimal("0.25");
    private BigDecimal smartPricingMaxPriceImpact = new BigDecimal("0.003");
    private BigDecimal fillSuccessRatio = new BigDecimal("0.999");
    private BigDecimal microfillMaxUnhedgedUsd = new BigDecimal("5");
    private Duration genericErrorRetryDelay = Duration.ofSeconds(2);
    private boolean leg1EscalateToTaker = false;
    private BigDecimal leg1TakerSlippage = new BigDecimal("0.002");

    // ---- Leg 2 (hedge) ----
    private int hedgeIocMaxAttempts = 3;
    private BigDecimal hedgeBaseSlippage = new BigDecimal("0.001");
    private BigDecimal hedgeSlippageStep = new BigDecimal("0.0005");
    private BigDecimal hedgeMaxSlippage = new BigDecimal("0.003");
    private Duration hedgeFillTimeout = Duration.ofSeconds(8);
    private Duration hedgeRetryDelay = Duration.ofMillis(200);

    // ---- Rollback ----
    private Duration rollbackFillTimeout = Duration.ofSeconds(10);
    private int rollbackMaxAttempts = 3;
    private Duration rollbackVerifyDelay = Duration.ofMillis(500);

    /** Poll interval of the fill waiter when the order stream is silent. */
    private Duration fillPollInterval = Duration.ofMillis(300);

    /** Upper bound on waiting for both legs in parallel mode. */
    private Duration parallelLegTimeout = Duration.ofSeconds(60);

    /** How long a timed-out parallel leg gets to return after being interrupted. */
    private Duration parallelLegStopTimeout = Duration.ofSeconds(15);
}
