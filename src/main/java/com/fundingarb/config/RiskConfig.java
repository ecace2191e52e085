package com.fundingarb.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Circuit breaker limits and alert throttling ({@code funding.risk}). */
@Data
@Component
@ConfigurationProperties(prefix = "funding.risk")
public class RiskConfig {

    private int maxConsecutiveFailures = 5;
    private Duration failureCooldown = Duration.ofMinutes(10);
    private BigDecimal maxDrawdownPct = new BigDecimal("0.20");
    private Duration brokenHedgeCooldown = Duration.ofSeconds(900);
    private Duration alertThrottle = Duration.ofMinutes(5);
}
