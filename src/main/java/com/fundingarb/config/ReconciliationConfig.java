package com.fundingarb.config;

import com.fundingarb.domain.enums.GhostPolicy;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "funding.reconciliation")
public class ReconciliationConfig {

    private Duration interval = Duration.ofSeconds(300);

    /** Relative quantity difference tolerated between persisted and live legs. */
    private BigDecimal qtyTolerance = new BigDecimal("0.02");

    private BigDecimal dustQty = new BigDecimal("0.0001");
    private Duration pendingStaleTimeout = Duration.ofSeconds(120);
    private Duration openingStaleTimeout = Duration.ofSeconds(600);
    private GhostPolicy ghostPolicy = GhostPolicy.CLOSE;
    private Duration ghostCloseTimeout = Duration.ofSeconds(10);

    /** How long to wait for the per-symbol lock before skipping a symbol this pass. */
    private Duration symbolLockWait = Duration.ofMillis(500);
}
