package com.fundingarb.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "funding.market-data")
public class MarketDataConfig {

    private Duration refreshInterval = Duration.ofSeconds(15);
    private Duration healthCheckInterval = Duration.ofSeconds(30);

    /** A refresh older than this multiple of the health-check interval marks the feed unhealthy. */
    private int healthStaleMultiple = 3;

    private int freshOrderbookAttempts = 3;
    private Duration freshOrderbookBaseDelay = Duration.ofMillis(300);
    private Duration fallbackMaxAge = Duration.ofSeconds(10);
    private int depthLevels = 20;
}
