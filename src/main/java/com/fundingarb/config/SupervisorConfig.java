package com.fundingarb.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "funding.supervisor")
public class SupervisorConfig {

    private Duration initialBackoff = Duration.ofSeconds(2);
    private Duration maxBackoff = Duration.ofSeconds(60);
    private Duration opportunityScanInterval = Duration.ofSeconds(10);
    private Duration positionCheckInterval = Duration.ofSeconds(5);
    private Duration heartbeatInterval = Duration.ofSeconds(60);
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /** When false the loops are not started; the engine only serves the API. */
    private boolean tradingEnabled = true;
}
