package com.fundingarb.api.dto.response;

import com.fundingarb.domain.model.TradeStats;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Trading state for the status endpoint. */
@Data
@Builder
public class EngineStatusResponse {

    private boolean tradingAllowed;
    private String pauseReason;

    /** Null while running, or when paused until acknowledged. */
    private Instant pausedUntil;

    private int consecutiveFailures;
    private boolean marketDataHealthy;
    private Map<String, Instant> lastMarketDataRefresh;
    private int openTrades;
    private TradeStats stats;
}
