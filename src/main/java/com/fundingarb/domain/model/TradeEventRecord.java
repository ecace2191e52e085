package com.fundingarb.domain.model;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Journal entry appended to a trade's audit trail. */
@Data
@Builder
public class TradeEventRecord {

    private String tradeId;
    private String eventType;
    private Map<String, Object> payload;
    private Instant timestamp;
}
