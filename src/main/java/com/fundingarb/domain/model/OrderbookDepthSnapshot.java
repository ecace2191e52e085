package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.Venue;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Multi-level book. Bids are sorted best (highest) first, asks best (lowest) first. */
@Data
@Builder
public class OrderbookDepthSnapshot {

    private String symbol;
    private Venue venue;

    @Builder.Default
    private List<PriceLevel> bids = new ArrayList<>();

    @Builder.Default
    private List<PriceLevel> asks = new ArrayList<>();

    private Instant updatedAt;
}
