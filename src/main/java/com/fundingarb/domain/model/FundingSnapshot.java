package com.fundingarb.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Cached market state of one symbol across both venues: hourly funding rates and mark prices.
 */
@Data
@Builder
public class FundingSnapshot {

    private String symbol;
    private BigDecimal lighterRate;
    private BigDecimal x10Rate;
    private BigDecimal lighterPrice;
    private BigDecimal x10Price;
    private Instant updatedAt;

    public boolean hasRates() {
        return lighterRate != null && x10Rate != null;
    }

    public boolean hasPrices() {
        return lighterPrice != null && x10Price != null && lighterPrice.signum() > 0 && x10Price.signum() > 0;
    }

    /** Mean of the two venue prices; used for sizing and notional calculations. */
    public BigDecimal referencePrice() {
        return lighterPrice.add(x10Price).divide(BigDecimal.valueOf(2));
    }
}
