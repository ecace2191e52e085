package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** Funding rate normalised to an hourly fraction (0.0001 = 0.01 % per hour). */
@Data
@Builder
public class FundingRate {

    public static final BigDecimal HOURS_PER_YEAR = BigDecimal.valueOf(24L * 365L);

    private String symbol;
    private Venue venue;
    private BigDecimal hourlyRate;
    private Instant updatedAt;

    public BigDecimal apy() {
        return hourlyRate.multiply(HOURS_PER_YEAR);
    }
}
