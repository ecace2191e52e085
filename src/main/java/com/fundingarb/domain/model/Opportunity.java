package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A scored, tradable funding spread for one symbol.
 *
 * <p>Produced by the opportunity engine and consumed once by the execution engine. Rates are
 * hourly fractions; {@code apy} is the annualised net spread captured by holding long on
 * {@code longVenue} and short on {@code shortVenue}.
 */
@Value
@Builder
public class Opportunity {

    String symbol;
    BigDecimal lighterRate;
    BigDecimal x10Rate;
    BigDecimal netFundingHourly;
    BigDecimal apy;
    BigDecimal lighterPrice;
    BigDecimal x10Price;
    BigDecimal suggestedQty;
    BigDecimal suggestedNotionalUsd;
    BigDecimal expectedValueUsd;
    BigDecimal breakevenHours;
    BigDecimal liquidityScore;

    /** Entry price gap between venues as a fraction of the long price. */
    BigDecimal spreadPct;

    Venue longVenue;
    Venue shortVenue;
    Instant detectedAt;

    public BigDecimal priceOn(Venue venue) {
        return venue == Venue.LIGHTER ? lighterPrice : x10Price;
    }
}
