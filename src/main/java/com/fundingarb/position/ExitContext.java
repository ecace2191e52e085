package com.fundingarb.position;

import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.FundingRate;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Market state an exit decision is made against. Rates are hourly fractions; a null
 * liquidation distance means the venue did not report a liquidation price.
 */
@Value
@Builder
public class ExitContext {

    Trade trade;
    Instant now;

    BigDecimal lighterRate;
    BigDecimal x10Rate;

    BigDecimal leg1MarkPrice;
    BigDecimal leg2MarkPrice;

    /** Fractional distance from mark to liquidation, e.g. 0.15 = 15 %. */
    BigDecimal leg1LiquidationDistance;

    BigDecimal leg2LiquidationDistance;

    /** Price PnL at marks, net of fees paid so far. */
    BigDecimal pricePnl;

    /** {@link #pricePnl} plus funding collected. */
    BigDecimal currentPnl;

    BigDecimal estimatedExitCostUsd;

    /** APY of the best alternative opportunity, or null when none is known. */
    BigDecimal bestOpportunityApy;

    public BigDecimal rateOn(Venue venue) {
        BigDecimal rate = venue == Venue.LIGHTER ? lighterRate : x10Rate;
        return rate != null ? rate : BigDecimal.ZERO;
    }

    /** Hourly funding earned by the position: the short venue's rate minus the long venue's. */
    public BigDecimal netFundingHourly() {
        TradeLeg longLeg = trade.getLeg1().getSide() == Side.BUY ? trade.getLeg1() : trade.getLeg2();
        TradeLeg shortLeg = longLeg == trade.getLeg1() ? trade.getLeg2() : trade.getLeg1();
        return rateOn(shortLeg.getVenue()).subtract(rateOn(longLeg.getVenue()));
    }

    public BigDecimal currentApy() {
        return netFundingHourly().multiply(FundingRate.HOURS_PER_YEAR);
    }
}
