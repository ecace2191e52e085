package com.fundingarb.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Data;

/**
 * Trading rules of one symbol on one venue.
 *
 * <p>Prices must be multiples of {@code tickSize} and quantities multiples of {@code stepSize}.
 */
@Data
@Builder
public class MarketInfo {

    private String symbol;

    @Builder.Default
    private BigDecimal tickSize = new BigDecimal("0.01");

    @Builder.Default
    private BigDecimal stepSize = new BigDecimal("0.001");

    @Builder.Default
    private BigDecimal minQty = new BigDecimal("0.001");

    public BigDecimal roundPrice(BigDecimal price, RoundingMode mode) {
        return roundToIncrement(price, tickSize, mode);
    }

    /** Rounds a quantity down to the step size; quantities never round up. */
    public BigDecimal roundQty(BigDecimal qty) {
        return roundToIncrement(qty, stepSize, RoundingMode.DOWN);
    }

    public static BigDecimal roundToIncrement(BigDecimal value, BigDecimal increment, RoundingMode mode) {
        if (increment == null || increment.signum() <= 0) {
            return value;
        }
        return value.divide(increment, 0, mode).multiply(increment).stripTrailingZeros();
    }
}
