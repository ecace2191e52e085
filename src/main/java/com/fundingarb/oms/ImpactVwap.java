package com.fundingarb.oms;

import com.fundingarb.domain.model.PriceLevel;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Optional;

/**
 * Volume-weighted price to fill a size against book levels, using only levels within a maximum
 * price impact of the best level.
 */
public final class ImpactVwap {

    private ImpactVwap() {}

    /**
     * @param levels    one side of the book, best first
     * @param qty       size to fill
     * @param maxImpact fraction of the best price the walk may move (0.003 = 0.3 %)
     * @return the VWAP, or empty when the levels inside the window cannot fill {@code qty}
     */
    public static Optional<BigDecimal> vwap(List<PriceLevel> levels, BigDecimal qty, BigDecimal maxImpact) {
        if (levels == null || levels.isEmpty() || qty.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal best = levels.get(0).getPrice();
        BigDecimal window = best.multiply(maxImpact);
        BigDecimal remaining = qty;
        BigDecimal notional = BigDecimal.ZERO;
        for (PriceLevel level : levels) {
            if (level.getPrice().subtract(best).abs().compareTo(window) > 0) {
                break;
            }
            BigDecimal take = remaining.min(level.getQty());
            notional = notional.add(take.multiply(level.getPrice()));
            remaining = remaining.subtract(take);
            if (remaining.signum() <= 0) {
                return Optional.of(notional.divide(qty, MathContext.DECIMAL64));
            }
        }
        return Optional.empty();
    }
}
