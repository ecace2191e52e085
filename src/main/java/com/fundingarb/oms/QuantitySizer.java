package com.fundingarb.oms;

import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.exception.SizingException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/** Converts a USD notional into a quantity both venues accept. */
public final class QuantitySizer {

    private QuantitySizer() {}

    /**
     * Rounds {@code notional / price} down to the coarser step size of the two venues.
     *
     * @throws SizingException if the price is not positive or the result is below either venue's minimum
     */
    public static BigDecimal size(String symbol, BigDecimal notionalUsd, BigDecimal price, MarketInfo a, MarketInfo b) {
        if (price == null || price.signum() <= 0) {
            throw new SizingException(symbol, "no valid price");
        }
        BigDecimal step = a.getStepSize().max(b.getStepSize());
        BigDecimal minQty = a.getMinQty().max(b.getMinQty());
        BigDecimal raw = notionalUsd.divide(price, MathContext.DECIMAL64);
        BigDecimal qty = MarketInfo.roundToIncrement(raw, step, RoundingMode.DOWN);
        if (qty.compareTo(minQty) < 0) {
            throw new SizingException(symbol, "quantity " + qty + " below minimum " + minQty);
        }
        return qty;
    }
}
