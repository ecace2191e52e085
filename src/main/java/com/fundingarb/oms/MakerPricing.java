package com.fundingarb.oms;

import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.domain.enums.AttemptSchedule;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.OrderbookSnapshot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Price and timing math for the maker chase and the IOC hedge. Stateless.
 */
public final class MakerPricing {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private MakerPricing() {}

    /**
     * Aggressiveness in [0, 1] for a maker attempt: {@code attempt / (maxAttempts - 1)}, raised to a
     * floor when the remaining size is large relative to top-of-book depth, then capped.
     *
     * @param attempt zero-based attempt number
     * @param l1Qty   size at the best price we would eventually trade against; zero disables the floor
     */
    public static BigDecimal aggressiveness(
            int attempt, int maxAttempts, BigDecimal remainingQty, BigDecimal l1Qty, ExecutionConfig config) {
        BigDecimal value = maxAttempts <= 1
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(attempt).divide(BigDecimal.valueOf(maxAttempts - 1L), MathContext.DECIMAL64);

        if (config.isSmartPricingEnabled() && l1Qty != null && l1Qty.signum() > 0) {
            BigDecimal utilisation = remainingQty.divide(l1Qty, MathContext.DECIMAL64);
            BigDecimal trigger = config.getSmartPricingL1UtilTrigger();
            if (utilisation.compareTo(trigger) > 0) {
                BigDecimal scale = clamp(utilisation.subtract(trigger).divide(TWO, MathContext.DECIMAL64));
                BigDecimal makerFloor = config.getSmartPricingMakerFloor();
                BigDecimal floor = makerFloor.add(BigDecimal.ONE.subtract(makerFloor).multiply(scale));
                value = value.max(floor);
            }
        }
        return clamp(value).min(config.getMakerMaxAggressiveness());
    }

    /**
     * Maker limit price between our best price and one tick short of the opposite best.
     * BUY rounds up to the tick, SELL rounds down, and the result never crosses the book.
     */
    public static BigDecimal makerPrice(Side side, OrderbookSnapshot book, BigDecimal aggressiveness, MarketInfo info) {
        BigDecimal tick = info.getTickSize();
        if (side == Side.BUY) {
            BigDecimal start = book.getBestBid();
            BigDecimal target = book.getBestAsk().subtract(tick).max(start);
            BigDecimal price = start.add(target.subtract(start).multiply(aggressiveness));
            price = info.roundPrice(price, RoundingMode.CEILING);
            return price.min(target);
        }
        BigDecimal start = book.getBestAsk();
        BigDecimal target = book.getBestBid().add(tick).min(start);
        BigDecimal price = start.subtract(start.subtract(target).multiply(aggressiveness));
        price = info.roundPrice(price, RoundingMode.FLOOR);
        return price.max(target);
    }

    /**
     * Splits the leg 1 timeout budget across attempts. Each share is at least {@code minPerAttempt};
     * with INCREASING, attempt n gets a share proportional to n.
     */
    public static List<Duration> attemptTimeouts(
            Duration total, int attempts, Duration minPerAttempt, AttemptSchedule schedule) {
        List<Duration> timeouts = new ArrayList<>();
        if (attempts <= 0) {
            return timeouts;
        }
        long totalMillis = total.toMillis();
        long weightSum = (long) attempts * (attempts + 1) / 2;
        for (int i = 1; i <= attempts; i++) {
            long share = schedule == AttemptSchedule.INCREASING ? totalMillis * i / weightSum : totalMillis / attempts;
            timeouts.add(Duration.ofMillis(Math.max(share, minPerAttempt.toMillis())));
        }
        return timeouts;
    }

    /**
     * IOC hedge limit: {@code base * (1 +/- min(baseSlippage + step * attempt, maxSlippage))},
     * rounded away from the book so the order stays marketable.
     */
    public static BigDecimal hedgeLimitPrice(
            Side side, BigDecimal basePrice, int attempt, ExecutionConfig config, MarketInfo info) {
        BigDecimal slippage = config.getHedgeBaseSlippage()
                .add(config.getHedgeSlippageStep().multiply(BigDecimal.valueOf(attempt)))
                .min(config.getHedgeMaxSlippage());
        return crossingPrice(side, basePrice, slippage, info);
    }

    /** Price {@code slippage} through {@code basePrice}: above for BUY, below for SELL. */
    public static BigDecimal crossingPrice(Side side, BigDecimal basePrice, BigDecimal slippage, MarketInfo info) {
        if (side == Side.BUY) {
            return info.roundPrice(basePrice.multiply(BigDecimal.ONE.add(slippage)), RoundingMode.CEILING);
        }
        return info.roundPrice(basePrice.multiply(BigDecimal.ONE.subtract(slippage)), RoundingMode.FLOOR);
    }

    private static BigDecimal clamp(BigDecimal value) {
        return value.max(BigDecimal.ZERO).min(BigDecimal.ONE);
    }
}
