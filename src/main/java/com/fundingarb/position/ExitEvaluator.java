package com.fundingarb.position;

import com.fundingarb.config.PositionConfig;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.model.ExitDecision;
import com.fundingarb.domain.model.FundingRate;
import com.fundingarb.domain.model.Trade;
import com.fundingarb.domain.model.TradeLeg;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Decides whether an open trade should be held, rebalanced or closed. Pure: reads only the
 * trade and the supplied {@link ExitContext}; first matching rule wins.
 *
 * <p>Rule order:
 * <ol>
 *   <li>liquidation distance (emergency)</li>
 *   <li>delta bound: rebalance band, emergency above it</li>
 *   <li>catastrophic funding flip (emergency)</li>
 *   <li>early take profit</li>
 *   <li>minimum hold gate: nothing below this line fires before it</li>
 *   <li>maximum hold</li>
 *   <li>funding flip, cost-checked</li>
 *   <li>net expected value over the horizon</li>
 *   <li>profit target</li>
 *   <li>opportunity-cost rotation</li>
 * </ol>
 *
 * <p>A net-EV hold means the projected funding still beats the exit cost; by default that edge
 * also suppresses the profit target and rotation rules.
 */
@Component
public class ExitEvaluator {

    static final String EMERGENCY = "EMERGENCY";
    static final String REBALANCE = "REBALANCE";
    static final String EARLY_TAKE_PROFIT = "EARLY_TAKE_PROFIT";

    private final PositionConfig positionConfig;

    public ExitEvaluator(PositionConfig positionConfig) {
        this.positionConfig = positionConfig;
    }

    public ExitDecision evaluate(ExitContext ctx) {
        Trade trade = ctx.getTrade();
        BigDecimal exitCost = orZero(ctx.getEstimatedExitCostUsd());
        BigDecimal currentPnl = orZero(ctx.getCurrentPnl());

        // ---- emergencies, ignore hold gates ----
        if (positionConfig.isLiquidationMonitoringEnabled()) {
            String liquidation = checkLiquidation(ctx);
            if (liquidation != null) {
                return ExitDecision.emergency(EMERGENCY + ": " + liquidation);
            }
        }
        if (positionConfig.isDeltaBoundEnabled()) {
            BigDecimal drift = deltaDrift(trade, ctx.getLeg1MarkPrice(), ctx.getLeg2MarkPrice());
            if (drift != null) {
                if (drift.compareTo(positionConfig.getDeltaBoundMax()) > 0) {
                    return ExitDecision.emergency(String.format("%s: delta drift %s > %s", EMERGENCY, pct(drift),
                            pct(positionConfig.getDeltaBoundMax())));
                }
                if (positionConfig.isRebalanceEnabled() && drift.compareTo(positionConfig.getRebalanceMinDelta()) >= 0) {
                    return ExitDecision.rebalance(String.format("%s: delta drift %s in band %s - %s", REBALANCE,
                            pct(drift), pct(positionConfig.getRebalanceMinDelta()),
                            pct(positionConfig.getDeltaBoundMax())));
                }
            }
        }
        BigDecimal currentApy = ctx.currentApy();
        if (positive(trade.getEntryApy()) && currentApy.compareTo(positionConfig.getCatastrophicFlipApy()) < 0) {
            return ExitDecision.emergency(String.format("%s: catastrophic funding flip to %s APY (entry %s)",
                    EMERGENCY, pct(currentApy), pct(trade.getEntryApy())));
        }

        if (positionConfig.isEarlyTakeProfitEnabled() && positive(positionConfig.getEarlyTakeProfitBaseUsd())) {
            BigDecimal threshold = earlyTakeProfitThreshold(exitCost);
            BigDecimal pricePnl = ctx.getPricePnl() != null ? ctx.getPricePnl() : currentPnl;
            if (pricePnl.compareTo(threshold) >= 0 && currentPnl.signum() >= 0) {
                return ExitDecision.exit(String.format("%s: price PnL %s >= %s", EARLY_TAKE_PROFIT,
                        money(pricePnl), money(threshold)));
            }
        }

        // ---- hold gates ----
        Duration held = trade.holdDuration(ctx.getNow());
        if (held.compareTo(positionConfig.getMinHold()) < 0) {
            return ExitDecision.hold(String.format("Hold time %ss < min %ss", held.getSeconds(),
                    positionConfig.getMinHold().getSeconds()));
        }
        if (held.compareTo(positionConfig.getMaxHold()) >= 0) {
            return ExitDecision.exit("Max hold time reached: " + positionConfig.getMaxHold().toHours() + "h");
        }

        // ---- economics ----
        BigDecimal netHourly = ctx.netFundingHourly();
        BigDecimal notional = notional(trade);

        if (positive(trade.getEntryApy()) && currentApy.compareTo(positionConfig.getFundingFlipApyThreshold()) < 0) {
            if (currentPnl.compareTo(exitCost) > 0) {
                return ExitDecision.exit(String.format("Funding flipped (%s APY), locking profit %s", pct(currentApy),
                        money(currentPnl)));
            }
            BigDecimal projectedLoss = netHourly.abs().multiply(notional)
                    .multiply(positionConfig.getFundingFlipHorizonHours());
            if (projectedLoss.compareTo(exitCost) > 0) {
                return ExitDecision.exit(String.format("Funding flip: %sh loss %s > exit cost %s",
                        positionConfig.getFundingFlipHorizonHours(), money(projectedLoss), money(exitCost)));
            }
        }

        String holdReason = "Hold: no exit condition met";
        boolean edgeGood = false;
        if (positionConfig.isNetEvEnabled() && positive(positionConfig.getNetEvHorizonHours())) {
            BigDecimal projected = netHourly.multiply(notional).multiply(positionConfig.getNetEvHorizonHours());
            BigDecimal threshold = exitCost.multiply(positionConfig.getNetEvExitCostMultiple());
            if (projected.signum() < 0 && projected.abs().compareTo(threshold) >= 0) {
                return ExitDecision.exit(String.format("NetEV: projected %sh funding loss %s >= %s",
                        positionConfig.getNetEvHorizonHours(), money(projected.abs()), money(threshold)));
            }
            if (projected.signum() >= 0 && projected.compareTo(threshold) < 0) {
                return ExitDecision.exit(String.format("NetEV: projected %sh funding %s < %s",
                        positionConfig.getNetEvHorizonHours(), money(projected), money(threshold)));
            }
            holdReason = String.format("Hold (NetEV): projected %s vs exit cost %s", money(projected),
                    money(threshold));
            edgeGood = true;
        }

        if (!(edgeGood && positionConfig.isNetEvSkipProfitTargetWhenEdgeGood())
                && currentPnl.compareTo(positionConfig.getProfitTargetUsd()) >= 0) {
            return ExitDecision.exit("Profit target hit: " + money(currentPnl));
        }

        if (!(edgeGood && positionConfig.isNetEvSkipOpportunityCostWhenEdgeGood())) {
            String rotation = checkRotation(ctx.getBestOpportunityApy(), currentApy, notional, exitCost);
            if (rotation != null) {
                return ExitDecision.exit(rotation);
            }
        }
        return ExitDecision.hold(holdReason);
    }

    // ========================
    // RULES
    // ========================

    /** {@code base + max(exitCost * multiple, minBuffer) + executionBuffer}. */
    public BigDecimal earlyTakeProfitThreshold(BigDecimal exitCost) {
        BigDecimal slippageBuffer = exitCost.multiply(positionConfig.getEarlyTakeProfitSlippageMultiple());
        return positionConfig.getEarlyTakeProfitBaseUsd()
                .add(slippageBuffer.max(positionConfig.getEarlyTakeProfitMinBufferUsd()))
                .add(positionConfig.getEarlyTakeProfitExecutionBufferUsd().max(BigDecimal.ZERO));
    }

    private String checkLiquidation(ExitContext ctx) {
        BigDecimal d1 = ctx.getLeg1LiquidationDistance();
        BigDecimal d2 = ctx.getLeg2LiquidationDistance();
        if (d1 == null || d2 == null) {
            return null;
        }
        BigDecimal worst = d1.min(d2);
        if (worst.compareTo(positionConfig.getLiquidationDistanceMin()) >= 0) {
            return null;
        }
        String venue = d1.compareTo(d2) <= 0 ? ctx.getTrade().getLeg1().getVenue().name()
                : ctx.getTrade().getLeg2().getVenue().name();
        return String.format("%s leg %s from liquidation < %s", venue, pct(worst),
                pct(positionConfig.getLiquidationDistanceMin()));
    }

    private String checkRotation(BigDecimal bestApy, BigDecimal currentApy, BigDecimal notional, BigDecimal exitCost) {
        if (bestApy == null || bestApy.compareTo(currentApy.add(positionConfig.getOpportunityCostApyDiff())) <= 0) {
            return null;
        }
        if (notional.signum() > 0 && exitCost.signum() > 0 && positive(positionConfig.getNetEvHorizonHours())) {
            BigDecimal gain = notional.multiply(bestApy.subtract(currentApy))
                    .multiply(positionConfig.getNetEvHorizonHours())
                    .divide(FundingRate.HOURS_PER_YEAR, MathContext.DECIMAL64);
            BigDecimal cost = exitCost.multiply(positionConfig.getRotationRoundtripMultiple())
                    .add(positionConfig.getRotationLatencyPenaltyUsd())
                    .multiply(positionConfig.getNetEvExitCostMultiple());
            if (gain.compareTo(cost) < 0) {
                return null;
            }
            return String.format("Opportunity rotation: %sh gain %s >= switching cost %s (APY %s vs %s)",
                    positionConfig.getNetEvHorizonHours(), money(gain), money(cost), pct(bestApy), pct(currentApy));
        }
        return String.format("Opportunity cost: APY %s > current %s + %s", pct(bestApy), pct(currentApy),
                pct(positionConfig.getOpportunityCostApyDiff()));
    }

    /**
     * Net signed notional over gross notional, at marks (entry price when no mark). Null when
     * either leg has no notional.
     */
    public static BigDecimal deltaDrift(Trade trade, BigDecimal leg1Mark, BigDecimal leg2Mark) {
        BigDecimal n1 = legNotional(trade.getLeg1(), leg1Mark);
        BigDecimal n2 = legNotional(trade.getLeg2(), leg2Mark);
        if (n1.signum() == 0 || n2.signum() == 0) {
            return null;
        }
        BigDecimal signed1 = trade.getLeg1().getSide() == Side.BUY ? n1 : n1.negate();
        BigDecimal signed2 = trade.getLeg2().getSide() == Side.BUY ? n2 : n2.negate();
        return signed1.add(signed2).abs().divide(n1.add(n2), MathContext.DECIMAL64);
    }

    private static BigDecimal legNotional(TradeLeg leg, BigDecimal mark) {
        BigDecimal price = mark != null && mark.signum() > 0 ? mark : leg.getEntryPrice();
        if (price == null) {
            return BigDecimal.ZERO;
        }
        return leg.getFilledQty().multiply(price);
    }

    private static BigDecimal notional(Trade trade) {
        BigDecimal notional = trade.getTargetNotionalUsd();
        if (!positive(notional)) {
            notional = trade.entryNotional().abs();
        }
        return notional;
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static String pct(BigDecimal fraction) {
        return fraction.movePointRight(2).setScale(2, RoundingMode.HALF_UP) + "%";
    }

    private static String money(BigDecimal usd) {
        return "$" + usd.setScale(2, RoundingMode.HALF_UP);
    }
}
