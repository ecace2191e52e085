package com.fundingarb.domain.model;

import lombok.Getter;

/**
 * Result of exit evaluation. At most one of {@code shouldExit} and {@code rebalance} is set.
 * {@code emergency} exits skip the maker phase of the close.
 */
@Getter
public class ExitDecision {

    private static final ExitDecision HOLD = new ExitDecision(false, false, false, null);

    private final boolean shouldExit;
    private final boolean emergency;
    private final boolean rebalance;
    private final String reason;

    private ExitDecision(boolean shouldExit, boolean emergency, boolean rebalance, String reason) {
        this.shouldExit = shouldExit;
        this.emergency = emergency;
        this.rebalance = rebalance;
        this.reason = reason;
    }

    public static ExitDecision hold() {
        return HOLD;
    }

    public static ExitDecision hold(String reason) {
        return new ExitDecision(false, false, false, reason);
    }

    public static ExitDecision exit(String reason) {
        return new ExitDecision(true, false, false, reason);
    }

    public static ExitDecision emergency(String reason) {
        return new ExitDecision(true, true, false, reason);
    }

    public static ExitDecision rebalance(String reason) {
        return new ExitDecision(false, false, true, reason);
    }

    @Override
    public String toString() {
        return "ExitDecision{exit=" + shouldExit + ", emergency=" + emergency + ", rebalance=" + rebalance
                + ", reason=" + reason + "}";
    }
}
