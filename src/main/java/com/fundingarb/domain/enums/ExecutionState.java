package com.fundingarb.domain.enums;

/**
 * Fine-grained execution progress of a trade's entry.
 *
 * <p>The happy path is PENDING -> LEG1_SUBMITTED -> LEG1_FILLED -> LEG2_SUBMITTED -> COMPLETE.
 * ABORTED is absorbing and reachable from any state before COMPLETE. The ROLLBACK_* states record
 * compensation progress after an aborted entry left live exposure; they sort after ABORTED so the
 * state still only moves forward.
 */
public enum ExecutionState {
    PENDING(0),
    LEG1_SUBMITTED(1),
    LEG1_FILLED(2),
    LEG2_SUBMITTED(3),
    COMPLETE(4),
    ABORTED(5),
    ROLLBACK_QUEUED(6),
    ROLLBACK_IN_PROGRESS(7),
    ROLLBACK_DONE(8),
    ROLLBACK_FAILED(8);

    private final int rank;

    ExecutionState(int rank) {
        this.rank = rank;
    }

    /**
     * Whether a trade in this state may move to {@code next}.
     * COMPLETE never moves to ABORTED or a rollback state; a finished rollback is final.
     */
    public boolean canAdvanceTo(ExecutionState next) {
        if (next == this) {
            return true;
        }
        if (this == COMPLETE || this == ROLLBACK_DONE || this == ROLLBACK_FAILED) {
            return false;
        }
        if (next == ABORTED) {
            return rank < ABORTED.rank;
        }
        return next.rank > rank;
    }

    public boolean isRollback() {
        return rank >= ROLLBACK_QUEUED.rank;
    }
}
