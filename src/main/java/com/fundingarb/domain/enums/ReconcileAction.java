package com.fundingarb.domain.enums;

/** Corrective action taken (or alert raised) by a reconciliation pass. */
public enum ReconcileAction {
    CLOSED_ZOMBIE("closed_zombie"),
    ADOPTED_GHOST("adopted_ghost"),
    CLOSED_CONFLICT("closed_conflict"),
    QUANTITY_MISMATCH("quantity_mismatch"),
    IGNORED("ignored");

    private final String code;

    ReconcileAction(String code) {
        this.code = code;
    }

    /** Stable lower-case code used in events and alerts. */
    public String getCode() {
        return code;
    }
}
