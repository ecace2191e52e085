package com.fundingarb.domain.enums;

/** What the reconciler does with live exposure that has no persisted trade. */
public enum GhostPolicy {
    IGNORE,
    ADOPT,
    CLOSE
}
