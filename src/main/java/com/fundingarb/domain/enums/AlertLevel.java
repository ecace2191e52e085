package com.fundingarb.domain.enums;

/** Severity of an operator alert. CRITICAL requires manual attention. */
public enum AlertLevel {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
