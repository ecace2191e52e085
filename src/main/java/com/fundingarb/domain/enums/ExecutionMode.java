package com.fundingarb.domain.enums;

/**
 * How the two entry legs are sequenced.
 * SEQUENTIAL finishes the maker leg before hedging; PARALLEL fires both legs together.
 */
public enum ExecutionMode {
    SEQUENTIAL,
    PARALLEL
}
