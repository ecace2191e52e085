package com.fundingarb.domain.enums;

/** How the leg 1 maker timeout budget is split across attempts. */
public enum AttemptSchedule {
    /** Every attempt gets the same share. */
    EQUAL,
    /** Attempt n gets a share proportional to n, so later (more aggressive) attempts wait longer. */
    INCREASING
}
