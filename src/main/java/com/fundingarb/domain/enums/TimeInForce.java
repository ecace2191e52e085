package com.fundingarb.domain.enums;

/**
 * Order time-in-force.
 * POST_ONLY rests as maker or is rejected; IOC fills what it can immediately and cancels the rest.
 */
public enum TimeInForce {
    GTC,
    IOC,
    POST_ONLY,
    FOK
}
