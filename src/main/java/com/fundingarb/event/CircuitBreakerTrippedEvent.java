package com.fundingarb.event;

import java.time.Instant;

/** New entries are paused. {@code resumeAfter} is null when only manual acknowledgement resumes. */
public class CircuitBreakerTrippedEvent extends DomainEvent {

    private final String reason;
    private final Instant resumeAfter;

    public CircuitBreakerTrippedEvent(Object source, String symbol, String reason, Instant resumeAfter) {
        super(source, symbol, null);
        this.reason = reason;
        this.resumeAfter = resumeAfter;
    }

    public String getReason() {
        return reason;
    }

    public Instant getResumeAfter() {
        return resumeAfter;
    }
}
