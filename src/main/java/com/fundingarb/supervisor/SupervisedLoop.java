package com.fundingarb.supervisor;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/** A named background loop body with its interval and consecutive failure count. */
public class SupervisedLoop {

    private final String name;
    private final Duration interval;
    private final Runnable body;
    private final AtomicInteger failures = new AtomicInteger();

    public SupervisedLoop(String name, Duration interval, Runnable body) {
        this.name = name;
        this.interval = interval;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    Runnable getBody() {
        return body;
    }

    public int getFailures() {
        return failures.get();
    }

    int recordFailure() {
        return failures.incrementAndGet();
    }

    void resetFailures() {
        failures.set(0);
    }
}
