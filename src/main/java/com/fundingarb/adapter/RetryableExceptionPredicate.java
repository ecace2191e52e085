package com.fundingarb.adapter;

import com.fundingarb.exception.BaseException;
import java.util.function.Predicate;

/** Retry only failures whose error code is marked retryable (rate limits, connection drops). */
public class RetryableExceptionPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof BaseException && ((BaseException) throwable).isRetryable();
    }
}
