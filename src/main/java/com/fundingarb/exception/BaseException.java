package com.fundingarb.exception;

import com.fundingarb.domain.enums.Venue;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String symbol;
    private final Venue venue;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, String symbol, Venue venue) {
        this(errorCode, message, symbol, venue, null, null);
    }

    protected BaseException(
            ErrorCode errorCode,
            String message,
            String symbol,
            Venue venue,
            Map<String, Object> details,
            Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.symbol = symbol;
        this.venue = venue;
        this.details = details != null ? Collections.unmodifiableMap(new HashMap<>(details)) : Map.of();
    }

    /** Builds a details map from key/value pairs; null values are kept. */
    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
