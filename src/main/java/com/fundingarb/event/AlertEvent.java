package com.fundingarb.event;

import com.fundingarb.domain.enums.AlertLevel;
import java.util.HashMap;
import java.util.Map;

/**
 * Operator-facing alert.
 *
 * <p>{@code incidentKey} identifies the underlying condition (for example
 * {@code "rollback-failed:BTC"}); notification delivery sends each CRITICAL incident once and
 * throttles repeats of the same key. When no key is given the message text is used.
 */
public class AlertEvent extends DomainEvent {

    private final AlertLevel level;
    private final String message;
    private final String incidentKey;
    private final Map<String, Object> details;

    public AlertEvent(Object source, AlertLevel level, String symbol, String message, String incidentKey) {
        this(source, level, symbol, message, incidentKey, null);
    }

    public AlertEvent(
            Object source,
            AlertLevel level,
            String symbol,
            String message,
            String incidentKey,
            Map<String, Object> details) {
        super(source, symbol, null);
        this.level = level;
        this.message = message;
        this.incidentKey = incidentKey != null ? incidentKey : message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public AlertLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getIncidentKey() {
        return incidentKey;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
