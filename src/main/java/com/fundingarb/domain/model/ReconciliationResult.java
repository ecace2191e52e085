package com.fundingarb.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Result of a reconciliation run comparing persisted trades against live venue positions.
 * {@code trigger} is "startup", "scheduled" or "manual".
 */
@Data
@Builder
public class ReconciliationResult {

    private Instant timestamp;
    private String trigger;
    private int tradesChecked;
    private int livePositionCount;

    @Builder.Default
    private List<ReconciliationFinding> findings = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private long durationMs;

    public boolean hasFindings() {
        return findings != null && !findings.isEmpty();
    }
}
