package com.ukdataalerts.coronavirus.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of evaluating one {@link MetricCheck} during a run.
 */
@Value
@Builder
public class CheckResult {

    MetricCheck check;

    /** Null when the check failed before a window could be resolved */
    ComparisonWindow window;

    /** Every area that could be compared, in series order */
    @Singular
    List<AreaResult> rows;

    /** Areas exceeding thresholds, highest change first */
    @Singular
    List<AreaResult> alerts;

    /** Areas skipped because a window had no data */
    int excludedAreas;

    /** Null on success */
    String failure;

    public boolean isFailed() {
        return failure != null;
    }

    public boolean hasAlerts() {
        return !alerts.isEmpty();
    }

    public static CheckResult failed(MetricCheck check, String failure) {
        return CheckResult.builder()
                .check(check)
                .failure(failure == null ? "unknown error" : failure)
                .build();
    }
}
