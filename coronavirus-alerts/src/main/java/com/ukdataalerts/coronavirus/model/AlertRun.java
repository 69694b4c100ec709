package com.ukdataalerts.coronavirus.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks each alert run for observability. Kept in memory as the last run
 * and reported through the status endpoint.
 */
@Data
@Builder
public class AlertRun {

    private String runId;           // UUID
    private VerificationMode verificationMode;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL | FAILED
    private int newDefinitions;
    private int checksEvaluated;
    private int checksFailed;
    private int alertsSent;
    @Builder.Default
    private List<String> failedChecks = new ArrayList<>();
    private String errorMessage;    // null on success
}
