package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.engine.FatalInputException;
import com.ukdataalerts.coronavirus.model.AlertRun;
import com.ukdataalerts.coronavirus.model.CheckResult;
import com.ukdataalerts.coronavirus.model.MetricCheck;
import com.ukdataalerts.coronavirus.output.AlertDispatcher;
import com.ukdataalerts.coronavirus.output.AlertReportRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates one alert run, in order:
 *  1. diff the metric manifest against the baseline and store the new baseline
 *  2. evaluate every configured check; a failing check does not stop the others
 *  3. send the new-metrics and threshold alerts
 *
 * Only one run may be in progress at a time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertRunService {

    private final MetricDefinitionService definitionService;
    private final MetricComparisonService comparisonService;
    private final PopulationSource populationSource;
    private final AlertDispatcher alertDispatcher;
    private final AlertReportRenderer renderer;
    private final AlertsProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile AlertRun lastRun;

    public boolean isRunning() {
        return running.get();
    }

    public Optional<AlertRun> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    /**
     * @throws RunInProgressException if another run has not finished yet
     * @throws RuntimeException       if the manifest cannot be fetched or an alert cannot be sent
     */
    public AlertRun run() {
        if (!running.compareAndSet(false, true)) {
            throw new RunInProgressException();
        }

        AlertRun run = AlertRun.builder()
                .runId(UUID.randomUUID().toString())
                .verificationMode(properties.getVerificationMode())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();
        lastRun = run;
        log.info("Alert run {} started ({} mode, {} checks)",
                run.getRunId(), run.getVerificationMode(), properties.getChecks().size());

        try {
            Set<String> newDefinitions = definitionService.detectNewDefinitions();
            run.setNewDefinitions(newDefinitions.size());

            RunContext context = new RunContext(
                    properties.getVerificationMode(),
                    properties.getThresholds().toThresholds(),
                    populationSource);

            List<CheckResult> results = new ArrayList<>();
            for (MetricCheck check : properties.getChecks()) {
                CheckResult result = evaluate(check, context);
                results.add(result);
                if (result.isFailed()) {
                    run.getFailedChecks().add(check.describe());
                }
            }
            run.setChecksEvaluated(results.size() - run.getFailedChecks().size());
            run.setChecksFailed(run.getFailedChecks().size());

            if (!newDefinitions.isEmpty()) {
                alertDispatcher.sendAlert(AlertReportRenderer.NEW_METRICS_SUBJECT,
                        renderer.renderNewMetrics(newDefinitions));
                run.setAlertsSent(run.getAlertsSent() + 1);
            }

            if (results.stream().anyMatch(CheckResult::hasAlerts)) {
                alertDispatcher.sendAlert(AlertReportRenderer.THRESHOLD_SUBJECT,
                        renderer.renderThresholdAlert(results));
                run.setAlertsSent(run.getAlertsSent() + 1);
            } else {
                log.info("No metric exceeded {}% change", properties.getThresholds().getPercentageChange());
            }

            run.setStatus(run.getChecksFailed() > 0 ? "PARTIAL" : "SUCCESS");
            return run;

        } catch (RuntimeException e) {
            log.error("Alert run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            log.info("Alert run {} finished: {} ({} new metrics, {} checks evaluated, {} failed, {} alerts sent)",
                    run.getRunId(), run.getStatus(), run.getNewDefinitions(), run.getChecksEvaluated(),
                    run.getChecksFailed(), run.getAlertsSent());
            running.set(false);
        }
    }

    private CheckResult evaluate(MetricCheck check, RunContext context) {
        try {
            return comparisonService.evaluate(check, context);
        } catch (FatalInputException e) {
            log.error("Check {} aborted: {}", check.describe(), e.getMessage());
            return CheckResult.failed(check, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Check {} failed: {}", check.describe(), e.getMessage(), e);
            return CheckResult.failed(check, e.getMessage());
        }
    }

    public static class RunInProgressException extends IllegalStateException {
        public RunInProgressException() {
            super("An alert run is already in progress");
        }
    }
}
