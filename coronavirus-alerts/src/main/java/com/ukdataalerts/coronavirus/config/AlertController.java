package com.ukdataalerts.coronavirus.config;

import com.ukdataalerts.coronavirus.service.AlertRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class AlertController {

    private final AlertRunService alertRunService;
    private final AlertsProperties properties;

    @PostMapping("/alerts/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (alertRunService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "alert run already in progress"));
        }
        new Thread(this::runQuietly, "manual-alert-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/alerts/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("service", "uk-coronavirus-data-alerts");
        status.put("version", "1.0.0");
        status.put("verificationMode", properties.getVerificationMode());
        status.put("checks", properties.getChecks().stream().map(c -> c.describe()).toList());
        status.put("running", alertRunService.isRunning());
        alertRunService.getLastRun().ifPresent(run -> status.put("lastRun", run));
        return ResponseEntity.ok(status);
    }

    private void runQuietly() {
        try {
            alertRunService.run();
        } catch (AlertRunService.RunInProgressException e) {
            log.warn("Manual alert run skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Manual alert run failed: {}", e.getMessage(), e);
        }
    }
}
