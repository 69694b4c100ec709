package com.ukdataalerts.coronavirus.scheduler;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.service.AlertRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup alert runs.
 *
 * Default schedule: every day at 10:00 London time, after the dashboard's
 * afternoon publication of the previous day's figures has settled.
 *
 * Override with ALERT_CRON env var or coronavirus-alerts.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertScheduler {

    private final AlertRunService alertRunService;
    private final AlertsProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running alerts now");
            runSafely();
        } else {
            log.info("Alerts ready. Next scheduled run: {} ({})",
                    properties.getScheduling().getCron(), properties.getScheduling().getZone());
        }
    }

    @Scheduled(cron = "${coronavirus-alerts.scheduling.cron:0 0 10 * * ?}",
            zone = "${coronavirus-alerts.scheduling.zone:Europe/London}")
    public void scheduledRun() {
        log.info("Scheduled alert run triggered");
        runSafely();
    }

    private void runSafely() {
        try {
            alertRunService.run();
        } catch (AlertRunService.RunInProgressException e) {
            log.warn("Skipping alert run: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Alert run failed: {}", e.getMessage(), e);
        }
    }
}
