package com.example.ocppcentral.scheduler;

import com.example.ocppcentral.service.MessageLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
@RequiredArgsConstructor
@Slf4j
public class MessageLogRetentionScheduler {

    private final MessageLogService messageLogService;
    private final Clock clock;

    @Value("${app.logs.retention-days:90}")
    private int retentionDays;

    /**
     * Daily at 2:30 AM by default (app.logs.retention-cron).
     */
    @Scheduled(cron = "${app.logs.retention-cron:0 30 2 * * *}")
    public void purgeOldLogs() {
        log.info("Starting OCPP log cleanup (retention: {} days)", retentionDays);
        try {
            Instant cutoff = clock.instant().minus(retentionDays, ChronoUnit.DAYS);
            messageLogService.purgeOlderThan(cutoff);
        } catch (RuntimeException e) {
            log.error("Error during OCPP log cleanup", e);
        }
    }
}
