package com.example.ocppcentral.scheduler;

import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.model.TransactionStatus;
import com.example.ocppcentral.repository.ChargingTransactionRepository;
import com.example.ocppcentral.service.BillingResult;
import com.example.ocppcentral.service.BillingService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Retries BILLING_FAILED transactions inside the retry window. Older ones are
 * only reported by the daily archival pass, never retried.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BillingRetryScheduler {

    private final ChargingTransactionRepository transactionRepository;
    private final BillingService billingService;
    private final Clock clock;

    @org.springframework.beans.factory.annotation.Value("${app.billing.retry.window-hours:24}")
    private long retryWindowHours;

    @org.springframework.beans.factory.annotation.Value("${app.billing.retry.item-delay-ms:100}")
    private long itemDelayMs;

    @org.springframework.beans.factory.annotation.Value("${app.billing.archive.after-days:7}")
    private long archiveAfterDays;

    /**
     * Every 30 minutes by default (app.billing.retry.interval-ms).
     */
    @Scheduled(fixedDelayString = "${app.billing.retry.interval-ms:1800000}",
            initialDelayString = "${app.billing.retry.initial-delay-ms:60000}")
    public void scheduledRetry() {
        try {
            retryFailedBillings();
        } catch (RuntimeException e) {
            log.error("Error during billing retry sweep", e);
        }
    }

    public SweepSummary retryFailedBillings() {
        Instant since = clock.instant().minus(retryWindowHours, ChronoUnit.HOURS);
        List<ChargingTransaction> failed = transactionRepository
                .findByStatusAndUpdatedAtAfterOrderByUpdatedAtAsc(TransactionStatus.BILLING_FAILED, since);
        if (failed.isEmpty()) {
            log.debug("No BILLING_FAILED transactions within the last {} hours", retryWindowHours);
            return new SweepSummary(0, 0, 0);
        }

        log.info("Retrying billing for {} BILLING_FAILED transactions", failed.size());
        int succeeded = 0;
        int stillFailing = 0;
        for (int i = 0; i < failed.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Billing retry sweep interrupted after {} of {} transactions", i, failed.size());
                break;
            }
            Long transactionId = failed.get(i).getId();
            BillingResult result = billingService.retryFailedBilling(transactionId);
            if (result.isSuccess()) {
                succeeded++;
            } else {
                stillFailing++;
                log.debug("Retry for transaction {} ended {}: {}", transactionId, result.getOutcome(), result.getMessage());
            }

            if (i < failed.size() - 1 && itemDelayMs > 0) {
                try {
                    Thread.sleep(itemDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Billing retry sweep interrupted after {} of {} transactions", i + 1, failed.size());
                    break;
                }
            }
        }

        log.info("Billing retry sweep completed: {} succeeded, {} failed", succeeded, stillFailing);
        return new SweepSummary(failed.size(), succeeded, stillFailing);
    }

    /**
     * Daily at 3 AM by default (app.billing.archive.cron).
     */
    @Scheduled(cron = "${app.billing.archive.cron:0 0 3 * * *}")
    public void scheduledStaleReport() {
        try {
            reportStaleBillingFailures();
        } catch (RuntimeException e) {
            log.error("Error while reporting stale billing failures", e);
        }
    }

    public int reportStaleBillingFailures() {
        Instant cutoff = clock.instant().minus(archiveAfterDays, ChronoUnit.DAYS);
        List<ChargingTransaction> stale = transactionRepository
                .findByStatusAndUpdatedAtBefore(TransactionStatus.BILLING_FAILED, cutoff);
        for (ChargingTransaction transaction : stale) {
            log.warn("Transaction {} has been BILLING_FAILED since {} and needs manual review",
                    transaction.getId(), transaction.getUpdatedAt());
        }
        if (!stale.isEmpty()) {
            log.warn("{} BILLING_FAILED transactions older than {} days", stale.size(), archiveAfterDays);
        }
        return stale.size();
    }

    @Value
    public static class SweepSummary {
        int total;
        int succeeded;
        int failed;
    }
}
