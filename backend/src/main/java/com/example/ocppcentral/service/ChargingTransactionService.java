package com.example.ocppcentral.service;

import com.example.ocppcentral.exception.InvalidStateException;
import com.example.ocppcentral.exception.TransactionNotFoundException;
import com.example.ocppcentral.model.ChargerStatus;
import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.model.MeterValue;
import com.example.ocppcentral.model.TransactionStatus;
import com.example.ocppcentral.repository.ChargingTransactionRepository;
import com.example.ocppcentral.repository.MeterValueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Status changes of charging transactions outside the billing boundary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChargingTransactionService {

    public enum StopOutcome {
        STOPPED,
        ALREADY_FINISHED,
        NOT_FOUND
    }

    private final ChargingTransactionRepository transactionRepository;
    private final MeterValueRepository meterValueRepository;
    private final Clock clock;

    public Optional<ChargingTransaction> findById(Long transactionId) {
        return transactionRepository.findById(transactionId);
    }

    public Optional<ChargingTransaction> findActiveForCharger(Long chargerId) {
        return transactionRepository.findFirstByChargerIdAndStatusInOrderByStartTimeDesc(
                chargerId, TransactionStatus.ACTIVE);
    }

    public boolean hasActiveTransaction(Long chargerId) {
        return transactionRepository.existsByChargerIdAndStatusIn(chargerId, TransactionStatus.ACTIVE);
    }

    public List<ChargingTransaction> findBillingFailed() {
        return transactionRepository.findByStatusOrderByUpdatedAtDesc(TransactionStatus.BILLING_FAILED);
    }

    @Transactional
    public ChargingTransaction startTransaction(Long chargerId, Long userId, Long vehicleId,
                                                Integer connectorId, String idTag, int meterStartWh,
                                                Instant startTime) {
        Instant now = clock.instant();
        ChargingTransaction transaction = transactionRepository.save(ChargingTransaction.builder()
                .chargerId(chargerId)
                .userId(userId)
                .vehicleId(vehicleId)
                .connectorId(connectorId)
                .idTag(idTag)
                .startMeterKwh(meterStartWh / 1000.0)
                .startTime(startTime != null ? startTime : now)
                .status(TransactionStatus.RUNNING)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Created transaction {} for charger {} with status RUNNING", transaction.getId(), chargerId);
        return transaction;
    }

    /**
     * Applies a StopTransaction. A transaction that is no longer ongoing keeps its
     * status and energy; a FAILED one without an end reading gets {@code meterStopWh}.
     */
    @Transactional
    public StopOutcome stopTransaction(Long transactionId, int meterStopWh, String reason) {
        Optional<ChargingTransaction> found = transactionRepository.findByIdForUpdate(transactionId);
        if (found.isEmpty()) {
            log.error("Transaction {} not found for StopTransaction", transactionId);
            return StopOutcome.NOT_FOUND;
        }
        ChargingTransaction transaction = found.get();
        if (!transaction.getStatus().isOngoing()) {
            log.warn("Duplicate StopTransaction for transaction {} in status {}", transactionId, transaction.getStatus());
            if (transaction.getStatus() == TransactionStatus.FAILED && transaction.getEndMeterKwh() == null) {
                // failed by a status change before any meter value arrived; keep the final reading only
                transaction.setEndMeterKwh(meterStopWh / 1000.0);
                transactionRepository.save(transaction);
                log.info("Recorded final meter reading {} Wh for failed transaction {}", meterStopWh, transactionId);
            }
            return StopOutcome.ALREADY_FINISHED;
        }

        Instant now = clock.instant();
        double endMeterKwh = meterStopWh / 1000.0;
        double startMeterKwh = transaction.getStartMeterKwh() == null ? 0.0 : transaction.getStartMeterKwh();
        transaction.setEndMeterKwh(endMeterKwh);
        transaction.setEnergyConsumedKwh(endMeterKwh - startMeterKwh);
        transaction.setEndTime(now);
        transaction.setStopReason(reason == null || reason.isBlank() ? "Remote" : reason);
        if (transaction.getStatus() == TransactionStatus.STARTED
                || transaction.getStatus() == TransactionStatus.PENDING_START) {
            transaction.transitionTo(TransactionStatus.RUNNING, now);
        }
        transaction.transitionTo(TransactionStatus.COMPLETED, now);
        transactionRepository.save(transaction);
        log.info("Transaction {} stopped: {} kWh consumed", transactionId, transaction.getEnergyConsumedKwh());
        return StopOutcome.STOPPED;
    }

    /**
     * Fails every ongoing transaction of a charger whose connector left the
     * charging states. Returns the ids that have energy to bill.
     */
    @Transactional
    public List<Long> failOngoingTransactions(Long chargerId, ChargerStatus status) {
        List<ChargingTransaction> ongoing = transactionRepository.findByChargerIdAndStatusIn(
                chargerId, TransactionStatus.ONGOING);
        List<Long> billable = new ArrayList<>();
        if (ongoing.isEmpty()) {
            return billable;
        }
        log.info("Status {} on charger {}: failing {} ongoing transactions", status, chargerId, ongoing.size());

        Instant now = clock.instant();
        for (ChargingTransaction transaction : ongoing) {
            if (transaction.getEndMeterKwh() == null) {
                Optional<MeterValue> latest = meterValueRepository
                        .findFirstByTransactionIdOrderByCreatedAtDescIdDesc(transaction.getId());
                if (latest.isPresent()) {
                    double start = transaction.getStartMeterKwh() == null ? 0.0 : transaction.getStartMeterKwh();
                    transaction.setEndMeterKwh(latest.get().getReadingKwh());
                    transaction.setEnergyConsumedKwh(latest.get().getReadingKwh() - start);
                } else {
                    log.warn("No meter values for transaction {}, energy unknown", transaction.getId());
                }
            }
            transaction.setStopReason("STATUS_CHANGE_TO_" + status.getOcppValue());
            transaction.setEndTime(now);
            transaction.transitionTo(TransactionStatus.FAILED, now);
            transactionRepository.save(transaction);

            Double energy = transaction.getEnergyConsumedKwh();
            if (energy != null && energy > 0) {
                billable.add(transaction.getId());
            }
        }
        return billable;
    }

    /**
     * Commits independently of the caller, whose billing transaction has rolled back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markBillingFailed(Long transactionId, String reason) {
        Optional<ChargingTransaction> found = transactionRepository.findById(transactionId);
        if (found.isEmpty()) {
            log.error("Cannot mark missing transaction {} as BILLING_FAILED", transactionId);
            return;
        }
        ChargingTransaction transaction = found.get();
        if (transaction.getStatus() == TransactionStatus.BILLING_FAILED) {
            // retry window is measured from the first failure
            log.warn("Billing retry failed again for transaction {}: {}", transactionId, reason);
            return;
        }
        if (!transaction.getStatus().canTransitionTo(TransactionStatus.BILLING_FAILED)) {
            log.error("Billing failed for transaction {} in status {}, cannot mark BILLING_FAILED: {}",
                    transactionId, transaction.getStatus(), reason);
            return;
        }
        transaction.transitionTo(TransactionStatus.BILLING_FAILED, clock.instant());
        transactionRepository.save(transaction);
        log.warn("Transaction {} marked BILLING_FAILED: {}", transactionId, reason);
    }

    /**
     * Admin stop of a transaction the charger never closed.
     */
    @Transactional
    public ChargingTransaction forceStop(Long transactionId, String reason) {
        ChargingTransaction transaction = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction " + transactionId + " not found"));
        if (!transaction.getStatus().isOngoing()) {
            throw new InvalidStateException("Transaction " + transactionId + " is already " + transaction.getStatus());
        }
        Instant now = clock.instant();
        transaction.setEndTime(now);
        transaction.setStopReason("Force stopped by admin: " + (reason == null ? "" : reason));
        transaction.transitionTo(TransactionStatus.STOPPED, now);
        log.info("Transaction {} force stopped: {}", transactionId, reason);
        return transactionRepository.save(transaction);
    }
}
