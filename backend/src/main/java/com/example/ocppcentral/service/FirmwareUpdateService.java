package com.example.ocppcentral.service;

import com.example.ocppcentral.model.Charger;
import com.example.ocppcentral.model.FirmwareUpdate;
import com.example.ocppcentral.model.FirmwareUpdateStatus;
import com.example.ocppcentral.repository.ChargerRepository;
import com.example.ocppcentral.repository.FirmwareUpdateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FirmwareUpdateService {

    private final FirmwareUpdateRepository firmwareUpdateRepository;
    private final ChargerRepository chargerRepository;
    private final Clock clock;

    @Transactional
    public FirmwareUpdate createPending(Charger charger, Long firmwareFileId, String location, String targetVersion) {
        FirmwareUpdate update = firmwareUpdateRepository.save(FirmwareUpdate.builder()
                .chargerId(charger.getId())
                .firmwareFileId(firmwareFileId)
                .targetVersion(targetVersion)
                .downloadUrl(location)
                .status(FirmwareUpdateStatus.PENDING)
                .initiatedAt(clock.instant())
                .build());
        log.info("Firmware update {} created for {} -> {}", update.getId(), charger.getChargePointId(), targetVersion);
        return update;
    }

    @Transactional
    public FirmwareUpdate markCommandFailed(Long updateId, String error) {
        FirmwareUpdate update = firmwareUpdateRepository.findById(updateId)
                .orElseThrow(() -> new IllegalStateException("Firmware update " + updateId + " disappeared"));
        update.setStatus(FirmwareUpdateStatus.DOWNLOAD_FAILED);
        update.setErrorMessage("Failed to send OCPP command: " + error);
        update.setCompletedAt(clock.instant());
        log.error("Firmware update {} failed to start: {}", updateId, error);
        return firmwareUpdateRepository.save(update);
    }

    public List<FirmwareUpdate> history(Long chargerId) {
        return firmwareUpdateRepository.findByChargerIdOrderByInitiatedAtDesc(chargerId);
    }

    /**
     * Applies a FirmwareStatusNotification to the charger's update in progress.
     * Idle, unknown statuses and illegal moves are logged and ignored.
     */
    @Transactional
    public Optional<FirmwareUpdate> applyStatusNotification(String chargePointId, String ocppStatus) {
        Optional<FirmwareUpdateStatus> mapped = FirmwareUpdateStatus.fromOcpp(ocppStatus);
        if (mapped.isEmpty()) {
            log.info("Firmware status {} from {} carries no update transition", ocppStatus, chargePointId);
            return Optional.empty();
        }
        Optional<Charger> charger = chargerRepository.findByChargePointId(chargePointId);
        if (charger.isEmpty()) {
            log.warn("FirmwareStatusNotification from unknown charger {}", chargePointId);
            return Optional.empty();
        }
        Optional<FirmwareUpdate> inProgress = firmwareUpdateRepository
                .findFirstByChargerIdAndStatusInOrderByInitiatedAtDesc(charger.get().getId(), FirmwareUpdateStatus.IN_PROGRESS);
        if (inProgress.isEmpty()) {
            log.warn("Firmware status {} from {} with no update in progress", ocppStatus, chargePointId);
            return Optional.empty();
        }

        FirmwareUpdate update = inProgress.get();
        FirmwareUpdateStatus next = mapped.get();
        if (update.getStatus() == next) {
            return Optional.of(update);
        }
        if (!update.getStatus().canTransitionTo(next)) {
            log.warn("Ignoring firmware transition {} -> {} for update {}", update.getStatus(), next, update.getId());
            return Optional.of(update);
        }

        Instant now = clock.instant();
        update.setStatus(next);
        if (update.getStartedAt() == null) {
            update.setStartedAt(now);
        }
        if (next.isTerminal()) {
            update.setCompletedAt(now);
        }
        if (next == FirmwareUpdateStatus.DOWNLOAD_FAILED || next == FirmwareUpdateStatus.INSTALLATION_FAILED) {
            update.setErrorMessage("Charger reported " + ocppStatus);
        }
        if (next == FirmwareUpdateStatus.INSTALLED && update.getTargetVersion() != null) {
            charger.get().setFirmwareVersion(update.getTargetVersion());
            chargerRepository.save(charger.get());
        }
        log.info("Firmware update {} for {} is now {}", update.getId(), chargePointId, next);
        return Optional.of(firmwareUpdateRepository.save(update));
    }
}
