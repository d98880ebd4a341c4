package com.example.ocppcentral.service;

import com.example.ocppcentral.exception.ChargerNotFoundException;
import com.example.ocppcentral.model.Charger;
import com.example.ocppcentral.model.ChargerStatus;
import com.example.ocppcentral.repository.ChargerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Charger state written by the protocol handlers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChargerService {

    private final ChargerRepository chargerRepository;
    private final Clock clock;

    public boolean isRegistered(String chargePointId) {
        return chargerRepository.existsByChargePointId(chargePointId);
    }

    public Optional<Charger> findByChargePointId(String chargePointId) {
        return chargerRepository.findByChargePointId(chargePointId);
    }

    public Charger getById(Long chargerId) {
        return chargerRepository.findById(chargerId)
                .orElseThrow(() -> new ChargerNotFoundException("Charger " + chargerId + " not found"));
    }

    @Transactional
    public Optional<Charger> recordBoot(String chargePointId, String vendor, String model, String firmwareVersion) {
        return chargerRepository.findByChargePointId(chargePointId).map(charger -> {
            Instant now = clock.instant();
            charger.setVendor(vendor);
            charger.setModel(model);
            if (firmwareVersion != null) {
                charger.setFirmwareVersion(firmwareVersion);
            }
            charger.setStatus(ChargerStatus.AVAILABLE);
            charger.setLastHeartbeatTime(now);
            charger.setUpdatedAt(now);
            return chargerRepository.save(charger);
        });
    }

    @Transactional
    public Optional<Charger> recordHeartbeat(String chargePointId) {
        return chargerRepository.findByChargePointId(chargePointId).map(charger -> {
            charger.setLastHeartbeatTime(clock.instant());
            return chargerRepository.save(charger);
        });
    }

    @Transactional
    public Optional<Charger> updateStatus(String chargePointId, ChargerStatus status) {
        return chargerRepository.findByChargePointId(chargePointId).map(charger -> {
            Instant now = clock.instant();
            charger.setStatus(status);
            charger.setLastHeartbeatTime(now);
            charger.setUpdatedAt(now);
            return chargerRepository.save(charger);
        });
    }
}
