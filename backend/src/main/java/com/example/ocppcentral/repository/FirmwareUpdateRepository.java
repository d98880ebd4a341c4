package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.FirmwareUpdate;
import com.example.ocppcentral.model.FirmwareUpdateStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface FirmwareUpdateRepository extends JpaRepository<FirmwareUpdate, Long> {

    Optional<FirmwareUpdate> findFirstByChargerIdAndStatusInOrderByInitiatedAtDesc(
            Long chargerId, Collection<FirmwareUpdateStatus> statuses);

    List<FirmwareUpdate> findByChargerIdOrderByInitiatedAtDesc(Long chargerId);
}
