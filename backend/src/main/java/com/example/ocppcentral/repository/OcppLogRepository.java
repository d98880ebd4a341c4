package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.OcppLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OcppLogRepository extends JpaRepository<OcppLog, Long> {

    List<OcppLog> findAllByOrderByTimestampDesc(Pageable pageable);

    List<OcppLog> findByChargePointIdOrderByTimestampDesc(String chargePointId, Pageable pageable);

    @Modifying
    @Query("delete from OcppLog l where l.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
