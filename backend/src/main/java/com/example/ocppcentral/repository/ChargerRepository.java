package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.Charger;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChargerRepository extends JpaRepository<Charger, Long> {

    Optional<Charger> findByChargePointId(String chargePointId);

    boolean existsByChargePointId(String chargePointId);
}
