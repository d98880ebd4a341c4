package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.Tariff;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TariffRepository extends JpaRepository<Tariff, Long> {

    Optional<Tariff> findFirstByChargerIdOrderByIdAsc(Long chargerId);

    Optional<Tariff> findFirstByGlobalTrueOrderByIdAsc();
}
