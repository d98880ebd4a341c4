package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.Vehicle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    Optional<Vehicle> findFirstByUserIdOrderByIdAsc(Long userId);
}
