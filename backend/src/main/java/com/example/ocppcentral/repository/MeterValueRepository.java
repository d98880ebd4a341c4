package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.MeterValue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MeterValueRepository extends JpaRepository<MeterValue, Long> {

    Optional<MeterValue> findFirstByTransactionIdOrderByCreatedAtDescIdDesc(Long transactionId);

    List<MeterValue> findByTransactionIdOrderByCreatedAtAsc(Long transactionId);
}
