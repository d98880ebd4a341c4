package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.model.TransactionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ChargingTransactionRepository extends JpaRepository<ChargingTransaction, Long> {

    /**
     * Row-locks the transaction for the duration of the surrounding transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from ChargingTransaction t where t.id = :id")
    Optional<ChargingTransaction> findByIdForUpdate(@Param("id") Long id);

    Optional<ChargingTransaction> findFirstByChargerIdAndStatusInOrderByStartTimeDesc(
            Long chargerId, Collection<TransactionStatus> statuses);

    boolean existsByChargerIdAndStatusIn(Long chargerId, Collection<TransactionStatus> statuses);

    List<ChargingTransaction> findByChargerIdAndStatusIn(Long chargerId, Collection<TransactionStatus> statuses);

    List<ChargingTransaction> findByStatusOrderByUpdatedAtDesc(TransactionStatus status);

    /**
     * BILLING_FAILED rows still inside the retry window.
     */
    List<ChargingTransaction> findByStatusAndUpdatedAtAfterOrderByUpdatedAtAsc(
            TransactionStatus status, Instant since);

    List<ChargingTransaction> findByStatusAndUpdatedAtBefore(TransactionStatus status, Instant before);
}
