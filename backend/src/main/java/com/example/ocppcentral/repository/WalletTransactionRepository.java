package com.example.ocppcentral.repository;

import com.example.ocppcentral.model.WalletTransaction;
import com.example.ocppcentral.model.WalletTransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, Long> {

    boolean existsByChargingTransactionIdAndType(Long chargingTransactionId, WalletTransactionType type);

    List<WalletTransaction> findByChargingTransactionId(Long chargingTransactionId);
}
