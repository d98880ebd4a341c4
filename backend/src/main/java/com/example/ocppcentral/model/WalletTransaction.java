package com.example.ocppcentral.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Ledger entry on a wallet. Charges are negative amounts of type CHARGE_DEDUCT,
 * one per billed charging transaction.
 */
@Entity
@Table(name = "wallet_transaction")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "wallet_id", nullable = false)
    private Long walletId;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false)
    private WalletTransactionType type;

    @Column(name = "description")
    private String description;

    @Column(name = "charging_transaction_id")
    private Long chargingTransactionId;

    @Lob
    @Column(name = "metadata")
    private String metadata;

    @Column(name = "created_at")
    private Instant createdAt;
}
