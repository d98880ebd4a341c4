package com.example.ocppcentral.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "meter_value")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeterValue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false)
    private Long transactionId;

    @Column(name = "reading_kwh", nullable = false)
    private Double readingKwh;

    @Column(name = "current_a")
    private Double currentA;

    @Column(name = "voltage_v")
    private Double voltageV;

    @Column(name = "power_kw")
    private Double powerKw;

    @Column(name = "created_at")
    private Instant createdAt;
}
