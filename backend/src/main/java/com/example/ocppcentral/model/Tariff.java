package com.example.ocppcentral.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "tariff")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tariff {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // null for the global tariff
    @Column(name = "charger_id")
    private Long chargerId;

    @Column(name = "rate_per_kwh", nullable = false, precision = 10, scale = 4)
    private BigDecimal ratePerKwh;

    @Column(name = "is_global", nullable = false)
    private boolean global;
}
