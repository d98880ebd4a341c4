package com.example.ocppcentral.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "ocpp_log", indexes = {
        @Index(name = "idx_ocpp_log_cp_ts", columnList = "charge_point_id, logged_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcppLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "charge_point_id", nullable = false)
    private String chargePointId;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false)
    private MessageDirection direction;

    @Column(name = "message_type")
    private String messageType;

    @Lob
    @Column(name = "payload")
    private String payload;

    @Column(name = "status")
    private String status;

    @Column(name = "correlation_id")
    private String correlationId;

    @Column(name = "logged_at", nullable = false)
    private Instant timestamp;
}
