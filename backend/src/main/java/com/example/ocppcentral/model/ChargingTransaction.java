package com.example.ocppcentral.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A charging session on one connector. Energy fields stay null until the stop is processed.
 */
@Entity
@Table(name = "charging_transaction")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargingTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "charger_id", nullable = false)
    private Long chargerId;

    @Column(name = "vehicle_id")
    private Long vehicleId;

    @Column(name = "connector_id")
    private Integer connectorId;

    @Column(name = "id_tag")
    private String idTag;

    @Column(name = "start_meter_kwh")
    private Double startMeterKwh;

    @Column(name = "end_meter_kwh")
    private Double endMeterKwh;

    @Column(name = "energy_consumed_kwh")
    private Double energyConsumedKwh;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "stop_reason")
    private String stopReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private TransactionStatus status;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Moves to {@code next} if the transition table allows it.
     *
     * @throws IllegalStateException on an illegal move
     */
    public void transitionTo(TransactionStatus next, Instant at) {
        if (status != null && !status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Transaction " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.updatedAt = at;
    }
}
