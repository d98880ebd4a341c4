package com.example.ocppcentral.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "firmware_update")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FirmwareUpdate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "charger_id", nullable = false)
    private Long chargerId;

    @Column(name = "firmware_file_id")
    private Long firmwareFileId;

    @Column(name = "target_version")
    private String targetVersion;

    @Column(name = "download_url", nullable = false)
    private String downloadUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private FirmwareUpdateStatus status;

    @Column(name = "initiated_at")
    private Instant initiatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message")
    private String errorMessage;
}
