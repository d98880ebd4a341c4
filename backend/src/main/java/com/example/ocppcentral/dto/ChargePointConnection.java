package com.example.ocppcentral.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A registry entry, enriched with local session data when this instance holds it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChargePointConnection {
    private String chargePointId;
    private Instant connectedAt;
    private Instant lastSeen;
    private boolean local;
}
