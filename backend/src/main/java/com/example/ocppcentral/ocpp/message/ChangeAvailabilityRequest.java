package com.example.ocppcentral.ocpp.message;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangeAvailabilityRequest {
    private int connectorId;
    // Operative | Inoperative
    private String type;
}
