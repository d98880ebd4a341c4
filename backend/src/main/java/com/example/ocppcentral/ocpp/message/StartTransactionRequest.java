package com.example.ocppcentral.ocpp.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StartTransactionRequest {
    private Integer connectorId;
    private String idTag;
    // Wh
    private Integer meterStart;
    private String timestamp;
    private Integer reservationId;
}
