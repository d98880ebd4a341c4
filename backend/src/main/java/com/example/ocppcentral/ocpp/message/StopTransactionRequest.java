package com.example.ocppcentral.ocpp.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StopTransactionRequest {
    private Long transactionId;
    private String idTag;
    // Wh
    private Integer meterStop;
    private String timestamp;
    private String reason;
    private JsonNode transactionData;
}
