package com.example.ocppcentral.ocpp.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatusNotificationRequest {
    private Integer connectorId;
    private String errorCode;
    private String status;
    private String info;
    private String timestamp;
    private String vendorId;
    private String vendorErrorCode;
}
