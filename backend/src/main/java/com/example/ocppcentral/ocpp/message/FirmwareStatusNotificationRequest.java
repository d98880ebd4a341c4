package com.example.ocppcentral.ocpp.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FirmwareStatusNotificationRequest {
    private String status;
}
