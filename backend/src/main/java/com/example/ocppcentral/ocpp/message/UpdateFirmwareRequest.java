package com.example.ocppcentral.ocpp.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateFirmwareRequest {
    private String location;
    private String retrieveDate;
    private Integer retries;
    private Integer retryInterval;
}
