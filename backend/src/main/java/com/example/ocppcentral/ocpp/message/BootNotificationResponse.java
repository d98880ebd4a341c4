package com.example.ocppcentral.ocpp.message;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BootNotificationResponse {
    private String status;
    private String currentTime;
    private int interval;
}
