package com.example.ocppcentral.ocpp.message;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartTransactionResponse {
    private long transactionId;
    private IdTagInfo idTagInfo;

    public static StartTransactionResponse rejected(AuthorizationStatus status) {
        return new StartTransactionResponse(0, new IdTagInfo(status));
    }
}
