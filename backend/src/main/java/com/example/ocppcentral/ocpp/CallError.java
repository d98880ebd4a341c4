package com.example.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class CallError implements OcppFrame {

    String uniqueId;
    String errorCode;
    String errorDescription;
    JsonNode details;

    @Override
    public MessageType getMessageType() {
        return MessageType.CALL_ERROR;
    }
}
