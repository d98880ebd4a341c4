package com.example.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class CallResult implements OcppFrame {

    String uniqueId;
    JsonNode payload;

    @Override
    public MessageType getMessageType() {
        return MessageType.CALL_RESULT;
    }
}
