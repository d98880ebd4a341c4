package com.example.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class Call implements OcppFrame {

    String uniqueId;
    String action;
    JsonNode payload;

    @Override
    public MessageType getMessageType() {
        return MessageType.CALL;
    }
}
