package com.example.ocppcentral.ocpp;

public interface OcppFrame {

    String getUniqueId();

    MessageType getMessageType();
}
