package com.example.ocppcentral.websocket;

import com.example.ocppcentral.model.MessageDirection;

/**
 * Receives every raw frame crossing a charge point connection.
 */
public interface MessageAuditSink {

    void record(String chargePointId, MessageDirection direction, String rawFrame);
}
