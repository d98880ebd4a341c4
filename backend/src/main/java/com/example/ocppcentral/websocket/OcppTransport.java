package com.example.ocppcentral.websocket;

import java.io.IOException;

/**
 * Outbound side of a charge point connection.
 */
public interface OcppTransport {

    String getId();

    boolean isOpen();

    void send(String text) throws IOException;

    void close(int code, String reason) throws IOException;
}
