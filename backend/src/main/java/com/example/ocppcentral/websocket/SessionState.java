package com.example.ocppcentral.websocket;

public enum SessionState {
    CONNECTING,
    ACTIVE,
    CLOSING,
    CLOSED
}
