package com.example.ocppcentral.ocpp;

/**
 * Inbound text that is not a valid OCPP-J frame. Carries the unique id when
 * one could still be read, so the caller can answer with a CALLERROR.
 */
public class MalformedFrameException extends Exception {

    private final String uniqueId;

    public MalformedFrameException(String message, String uniqueId) {
        super(message);
        this.uniqueId = uniqueId;
    }

    public MalformedFrameException(String message, String uniqueId, Throwable cause) {
        super(message, cause);
        this.uniqueId = uniqueId;
    }

    public String getUniqueId() {
        return uniqueId;
    }

    public boolean hasUniqueId() {
        return uniqueId != null;
    }
}
