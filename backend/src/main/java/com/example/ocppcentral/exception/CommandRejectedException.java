package com.example.ocppcentral.exception;

import lombok.Getter;

/**
 * The charge point answered a Call with a CALLERROR frame.
 */
@Getter
public class CommandRejectedException extends RuntimeException {

    private final String errorCode;
    private final String errorDescription;

    public CommandRejectedException(String errorCode, String errorDescription) {
        super(errorCode + (errorDescription == null || errorDescription.isEmpty() ? "" : ": " + errorDescription));
        this.errorCode = errorCode;
        this.errorDescription = errorDescription;
    }
}
