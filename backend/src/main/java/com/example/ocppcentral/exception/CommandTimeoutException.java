package com.example.ocppcentral.exception;

public class CommandTimeoutException extends RuntimeException {

    public CommandTimeoutException(String message) {
        super(message);
    }
}
