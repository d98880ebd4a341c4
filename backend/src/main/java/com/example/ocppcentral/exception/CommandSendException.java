package com.example.ocppcentral.exception;

public class CommandSendException extends RuntimeException {

    public CommandSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
