package com.example.ocppcentral.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ChargerNotConnectedException extends RuntimeException {

    public ChargerNotConnectedException(String message) {
        super(message);
    }
}
