package com.example.ocppcentral.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ChargerNotFoundException extends RuntimeException {

    public ChargerNotFoundException(String message) {
        super(message);
    }
}
