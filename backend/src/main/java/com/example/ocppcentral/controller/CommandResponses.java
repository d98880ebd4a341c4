package com.example.ocppcentral.controller;

import com.example.ocppcentral.service.CommandResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

final class CommandResponses {

    private CommandResponses() {
    }

    static HttpStatus statusOf(CommandResult result) {
        switch (result.getOutcome()) {
            case SUCCESS:
                return HttpStatus.OK;
            case NOT_CONNECTED:
                return HttpStatus.CONFLICT;
            case TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }

    static ResponseEntity<Object> toResponse(CommandResult result) {
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    static ResponseEntity<Object> failure(Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", String.valueOf(cause.getMessage())));
    }
}
