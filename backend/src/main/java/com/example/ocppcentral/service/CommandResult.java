package com.example.ocppcentral.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a server-initiated OCPP command. Never carries an exception.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommandResult {

    public enum Outcome {
        SUCCESS,
        NOT_CONNECTED,
        TIMEOUT,
        REJECTED,
        SEND_FAILED
    }

    Outcome outcome;
    JsonNode response;
    String errorCode;
    String message;

    public static CommandResult success(JsonNode response) {
        return new CommandResult(Outcome.SUCCESS, response, null, null);
    }

    public static CommandResult notConnected(String chargePointId) {
        return new CommandResult(Outcome.NOT_CONNECTED, null, null, "Charger " + chargePointId + " is not connected");
    }

    public static CommandResult timeout(String message) {
        return new CommandResult(Outcome.TIMEOUT, null, null, message);
    }

    public static CommandResult rejected(String errorCode, String message) {
        return new CommandResult(Outcome.REJECTED, null, errorCode, message);
    }

    public static CommandResult sendFailed(String message) {
        return new CommandResult(Outcome.SEND_FAILED, null, null, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
