package com.example.ocppcentral.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Connector status as reported by OCPP 1.6 StatusNotification.
 */
public enum ChargerStatus {
    AVAILABLE("Available"),
    PREPARING("Preparing"),
    CHARGING("Charging"),
    SUSPENDED_EVSE("SuspendedEVSE"),
    SUSPENDED_EV("SuspendedEV"),
    FINISHING("Finishing"),
    RESERVED("Reserved"),
    UNAVAILABLE("Unavailable"),
    FAULTED("Faulted");

    // statuses during which an ongoing transaction stays alive
    private static final Set<ChargerStatus> CHARGING_STATES =
            EnumSet.of(CHARGING, PREPARING, SUSPENDED_EVSE, SUSPENDED_EV, FINISHING);

    private final String ocppValue;

    ChargerStatus(String ocppValue) {
        this.ocppValue = ocppValue;
    }

    public String getOcppValue() {
        return ocppValue;
    }

    public boolean isChargingState() {
        return CHARGING_STATES.contains(this);
    }

    public static Optional<ChargerStatus> fromOcpp(String value) {
        return Arrays.stream(values())
                .filter(s -> s.ocppValue.equals(value))
                .findFirst();
    }
}
