package com.example.ocppcentral.ocpp;

import java.util.Optional;

public enum OcppAction {
    // charge point -> central system
    BOOT_NOTIFICATION("BootNotification"),
    HEARTBEAT("Heartbeat"),
    STATUS_NOTIFICATION("StatusNotification"),
    START_TRANSACTION("StartTransaction"),
    STOP_TRANSACTION("StopTransaction"),
    METER_VALUES("MeterValues"),
    FIRMWARE_STATUS_NOTIFICATION("FirmwareStatusNotification"),

    // central system -> charge point
    REMOTE_START_TRANSACTION("RemoteStartTransaction"),
    REMOTE_STOP_TRANSACTION("RemoteStopTransaction"),
    CHANGE_AVAILABILITY("ChangeAvailability"),
    RESET("Reset"),
    UPDATE_FIRMWARE("UpdateFirmware");

    private final String value;

    OcppAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<OcppAction> fromValue(String value) {
        for (OcppAction action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
