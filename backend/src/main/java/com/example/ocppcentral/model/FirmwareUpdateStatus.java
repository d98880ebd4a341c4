package com.example.ocppcentral.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public enum FirmwareUpdateStatus {
    PENDING(null),
    DOWNLOADING("Downloading"),
    DOWNLOADED("Downloaded"),
    INSTALLING("Installing"),
    INSTALLED("Installed"),
    DOWNLOAD_FAILED("DownloadFailed"),
    INSTALLATION_FAILED("InstallationFailed");

    public static final Set<FirmwareUpdateStatus> IN_PROGRESS =
            EnumSet.of(PENDING, DOWNLOADING, DOWNLOADED, INSTALLING);

    private static final Map<FirmwareUpdateStatus, Set<FirmwareUpdateStatus>> TRANSITIONS =
            new EnumMap<>(FirmwareUpdateStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(DOWNLOADING, DOWNLOADED, DOWNLOAD_FAILED));
        TRANSITIONS.put(DOWNLOADING, EnumSet.of(DOWNLOADED, INSTALLING, DOWNLOAD_FAILED));
        TRANSITIONS.put(DOWNLOADED, EnumSet.of(INSTALLING, INSTALLED, INSTALLATION_FAILED));
        TRANSITIONS.put(INSTALLING, EnumSet.of(INSTALLED, INSTALLATION_FAILED));
        TRANSITIONS.put(INSTALLED, EnumSet.noneOf(FirmwareUpdateStatus.class));
        TRANSITIONS.put(DOWNLOAD_FAILED, EnumSet.noneOf(FirmwareUpdateStatus.class));
        TRANSITIONS.put(INSTALLATION_FAILED, EnumSet.noneOf(FirmwareUpdateStatus.class));
    }

    private final String ocppValue;

    FirmwareUpdateStatus(String ocppValue) {
        this.ocppValue = ocppValue;
    }

    public boolean canTransitionTo(FirmwareUpdateStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /** Maps a FirmwareStatusNotification status. "Idle" and unknown values map to empty. */
    public static Optional<FirmwareUpdateStatus> fromOcpp(String value) {
        for (FirmwareUpdateStatus s : values()) {
            if (s.ocppValue != null && s.ocppValue.equals(value)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
