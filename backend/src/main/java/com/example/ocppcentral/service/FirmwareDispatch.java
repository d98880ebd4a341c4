package com.example.ocppcentral.service;

import com.example.ocppcentral.model.FirmwareUpdate;
import lombok.Value;

/**
 * A firmware update record together with the outcome of its UpdateFirmware call.
 */
@Value
public class FirmwareDispatch {
    FirmwareUpdate update;
    CommandResult command;
}
