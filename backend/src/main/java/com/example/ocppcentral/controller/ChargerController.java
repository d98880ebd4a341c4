package com.example.ocppcentral.controller;

import com.example.ocppcentral.dto.ChangeAvailabilityCommand;
import com.example.ocppcentral.dto.FirmwareUpdateCommand;
import com.example.ocppcentral.dto.RemoteStartRequest;
import com.example.ocppcentral.dto.ResetCommand;
import com.example.ocppcentral.model.FirmwareUpdate;
import com.example.ocppcentral.service.ChargePointCommandService;
import com.example.ocppcentral.service.ConnectionStatusService;
import com.example.ocppcentral.service.FirmwareUpdateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/chargers")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "Chargers", description = "Connection status and typed commands by charger id")
public class ChargerController {

    private final ConnectionStatusService connectionStatusService;
    private final ChargePointCommandService commandService;
    private final FirmwareUpdateService firmwareUpdateService;

    @GetMapping("/connection-status")
    @Operation(summary = "Bulk connection status, keyed by charge point id")
    public Map<String, Boolean> connectionStatus(@RequestParam List<Long> ids) {
        return connectionStatusService.bulkConnectionStatusByIds(ids);
    }

    @PostMapping("/{chargerId}/remote-start")
    @Operation(summary = "RemoteStartTransaction")
    public CompletableFuture<ResponseEntity<Object>> remoteStart(
            @PathVariable Long chargerId,
            @Valid @RequestBody RemoteStartRequest request) {
        return commandService.remoteStart(chargerId, request.getConnectorId(), request.getIdTag())
                .thenApply(CommandResponses::toResponse)
                .exceptionally(CommandResponses::failure);
    }

    @PostMapping("/{chargerId}/remote-stop")
    @Operation(summary = "RemoteStopTransaction for the charger's active transaction")
    public CompletableFuture<ResponseEntity<Object>> remoteStop(@PathVariable Long chargerId) {
        return commandService.remoteStop(chargerId)
                .thenApply(CommandResponses::toResponse)
                .exceptionally(CommandResponses::failure);
    }

    @PostMapping("/{chargerId}/change-availability")
    @Operation(summary = "ChangeAvailability (Operative or Inoperative)")
    public CompletableFuture<ResponseEntity<Object>> changeAvailability(
            @PathVariable Long chargerId,
            @Valid @RequestBody ChangeAvailabilityCommand request) {
        return commandService.changeAvailability(chargerId, request.getConnectorId(), request.getType())
                .thenApply(CommandResponses::toResponse)
                .exceptionally(CommandResponses::failure);
    }

    @PostMapping("/{chargerId}/reset")
    @Operation(summary = "Reset (Hard or Soft)")
    public CompletableFuture<ResponseEntity<Object>> reset(
            @PathVariable Long chargerId,
            @Valid @RequestBody ResetCommand request) {
        return commandService.reset(chargerId, request.getType())
                .thenApply(CommandResponses::toResponse)
                .exceptionally(CommandResponses::failure);
    }

    @PostMapping("/{chargerId}/firmware-update")
    @Operation(summary = "UpdateFirmware, after offline, active-session and version checks")
    public CompletableFuture<ResponseEntity<Object>> updateFirmware(
            @PathVariable Long chargerId,
            @Valid @RequestBody FirmwareUpdateCommand request) {
        return commandService.updateFirmware(chargerId, request.getFirmwareFileId(),
                        request.getLocation(), request.getVersion())
                .thenApply(dispatch -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("update", dispatch.getUpdate());
                    body.put("command", dispatch.getCommand());
                    return ResponseEntity.status(CommandResponses.statusOf(dispatch.getCommand())).body((Object) body);
                })
                .exceptionally(CommandResponses::failure);
    }

    @GetMapping("/{chargerId}/firmware-updates")
    @Operation(summary = "Firmware update history, newest first")
    public List<FirmwareUpdate> firmwareHistory(@PathVariable Long chargerId) {
        return firmwareUpdateService.history(chargerId);
    }
}
