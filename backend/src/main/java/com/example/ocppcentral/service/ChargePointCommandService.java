package com.example.ocppcentral.service;

import com.example.ocppcentral.exception.ChargerNotConnectedException;
import com.example.ocppcentral.exception.ChargerNotFoundException;
import com.example.ocppcentral.exception.InvalidStateException;
import com.example.ocppcentral.model.Charger;
import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.model.FirmwareUpdate;
import com.example.ocppcentral.ocpp.OcppAction;
import com.example.ocppcentral.ocpp.message.ChangeAvailabilityRequest;
import com.example.ocppcentral.ocpp.message.RemoteStartTransactionRequest;
import com.example.ocppcentral.ocpp.message.RemoteStopTransactionRequest;
import com.example.ocppcentral.ocpp.message.ResetRequest;
import com.example.ocppcentral.ocpp.message.UpdateFirmwareRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Typed server-initiated commands. Resolves the charger, checks it is
 * connected locally and hands the call to the session manager.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChargePointCommandService {

    private static final Set<String> AVAILABILITY_TYPES = Set.of("Operative", "Inoperative");
    private static final Set<String> RESET_TYPES = Set.of("Hard", "Soft");

    private final ChargerService chargerService;
    private final ChargingTransactionService chargingTransactionService;
    private final FirmwareUpdateService firmwareUpdateService;
    private final ConnectionStatusService connectionStatusService;
    private final ChargePointSessionManager sessionManager;
    private final Clock clock;

    @Value("${app.firmware.retries:3}")
    private int firmwareRetries;

    @Value("${app.firmware.retry-interval:300}")
    private int firmwareRetryInterval;

    public CompletableFuture<CommandResult> remoteStart(Long chargerId, Integer connectorId, String idTag) {
        Charger charger = requireConnected(chargerId);
        return sessionManager.sendCommand(charger.getChargePointId(), OcppAction.REMOTE_START_TRANSACTION.getValue(),
                new RemoteStartTransactionRequest(connectorId, idTag));
    }

    public CompletableFuture<CommandResult> remoteStop(Long chargerId) {
        Charger charger = requireConnected(chargerId);
        ChargingTransaction active = chargingTransactionService.findActiveForCharger(chargerId)
                .orElseThrow(() -> new InvalidStateException("No active charging session found"));
        return sessionManager.sendCommand(charger.getChargePointId(), OcppAction.REMOTE_STOP_TRANSACTION.getValue(),
                new RemoteStopTransactionRequest(active.getId()));
    }

    public CompletableFuture<CommandResult> changeAvailability(Long chargerId, int connectorId, String type) {
        if (!AVAILABILITY_TYPES.contains(type)) {
            throw new IllegalArgumentException("Availability type must be Operative or Inoperative, got " + type);
        }
        Charger charger = requireConnected(chargerId);
        return sessionManager.sendCommand(charger.getChargePointId(), OcppAction.CHANGE_AVAILABILITY.getValue(),
                new ChangeAvailabilityRequest(connectorId, type));
    }

    public CompletableFuture<CommandResult> reset(Long chargerId, String type) {
        if (!RESET_TYPES.contains(type)) {
            throw new IllegalArgumentException("Reset type must be Hard or Soft, got " + type);
        }
        Charger charger = requireConnected(chargerId);
        return sessionManager.sendCommand(charger.getChargePointId(), OcppAction.RESET.getValue(), new ResetRequest(type));
    }

    /**
     * Raw command to a charge point by its OCPP id, bypassing the typed payloads.
     *
     * @throws ChargerNotFoundException when no charger has that id
     */
    public CompletableFuture<CommandResult> sendRaw(String chargePointId, String action, Object payload) {
        if (!chargerService.isRegistered(chargePointId)) {
            throw new ChargerNotFoundException("Charger " + chargePointId + " not found");
        }
        return sessionManager.sendCommand(chargePointId, action, payload);
    }

    public CompletableFuture<FirmwareDispatch> updateFirmware(Long chargerId, Long firmwareFileId,
                                                              String location, String targetVersion) {
        Charger charger = chargerService.getById(chargerId);
        if (!connectionStatusService.isHeartbeatFresh(charger)) {
            throw new InvalidStateException("Charger " + charger.getChargePointId() + " is offline (last heartbeat "
                    + charger.getLastHeartbeatTime() + ")");
        }
        chargingTransactionService.findActiveForCharger(chargerId).ifPresent(tx -> {
            throw new InvalidStateException("Charger has an active charging session (transaction ID: " + tx.getId() + ")");
        });
        if (targetVersion != null && targetVersion.equals(charger.getFirmwareVersion())) {
            throw new InvalidStateException("Charger already has firmware version " + targetVersion);
        }

        FirmwareUpdate update = firmwareUpdateService.createPending(charger, firmwareFileId, location, targetVersion);
        UpdateFirmwareRequest request = UpdateFirmwareRequest.builder()
                .location(location)
                .retrieveDate(clock.instant().toString())
                .retries(firmwareRetries)
                .retryInterval(firmwareRetryInterval)
                .build();

        return sessionManager.sendCommand(charger.getChargePointId(), OcppAction.UPDATE_FIRMWARE.getValue(), request)
                .thenApply(result -> {
                    if (result.isSuccess()) {
                        return new FirmwareDispatch(update, result);
                    }
                    return new FirmwareDispatch(firmwareUpdateService.markCommandFailed(update.getId(), result.getMessage()), result);
                });
    }

    /**
     * Stops the transaction in the store. A RemoteStopTransaction is sent
     * when the charger is connected; its outcome is only logged.
     */
    public ChargingTransaction forceStopTransaction(Long transactionId, String reason) {
        ChargingTransaction stopped = chargingTransactionService.forceStop(transactionId, reason);
        Charger charger = chargerService.getById(stopped.getChargerId());
        if (sessionManager.isConnected(charger.getChargePointId())) {
            sessionManager.sendCommand(charger.getChargePointId(), OcppAction.REMOTE_STOP_TRANSACTION.getValue(),
                            new RemoteStopTransactionRequest(transactionId))
                    .thenAccept(result -> {
                        if (!result.isSuccess()) {
                            log.warn("RemoteStopTransaction for force-stopped transaction {} failed: {} {}",
                                    transactionId, result.getOutcome(), result.getMessage());
                        }
                    });
        }
        return stopped;
    }

    private Charger requireConnected(Long chargerId) {
        Charger charger = chargerService.getById(chargerId);
        if (!sessionManager.isConnected(charger.getChargePointId())) {
            throw new ChargerNotConnectedException("Charger " + charger.getChargePointId() + " is not connected");
        }
        return charger;
    }
}
