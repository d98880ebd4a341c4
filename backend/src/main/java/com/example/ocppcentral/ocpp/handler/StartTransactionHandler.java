package com.example.ocppcentral.ocpp.handler;

import com.example.ocppcentral.model.AppUser;
import com.example.ocppcentral.model.Charger;
import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.model.Vehicle;
import com.example.ocppcentral.ocpp.OcppAction;
import com.example.ocppcentral.ocpp.OcppRequestHandler;
import com.example.ocppcentral.ocpp.message.AuthorizationStatus;
import com.example.ocppcentral.ocpp.message.IdTagInfo;
import com.example.ocppcentral.ocpp.message.StartTransactionRequest;
import com.example.ocppcentral.ocpp.message.StartTransactionResponse;
import com.example.ocppcentral.service.AppUserService;
import com.example.ocppcentral.service.ChargerService;
import com.example.ocppcentral.service.ChargingTransactionService;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartTransactionHandler implements OcppRequestHandler<StartTransactionRequest> {

    private final ChargerService chargerService;
    private final AppUserService appUserService;
    private final ChargingTransactionService chargingTransactionService;

    @Override
    public OcppAction getAction() {
        return OcppAction.START_TRANSACTION;
    }

    @Override
    public Class<StartTransactionRequest> getRequestType() {
        return StartTransactionRequest.class;
    }

    @Override
    public Object handle(ChargePointSession session, StartTransactionRequest request) {
        String chargePointId = session.getChargePointId();
        log.info("StartTransaction from {}: connector={}, idTag={}, meterStart={}", chargePointId,
                request.getConnectorId(), request.getIdTag(), request.getMeterStart());

        try {
            Optional<Charger> charger = chargerService.findByChargePointId(chargePointId);
            if (charger.isEmpty()) {
                log.error("StartTransaction from {} which is not in the database", chargePointId);
                return StartTransactionResponse.rejected(AuthorizationStatus.INVALID);
            }

            Optional<AppUser> user = appUserService.findByIdTag(request.getIdTag());
            if (user.isEmpty()) {
                log.error("StartTransaction from {}: no user with RFID '{}'", chargePointId, request.getIdTag());
                return StartTransactionResponse.rejected(AuthorizationStatus.INVALID);
            }
            if (!user.get().isActive()) {
                log.error("StartTransaction from {}: user {} is deactivated", chargePointId, user.get().getId());
                return StartTransactionResponse.rejected(AuthorizationStatus.BLOCKED);
            }

            Long chargerId = charger.get().getId();
            if (chargingTransactionService.hasActiveTransaction(chargerId)) {
                log.warn("StartTransaction from {} while another transaction is active", chargePointId);
                return StartTransactionResponse.rejected(AuthorizationStatus.CONCURRENT_TX);
            }

            Vehicle vehicle = appUserService.getOrCreateVehicle(user.get());
            int meterStart = request.getMeterStart() == null ? 0 : request.getMeterStart();
            ChargingTransaction transaction = chargingTransactionService.startTransaction(chargerId, user.get().getId(),
                    vehicle.getId(), request.getConnectorId(), request.getIdTag(), meterStart,
                    parseTimestamp(request.getTimestamp()));

            return new StartTransactionResponse(transaction.getId(), new IdTagInfo(AuthorizationStatus.ACCEPTED));
        } catch (RuntimeException e) {
            log.error("Error creating transaction for {}", chargePointId, e);
            return StartTransactionResponse.rejected(AuthorizationStatus.INVALID);
        }
    }

    private static Instant parseTimestamp(String timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable StartTransaction timestamp '{}'", timestamp);
            return null;
        }
    }
}
