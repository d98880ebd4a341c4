package com.example.ocppcentral.ocpp.handler;

import com.example.ocppcentral.model.Charger;
import com.example.ocppcentral.model.ChargerStatus;
import com.example.ocppcentral.ocpp.OcppAction;
import com.example.ocppcentral.ocpp.OcppRequestHandler;
import com.example.ocppcentral.ocpp.message.StatusNotificationRequest;
import com.example.ocppcentral.service.BillingService;
import com.example.ocppcentral.service.ChargerService;
import com.example.ocppcentral.service.ChargingTransactionService;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Records connector status. Leaving the charging states fails the charger's
 * ongoing transactions and bills whatever energy they metered.
 * The reply is always empty so the charger is never blocked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatusNotificationHandler implements OcppRequestHandler<StatusNotificationRequest> {

    private final ChargerService chargerService;
    private final ChargingTransactionService chargingTransactionService;
    private final BillingService billingService;

    @Override
    public OcppAction getAction() {
        return OcppAction.STATUS_NOTIFICATION;
    }

    @Override
    public Class<StatusNotificationRequest> getRequestType() {
        return StatusNotificationRequest.class;
    }

    @Override
    public Object handle(ChargePointSession session, StatusNotificationRequest request) {
        String chargePointId = session.getChargePointId();
        log.info("StatusNotification from {}: connector={}, status={}, errorCode={}, info={}", chargePointId,
                request.getConnectorId(), request.getStatus(), request.getErrorCode(), request.getInfo());

        Optional<ChargerStatus> status = ChargerStatus.fromOcpp(request.getStatus());
        if (status.isEmpty()) {
            log.warn("Unknown connector status '{}' from {}", request.getStatus(), chargePointId);
            return Collections.emptyMap();
        }

        try {
            Optional<Charger> charger = chargerService.updateStatus(chargePointId, status.get());
            if (charger.isEmpty()) {
                log.warn("Failed to update status for {}: charger not in database", chargePointId);
                return Collections.emptyMap();
            }
            if (!status.get().isChargingState()) {
                List<Long> billable = chargingTransactionService.failOngoingTransactions(charger.get().getId(), status.get());
                billable.forEach(billingService::processTransactionBillingAsync);
            }
        } catch (RuntimeException e) {
            log.error("Error handling StatusNotification {} from {}", request.getStatus(), chargePointId, e);
        }
        return Collections.emptyMap();
    }
}
