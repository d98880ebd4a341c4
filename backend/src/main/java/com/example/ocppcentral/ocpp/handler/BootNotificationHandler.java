package com.example.ocppcentral.ocpp.handler;

import com.example.ocppcentral.ocpp.OcppAction;
import com.example.ocppcentral.ocpp.OcppRequestHandler;
import com.example.ocppcentral.ocpp.message.BootNotificationRequest;
import com.example.ocppcentral.ocpp.message.BootNotificationResponse;
import com.example.ocppcentral.service.ChargerService;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class BootNotificationHandler implements OcppRequestHandler<BootNotificationRequest> {

    private final ChargerService chargerService;
    private final Clock clock;

    @Value("${app.ocpp.heartbeat-interval:300}")
    private int heartbeatInterval;

    @Override
    public OcppAction getAction() {
        return OcppAction.BOOT_NOTIFICATION;
    }

    @Override
    public Class<BootNotificationRequest> getRequestType() {
        return BootNotificationRequest.class;
    }

    @Override
    public Object handle(ChargePointSession session, BootNotificationRequest request) {
        String chargePointId = session.getChargePointId();
        log.info("BootNotification from {}: vendor={}, model={}, firmware={}", chargePointId,
                request.getChargePointVendor(), request.getChargePointModel(), request.getFirmwareVersion());

        session.markHeartbeat();
        if (chargerService.recordBoot(chargePointId, request.getChargePointVendor(),
                request.getChargePointModel(), request.getFirmwareVersion()).isEmpty()) {
            log.warn("BootNotification from {} which is not in the database", chargePointId);
        }
        return new BootNotificationResponse("Accepted", clock.instant().toString(), heartbeatInterval);
    }
}
