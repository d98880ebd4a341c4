package com.example.ocppcentral.ocpp.handler;

import com.example.ocppcentral.ocpp.OcppAction;
import com.example.ocppcentral.ocpp.OcppRequestHandler;
import com.example.ocppcentral.ocpp.message.FirmwareStatusNotificationRequest;
import com.example.ocppcentral.service.FirmwareUpdateService;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;

@Slf4j
@Component
@RequiredArgsConstructor
public class FirmwareStatusNotificationHandler implements OcppRequestHandler<FirmwareStatusNotificationRequest> {

    private final FirmwareUpdateService firmwareUpdateService;

    @Override
    public OcppAction getAction() {
        return OcppAction.FIRMWARE_STATUS_NOTIFICATION;
    }

    @Override
    public Class<FirmwareStatusNotificationRequest> getRequestType() {
        return FirmwareStatusNotificationRequest.class;
    }

    @Override
    public Object handle(ChargePointSession session, FirmwareStatusNotificationRequest request) {
        log.info("FirmwareStatusNotification from {}: {}", session.getChargePointId(), request.getStatus());
        firmwareUpdateService.applyStatusNotification(session.getChargePointId(), request.getStatus());
        return Collections.emptyMap();
    }
}
