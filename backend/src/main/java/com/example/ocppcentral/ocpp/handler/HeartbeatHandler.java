package com.example.ocppcentral.ocpp.handler;

import com.example.ocppcentral.ocpp.OcppAction;
import com.example.ocppcentral.ocpp.OcppRequestHandler;
import com.example.ocppcentral.ocpp.message.CurrentTimeResponse;
import com.example.ocppcentral.ocpp.message.HeartbeatRequest;
import com.example.ocppcentral.service.ChargerService;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class HeartbeatHandler implements OcppRequestHandler<HeartbeatRequest> {

    private final ChargerService chargerService;
    private final Clock clock;

    @Override
    public OcppAction getAction() {
        return OcppAction.HEARTBEAT;
    }

    @Override
    public Class<HeartbeatRequest> getRequestType() {
        return HeartbeatRequest.class;
    }

    @Override
    public Object handle(ChargePointSession session, HeartbeatRequest request) {
        session.markHeartbeat();
        if (chargerService.recordHeartbeat(session.getChargePointId()).isEmpty()) {
            log.warn("Heartbeat from {} which is not in the database", session.getChargePointId());
        } else {
            log.debug("Heartbeat from {}", session.getChargePointId());
        }
        return new CurrentTimeResponse(clock.instant().toString());
    }
}
