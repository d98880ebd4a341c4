package com.example.ocppcentral.ocpp.handler;

import com.example.ocppcentral.ocpp.OcppAction;
import com.example.ocppcentral.ocpp.OcppRequestHandler;
import com.example.ocppcentral.ocpp.message.MeterValuesRequest;
import com.example.ocppcentral.service.MeterValueService;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;

@Slf4j
@Component
@RequiredArgsConstructor
public class MeterValuesHandler implements OcppRequestHandler<MeterValuesRequest> {

    private final MeterValueService meterValueService;

    @Override
    public OcppAction getAction() {
        return OcppAction.METER_VALUES;
    }

    @Override
    public Class<MeterValuesRequest> getRequestType() {
        return MeterValuesRequest.class;
    }

    @Override
    public Object handle(ChargePointSession session, MeterValuesRequest request) {
        try {
            meterValueService.recordMeterValues(session.getChargePointId(), request);
        } catch (RuntimeException e) {
            log.error("Error storing meter values from {} for transaction {}",
                    session.getChargePointId(), request.getTransactionId(), e);
        }
        return Collections.emptyMap();
    }
}
