package com.example.ocppcentral.ocpp;

import com.example.ocppcentral.websocket.ChargePointSession;

/**
 * Handles one charge-point-initiated action. The returned object is
 * serialized as the CallResult payload.
 *
 * @param <T> request payload type
 */
public interface OcppRequestHandler<T> {

    OcppAction getAction();

    Class<T> getRequestType();

    Object handle(ChargePointSession session, T request);
}
