package com.example.ocppcentral.ocpp;

import com.example.ocppcentral.websocket.ChargePointSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes inbound Calls to their handler through a table built at startup.
 * Unknown actions are answered with an empty CallResult.
 */
@Slf4j
@Component
public class OcppDispatcher {

    private final OcppCodec codec;
    private final Map<OcppAction, OcppRequestHandler<?>> handlers = new EnumMap<>(OcppAction.class);

    public OcppDispatcher(OcppCodec codec, List<OcppRequestHandler<?>> handlerBeans) {
        this.codec = codec;
        for (OcppRequestHandler<?> handler : handlerBeans) {
            OcppRequestHandler<?> previous = handlers.putIfAbsent(handler.getAction(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.getAction() + ": "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        log.info("OCPP dispatch table: {}", handlers.keySet());
    }

    public OcppFrame dispatch(ChargePointSession session, Call call) {
        OcppRequestHandler<?> handler = OcppAction.fromValue(call.getAction())
                .map(handlers::get)
                .orElse(null);
        if (handler == null) {
            log.warn("[OCPP][{}] No handler for action {}, replying with empty result",
                    session.getChargePointId(), call.getAction());
            return new CallResult(call.getUniqueId(), codec.toTree(null));
        }
        return invoke(handler, session, call);
    }

    private <T> OcppFrame invoke(OcppRequestHandler<T> handler, ChargePointSession session, Call call) {
        T request;
        try {
            request = codec.fromTree(call.getPayload(), handler.getRequestType());
        } catch (JsonProcessingException e) {
            log.warn("[OCPP][{}] Invalid {} payload: {}", session.getChargePointId(), call.getAction(), e.getOriginalMessage());
            return formationViolation(call, e.getOriginalMessage());
        }
        if (request == null) {
            return formationViolation(call, "payload is null");
        }

        try {
            Object response = handler.handle(session, request);
            return new CallResult(call.getUniqueId(), codec.toTree(response));
        } catch (RuntimeException e) {
            log.error("[OCPP][{}] Handler for {} failed", session.getChargePointId(), call.getAction(), e);
            return new CallError(call.getUniqueId(), OcppErrorCode.INTERNAL_ERROR.getValue(),
                    "Failed to process " + call.getAction(), codec.toTree(null));
        }
    }

    private CallError formationViolation(Call call, String detail) {
        JsonNode details = codec.toTree(null);
        return new CallError(call.getUniqueId(), OcppErrorCode.FORMATION_VIOLATION.getValue(),
                "Invalid " + call.getAction() + " payload: " + detail, details);
    }
}
