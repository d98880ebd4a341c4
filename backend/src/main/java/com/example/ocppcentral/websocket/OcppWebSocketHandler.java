package com.example.ocppcentral.websocket;

import com.example.ocppcentral.service.ChargePointSessionManager;
import com.example.ocppcentral.service.ChargerService;
import com.example.ocppcentral.service.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.SubProtocolCapable;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Entry point for charge point connections on {@code /ocpp/{chargePointId}}.
 */
@Slf4j
@Component
public class OcppWebSocketHandler extends TextWebSocketHandler implements SubProtocolCapable {

    public static final String OCPP_SUBPROTOCOL = "ocpp1.6";
    static final String SESSION_ATTRIBUTE = "ocpp.chargePointSession";

    private final ChargerService chargerService;
    private final ChargePointSessionManager sessionManager;
    private final ConnectionRegistry connectionRegistry;
    private final ChargePointSessionFactory sessionFactory;
    private final TaskExecutor sessionExecutor;

    public OcppWebSocketHandler(ChargerService chargerService,
                                ChargePointSessionManager sessionManager,
                                ConnectionRegistry connectionRegistry,
                                ChargePointSessionFactory sessionFactory,
                                @Qualifier("ocppSessionExecutor") TaskExecutor sessionExecutor) {
        this.chargerService = chargerService;
        this.sessionManager = sessionManager;
        this.connectionRegistry = connectionRegistry;
        this.sessionFactory = sessionFactory;
        this.sessionExecutor = sessionExecutor;
    }

    @Override
    public List<String> getSubProtocols() {
        return List.of(OCPP_SUBPROTOCOL);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession webSocketSession) {
        String chargePointId = chargePointIdOf(webSocketSession.getUri());
        if (chargePointId == null) {
            reject(webSocketSession, "Missing charge point id in path");
            return;
        }
        if (!chargerService.isRegistered(chargePointId)) {
            log.warn("[OCPP] Rejecting unknown charger {}", chargePointId);
            reject(webSocketSession, "Charger " + chargePointId + " not registered in system");
            return;
        }

        ChargePointSession session = sessionFactory.create(chargePointId, new WebSocketSessionTransport(webSocketSession));
        if (!sessionManager.admit(chargePointId, session)) {
            log.warn("[OCPP] Rejecting duplicate connection for {}", chargePointId);
            reject(webSocketSession, "Charger " + chargePointId + " is already connected");
            return;
        }

        webSocketSession.getAttributes().put(SESSION_ATTRIBUTE, session);
        session.activate();
        if (!connectionRegistry.put(chargePointId, session.getConnectedAt())) {
            log.warn("[OCPP] {} admitted locally but not recorded in connection registry", chargePointId);
        }

        try {
            sessionExecutor.execute(session::receiveLoop);
        } catch (TaskRejectedException e) {
            log.error("[OCPP] No worker available for {}, closing connection", chargePointId, e);
            cleanup(webSocketSession, "no receive worker available");
            closeQuietly(webSocketSession, CloseStatus.SERVICE_OVERLOAD);
            return;
        }
        log.info("[OCPP] Charger {} connected (ws session {}, subprotocol {})",
                chargePointId, webSocketSession.getId(), webSocketSession.getAcceptedProtocol());
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage message) {
        ChargePointSession session = sessionOf(webSocketSession);
        if (session == null) {
            log.warn("[OCPP] Frame on unadmitted ws session {} ignored", webSocketSession.getId());
            return;
        }
        session.enqueue(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
        log.warn("[OCPP] Transport error on ws session {}: {}", webSocketSession.getId(), exception.getMessage());
        cleanup(webSocketSession, "transport error: " + exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
        cleanup(webSocketSession, "connection closed " + status);
    }

    private void cleanup(WebSocketSession webSocketSession, String reason) {
        Object attribute = webSocketSession.getAttributes().remove(SESSION_ATTRIBUTE);
        if (!(attribute instanceof ChargePointSession session)) {
            return;
        }
        String chargePointId = session.getChargePointId();
        try {
            session.close(reason);
        } catch (RuntimeException e) {
            log.error("[OCPP] Error closing session for {}", chargePointId, e);
        }
        // a newer session for the same id keeps its slot and registry entry
        if (sessionManager.remove(chargePointId, session)) {
            connectionRegistry.delete(chargePointId);
        }
        log.info("[OCPP] Charger {} disconnected: {}", chargePointId, reason);
    }

    private ChargePointSession sessionOf(WebSocketSession webSocketSession) {
        Object attribute = webSocketSession.getAttributes().get(SESSION_ATTRIBUTE);
        return attribute instanceof ChargePointSession session ? session : null;
    }

    private void reject(WebSocketSession webSocketSession, String reason) {
        closeQuietly(webSocketSession, CloseStatus.POLICY_VIOLATION.withReason(reason));
    }

    private void closeQuietly(WebSocketSession webSocketSession, CloseStatus status) {
        try {
            webSocketSession.close(status);
        } catch (IOException e) {
            log.warn("[OCPP] Failed to close ws session {}: {}", webSocketSession.getId(), e.getMessage());
        }
    }

    static String chargePointIdOf(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        String segment = slash >= 0 ? path.substring(slash + 1) : path;
        if (segment.isBlank()) {
            return null;
        }
        return UriUtils.decode(segment, StandardCharsets.UTF_8);
    }
}
