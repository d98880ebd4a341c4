package com.example.ocppcentral.websocket;

import com.example.ocppcentral.service.ChargePointSessionManager;
import com.example.ocppcentral.service.ChargerService;
import com.example.ocppcentral.service.ConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OcppWebSocketHandlerTest {

    @Mock
    private ChargerService chargerService;

    @Mock
    private ChargePointSessionManager sessionManager;

    @Mock
    private ConnectionRegistry connectionRegistry;

    @Mock
    private ChargePointSessionFactory sessionFactory;

    @Mock
    private TaskExecutor sessionExecutor;

    @Mock
    private WebSocketSession webSocketSession;

    @Mock
    private ChargePointSession session;

    private final Map<String, Object> attributes = new HashMap<>();
    private OcppWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new OcppWebSocketHandler(chargerService, sessionManager, connectionRegistry,
                sessionFactory, sessionExecutor);
    }

    @Test
    void testAfterConnectionEstablished_UnregisteredChargerIsRejected() throws Exception {
        // Arrange
        when(webSocketSession.getUri()).thenReturn(URI.create("ws://localhost/ocpp/CP-9"));
        when(chargerService.isRegistered("CP-9")).thenReturn(false);

        // Act
        handler.afterConnectionEstablished(webSocketSession);

        // Assert
        verify(webSocketSession).close(CloseStatus.POLICY_VIOLATION.withReason("Charger CP-9 not registered in system"));
        verify(sessionManager, never()).admit(anyString(), any());
        verify(connectionRegistry, never()).put(anyString(), any());
    }

    @Test
    void testAfterConnectionEstablished_DuplicateConnectionIsRejected() throws Exception {
        // Arrange
        givenRegisteredCharger("CP-1");
        when(sessionManager.admit("CP-1", session)).thenReturn(false);

        // Act
        handler.afterConnectionEstablished(webSocketSession);

        // Assert
        verify(webSocketSession).close(CloseStatus.POLICY_VIOLATION.withReason("Charger CP-1 is already connected"));
        verify(sessionExecutor, never()).execute(any());
        assertThat(attributes).isEmpty();
    }

    @Test
    void testAfterConnectionEstablished_AdmitsAndStartsReceiveLoop() throws Exception {
        // Arrange
        givenRegisteredCharger("CP-1");
        Instant connectedAt = Instant.parse("2024-05-01T10:00:00Z");
        when(sessionManager.admit("CP-1", session)).thenReturn(true);
        when(session.getConnectedAt()).thenReturn(connectedAt);
        when(connectionRegistry.put("CP-1", connectedAt)).thenReturn(true);

        // Act
        handler.afterConnectionEstablished(webSocketSession);

        // Assert
        verify(session).activate();
        verify(connectionRegistry).put("CP-1", connectedAt);
        verify(sessionExecutor).execute(any(Runnable.class));
        verify(webSocketSession, never()).close(any(CloseStatus.class));
        assertThat(attributes).containsEntry(OcppWebSocketHandler.SESSION_ATTRIBUTE, session);
    }

    @Test
    void testAfterConnectionEstablished_NoWorkerAvailableClosesWithOverload() throws Exception {
        // Arrange
        givenRegisteredCharger("CP-1");
        when(sessionManager.admit("CP-1", session)).thenReturn(true);
        when(session.getConnectedAt()).thenReturn(Instant.now());
        when(session.getChargePointId()).thenReturn("CP-1");
        when(sessionManager.remove("CP-1", session)).thenReturn(true);
        doThrow(new TaskRejectedException("pool exhausted")).when(sessionExecutor).execute(any(Runnable.class));

        // Act
        handler.afterConnectionEstablished(webSocketSession);

        // Assert
        verify(session).close(anyString());
        verify(connectionRegistry).delete("CP-1");
        verify(webSocketSession).close(CloseStatus.SERVICE_OVERLOAD);
    }

    @Test
    void testHandleTextMessage_EnqueuesOnAdmittedSession() throws Exception {
        attributes.put(OcppWebSocketHandler.SESSION_ATTRIBUTE, session);
        when(webSocketSession.getAttributes()).thenReturn(attributes);

        handler.handleTextMessage(webSocketSession, new TextMessage("[2,\"1\",\"Heartbeat\",{}]"));

        verify(session).enqueue("[2,\"1\",\"Heartbeat\",{}]");
    }

    @Test
    void testAfterConnectionClosed_RemovesSessionAndRegistryEntry() {
        attributes.put(OcppWebSocketHandler.SESSION_ATTRIBUTE, session);
        when(webSocketSession.getAttributes()).thenReturn(attributes);
        when(session.getChargePointId()).thenReturn("CP-1");
        when(sessionManager.remove("CP-1", session)).thenReturn(true);

        handler.afterConnectionClosed(webSocketSession, CloseStatus.NORMAL);

        verify(session).close(anyString());
        verify(connectionRegistry).delete("CP-1");
        assertThat(attributes).isEmpty();
    }

    @Test
    void testAfterConnectionClosed_SupersededSessionKeepsRegistryEntry() {
        attributes.put(OcppWebSocketHandler.SESSION_ATTRIBUTE, session);
        when(webSocketSession.getAttributes()).thenReturn(attributes);
        when(session.getChargePointId()).thenReturn("CP-1");
        when(sessionManager.remove("CP-1", session)).thenReturn(false);

        handler.afterConnectionClosed(webSocketSession, CloseStatus.NORMAL);

        verify(connectionRegistry, never()).delete(anyString());
    }

    @Test
    void testHandleTransportError_ClosesSession() {
        attributes.put(OcppWebSocketHandler.SESSION_ATTRIBUTE, session);
        when(webSocketSession.getAttributes()).thenReturn(attributes);
        when(session.getChargePointId()).thenReturn("CP-1");
        when(sessionManager.remove("CP-1", session)).thenReturn(true);

        handler.handleTransportError(webSocketSession, new java.io.EOFException("reset by peer"));

        verify(session).close(anyString());
        verify(connectionRegistry).delete("CP-1");
    }

    @Test
    void testChargePointIdOf() {
        assertThat(OcppWebSocketHandler.chargePointIdOf(URI.create("ws://host/ocpp/CP-1"))).isEqualTo("CP-1");
        assertThat(OcppWebSocketHandler.chargePointIdOf(URI.create("ws://host/ocpp/CP-1/"))).isEqualTo("CP-1");
        assertThat(OcppWebSocketHandler.chargePointIdOf(URI.create("ws://host/ocpp/CP%2001"))).isEqualTo("CP 01");
        assertThat(OcppWebSocketHandler.chargePointIdOf(null)).isNull();
    }

    @Test
    void testGetSubProtocols() {
        assertThat(handler.getSubProtocols()).containsExactly("ocpp1.6");
    }

    private void givenRegisteredCharger(String chargePointId) {
        when(webSocketSession.getUri()).thenReturn(URI.create("ws://localhost/ocpp/" + chargePointId));
        lenient().when(webSocketSession.getAttributes()).thenReturn(attributes);
        when(chargerService.isRegistered(chargePointId)).thenReturn(true);
        when(sessionFactory.create(eq(chargePointId), any(OcppTransport.class))).thenReturn(session);
    }
}
