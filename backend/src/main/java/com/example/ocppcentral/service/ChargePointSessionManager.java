package com.example.ocppcentral.service;

import com.example.ocppcentral.exception.CommandRejectedException;
import com.example.ocppcentral.exception.CommandTimeoutException;
import com.example.ocppcentral.exception.SessionClosedException;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the sessions of this instance. Admission is a single putIfAbsent, so
 * two racing connections for the same charge point cannot both win.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChargePointSessionManager {

    private final ConnectionRegistry connectionRegistry;
    private final Map<String, ChargePointSession> sessions = new ConcurrentHashMap<>();

    public boolean admit(String chargePointId, ChargePointSession session) {
        ChargePointSession existing = sessions.putIfAbsent(chargePointId, session);
        if (existing != null) {
            log.warn("Charger {} already has a session (state={})", chargePointId, existing.getState());
            return false;
        }
        log.info("Admitted session for {} ({} connected)", chargePointId, sessions.size());
        return true;
    }

    /**
     * Removes {@code session} only if it is still the one registered for the id.
     */
    public boolean remove(String chargePointId, ChargePointSession session) {
        boolean removed = sessions.remove(chargePointId, session);
        if (removed) {
            log.info("Removed session for {} ({} connected)", chargePointId, sessions.size());
        }
        return removed;
    }

    public void remove(String chargePointId) {
        if (sessions.remove(chargePointId) != null) {
            log.info("Removed session for {} ({} connected)", chargePointId, sessions.size());
        }
    }

    public Optional<ChargePointSession> get(String chargePointId) {
        return Optional.ofNullable(sessions.get(chargePointId));
    }

    public boolean isConnected(String chargePointId) {
        ChargePointSession session = sessions.get(chargePointId);
        return session != null && session.isActive();
    }

    public Set<String> connectedChargePointIds() {
        return Collections.unmodifiableSet(sessions.keySet());
    }

    public Collection<ChargePointSession> sessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public CompletableFuture<CommandResult> sendCommand(String chargePointId, String action, Object payload) {
        ChargePointSession session = sessions.get(chargePointId);
        if (session == null || !session.isActive()) {
            log.warn("Cannot send {} to {}: not connected", action, chargePointId);
            return CompletableFuture.completedFuture(CommandResult.notConnected(chargePointId));
        }

        return session.call(action, payload).handle((response, ex) -> {
            if (ex == null) {
                log.info("{} accepted by {}: {}", action, chargePointId, response);
                return CommandResult.success(response);
            }
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof CommandTimeoutException) {
                return CommandResult.timeout(cause.getMessage());
            }
            if (cause instanceof CommandRejectedException rejected) {
                log.warn("{} rejected by {}: {}", action, chargePointId, rejected.getMessage());
                return CommandResult.rejected(rejected.getErrorCode(), rejected.getMessage());
            }
            if (cause instanceof SessionClosedException) {
                return CommandResult.notConnected(chargePointId);
            }
            log.error("Failed to send {} to {}", action, chargePointId, cause);
            return CommandResult.sendFailed(cause.getMessage());
        });
    }

    /**
     * Closes the socket of {@code session} and drops it with its registry record.
     * When a newer session has already taken its place, the newer one and the
     * registry record are left alone. Never throws.
     */
    public void forceDisconnect(String chargePointId, ChargePointSession session, String reason) {
        boolean current = sessions.remove(chargePointId, session);
        log.info("[DISCONNECT] Forcing disconnect of {}{}: {}", chargePointId, current ? "" : " (superseded session)", reason);
        try {
            session.disconnect(CloseStatus.GOING_AWAY.getCode(), reason);
        } catch (RuntimeException e) {
            log.error("[DISCONNECT] Error closing session for {}", chargePointId, e);
        }
        if (current) {
            connectionRegistry.delete(chargePointId);
        }
    }
}
