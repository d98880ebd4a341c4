package com.example.ocppcentral.websocket;

import com.example.ocppcentral.exception.CommandRejectedException;
import com.example.ocppcentral.exception.CommandSendException;
import com.example.ocppcentral.exception.CommandTimeoutException;
import com.example.ocppcentral.exception.SessionClosedException;
import com.example.ocppcentral.model.MessageDirection;
import com.example.ocppcentral.ocpp.Call;
import com.example.ocppcentral.ocpp.CallError;
import com.example.ocppcentral.ocpp.CallResult;
import com.example.ocppcentral.ocpp.MalformedFrameException;
import com.example.ocppcentral.ocpp.OcppCodec;
import com.example.ocppcentral.ocpp.OcppDispatcher;
import com.example.ocppcentral.ocpp.OcppErrorCode;
import com.example.ocppcentral.ocpp.OcppFrame;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live OCPP connection. Inbound frames are queued by the transport thread
 * and handled one at a time by {@link #receiveLoop()}; server-initiated calls
 * are correlated by unique id and completed from that loop.
 */
@Slf4j
public class ChargePointSession {

    private static final long POLL_INTERVAL_MS = 500;

    private final String chargePointId;
    private final OcppTransport transport;
    private final OcppCodec codec;
    private final OcppDispatcher dispatcher;
    private final MessageAuditSink auditSink;
    private final ScheduledExecutorService timeoutScheduler;
    private final Duration callTimeout;
    private final Clock clock;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
    private final Map<String, CompletableFuture<JsonNode>> pendingCalls = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final Instant connectedAt;
    private volatile Instant lastSeen;
    private volatile Instant lastHeartbeat;

    public ChargePointSession(String chargePointId,
                              OcppTransport transport,
                              OcppCodec codec,
                              OcppDispatcher dispatcher,
                              MessageAuditSink auditSink,
                              ScheduledExecutorService timeoutScheduler,
                              Duration callTimeout,
                              Clock clock) {
        this.chargePointId = chargePointId;
        this.transport = transport;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.auditSink = auditSink;
        this.timeoutScheduler = timeoutScheduler;
        this.callTimeout = callTimeout;
        this.clock = clock;
        this.connectedAt = clock.instant();
        this.lastSeen = connectedAt;
    }

    public boolean activate() {
        return state.compareAndSet(SessionState.CONNECTING, SessionState.ACTIVE);
    }

    /**
     * Called from the transport thread. Frames arriving after close are dropped.
     */
    public void enqueue(String rawFrame) {
        SessionState current = state.get();
        if (current == SessionState.CLOSING || current == SessionState.CLOSED) {
            log.debug("[OCPP][{}] Dropping frame on {} session", chargePointId, current);
            return;
        }
        inbox.offer(rawFrame);
    }

    /**
     * Drains the inbox until the session closes. Runs on its own worker so
     * frames of one session are handled strictly in arrival order. Frames
     * queued before the close are still handled once the loop ends.
     */
    public void receiveLoop() {
        log.info("[OCPP][{}] Receive loop started", chargePointId);
        try {
            while (isActive()) {
                String raw = inbox.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (raw == null) {
                    if (!transport.isOpen()) {
                        log.info("[OCPP][{}] Transport no longer open, leaving receive loop", chargePointId);
                        break;
                    }
                    continue;
                }
                try {
                    processFrame(raw);
                } catch (RuntimeException e) {
                    log.error("[OCPP][{}] Error while handling frame {}", chargePointId, raw, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[OCPP][{}] Receive loop interrupted", chargePointId);
        }
        drainRemaining();
        log.info("[OCPP][{}] Receive loop stopped (state={})", chargePointId, state.get());
    }

    private void drainRemaining() {
        String raw;
        while ((raw = inbox.poll()) != null) {
            try {
                processFrame(raw);
            } catch (RuntimeException e) {
                log.error("[OCPP][{}] Error while handling queued frame {}", chargePointId, raw, e);
            }
        }
    }

    void processFrame(String raw) {
        lastSeen = clock.instant();
        log.info("[OCPP][IN][{}] {}", chargePointId, raw);
        audit(MessageDirection.IN, raw);

        OcppFrame frame;
        try {
            frame = codec.decode(raw);
        } catch (MalformedFrameException e) {
            log.warn("[OCPP][{}] Malformed frame: {}", chargePointId, e.getMessage());
            if (e.hasUniqueId()) {
                reply(new CallError(e.getUniqueId(), OcppErrorCode.PROTOCOL_ERROR.getValue(),
                        e.getMessage(), codec.toTree(null)));
            }
            return;
        }

        if (frame instanceof Call call) {
            reply(dispatcher.dispatch(this, call));
        } else if (frame instanceof CallResult result) {
            CompletableFuture<JsonNode> waiter = pendingCalls.remove(result.getUniqueId());
            if (waiter == null) {
                log.warn("[OCPP][{}] Discarding CallResult {} with no pending call", chargePointId, result.getUniqueId());
                return;
            }
            waiter.complete(result.getPayload());
        } else if (frame instanceof CallError error) {
            CompletableFuture<JsonNode> waiter = pendingCalls.remove(error.getUniqueId());
            if (waiter == null) {
                log.warn("[OCPP][{}] Discarding CallError {} with no pending call", chargePointId, error.getUniqueId());
                return;
            }
            waiter.completeExceptionally(new CommandRejectedException(error.getErrorCode(), error.getErrorDescription()));
        }
    }

    /**
     * Sends a server-initiated Call. The future fails with
     * {@link CommandTimeoutException}, {@link CommandRejectedException},
     * {@link CommandSendException} or {@link SessionClosedException}.
     */
    public CompletableFuture<JsonNode> call(String action, Object payload) {
        if (!isActive()) {
            return CompletableFuture.failedFuture(
                    new SessionClosedException("Session for " + chargePointId + " is " + state.get()));
        }

        String uniqueId = String.valueOf(sequence.incrementAndGet());
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pendingCalls.put(uniqueId, future);
        if (!isActive()) {
            // closed between the state check and registration
            pendingCalls.remove(uniqueId);
            future.completeExceptionally(
                    new SessionClosedException("Session for " + chargePointId + " is " + state.get()));
            return future;
        }

        try {
            send(codec.encode(new Call(uniqueId, action, codec.toTree(payload))));
        } catch (IOException | RuntimeException e) {
            pendingCalls.remove(uniqueId);
            future.completeExceptionally(new CommandSendException("Failed to send " + action + " to " + chargePointId, e));
            return future;
        }

        timeoutScheduler.schedule(() -> {
            if (pendingCalls.remove(uniqueId) != null) {
                log.warn("[OCPP][{}] {} ({}) timed out after {}", chargePointId, action, uniqueId, callTimeout);
                future.completeExceptionally(new CommandTimeoutException(
                        action + " to " + chargePointId + " timed out after " + callTimeout.toMillis() + " ms"));
            }
        }, callTimeout.toMillis(), TimeUnit.MILLISECONDS);

        return future;
    }

    /**
     * Moves to CLOSED and fails every pending call. Frames already queued are
     * left for the receive loop. Idempotent.
     */
    public void close(String reason) {
        SessionState previous = state.getAndUpdate(s ->
                s == SessionState.CLOSING || s == SessionState.CLOSED ? s : SessionState.CLOSING);
        if (previous == SessionState.CLOSING || previous == SessionState.CLOSED) {
            return;
        }
        SessionClosedException cause = new SessionClosedException("Session for " + chargePointId + " closed: " + reason);
        for (String uniqueId : new ArrayList<>(pendingCalls.keySet())) {
            CompletableFuture<JsonNode> waiter = pendingCalls.remove(uniqueId);
            if (waiter != null) {
                waiter.completeExceptionally(cause);
            }
        }
        state.set(SessionState.CLOSED);
        log.info("[OCPP][{}] Session closed: {}", chargePointId, reason);
    }

    /**
     * Closes the session and the underlying socket.
     */
    public void disconnect(int closeCode, String reason) {
        close(reason);
        try {
            transport.close(closeCode, reason);
        } catch (IOException e) {
            log.warn("[OCPP][{}] Error closing transport: {}", chargePointId, e.getMessage());
        }
    }

    public void markHeartbeat() {
        lastHeartbeat = clock.instant();
    }

    /**
     * Most recent sign of life: heartbeat, any inbound frame, or the connection itself.
     */
    public Instant getLastActivity() {
        Instant latest = connectedAt;
        Instant seen = lastSeen;
        Instant heartbeat = lastHeartbeat;
        if (seen != null && seen.isAfter(latest)) {
            latest = seen;
        }
        if (heartbeat != null && heartbeat.isAfter(latest)) {
            latest = heartbeat;
        }
        return latest;
    }

    public boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    public SessionState getState() {
        return state.get();
    }

    public String getChargePointId() {
        return chargePointId;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    int pendingCallCount() {
        return pendingCalls.size();
    }

    private void reply(OcppFrame frame) {
        try {
            send(codec.encode(frame));
        } catch (IOException e) {
            log.error("[OCPP][{}] Failed to send reply {}", chargePointId, frame.getUniqueId(), e);
        }
    }

    private void send(String raw) throws IOException {
        transport.send(raw);
        log.info("[OCPP][OUT][{}] {}", chargePointId, raw);
        audit(MessageDirection.OUT, raw);
    }

    private void audit(MessageDirection direction, String raw) {
        try {
            auditSink.record(chargePointId, direction, raw);
        } catch (RuntimeException e) {
            log.warn("[OCPP][{}] Failed to record {} frame in message log: {}", chargePointId, direction, e.getMessage());
        }
    }
}
