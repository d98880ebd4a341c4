package com.example.ocppcentral.scheduler;

import com.example.ocppcentral.service.ChargePointSessionManager;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Disconnects local sessions that have gone silent for longer than the
 * staleness threshold.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleSessionScheduler {

    private final ChargePointSessionManager sessionManager;
    private final Clock clock;

    @Value("${app.ocpp.staleness-threshold:90s}")
    private Duration stalenessThreshold;

    @Scheduled(fixedDelayString = "${app.ocpp.stale-check-interval-ms:15000}")
    public void scheduledCheck() {
        try {
            disconnectStaleSessions();
        } catch (RuntimeException e) {
            log.error("Error during stale session check", e);
        }
    }

    public int disconnectStaleSessions() {
        Instant now = clock.instant();
        List<ChargePointSession> snapshot = new ArrayList<>(sessionManager.sessions());
        int disconnected = 0;
        for (ChargePointSession session : snapshot) {
            Duration silence = Duration.between(session.getLastActivity(), now);
            if (silence.compareTo(stalenessThreshold) > 0) {
                log.warn("[HEARTBEAT] {} silent for {}s, disconnecting", session.getChargePointId(), silence.toSeconds());
                sessionManager.forceDisconnect(session.getChargePointId(), session,
                        "No heartbeat for " + silence.toSeconds() + " seconds");
                disconnected++;
            }
        }
        if (disconnected > 0) {
            log.info("Stale session check: {} of {} sessions disconnected", disconnected, snapshot.size());
        }
        return disconnected;
    }
}
