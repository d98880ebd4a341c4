package com.example.ocppcentral.service;

import com.example.ocppcentral.model.Charger;
import com.example.ocppcentral.repository.ChargerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Answers "is this charger connected" for listings. A charger counts as
 * connected only when it is in the registry and its last heartbeat is
 * within the staleness threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionStatusService {

    private final ConnectionRegistry connectionRegistry;
    private final ChargerRepository chargerRepository;
    private final ChargePointSessionManager sessionManager;
    private final Clock clock;

    @Value("${app.ocpp.staleness-threshold:90s}")
    private Duration stalenessThreshold;

    public Map<String, Boolean> bulkConnectionStatus(Collection<Charger> chargers) {
        if (chargers.isEmpty()) {
            return Collections.emptyMap();
        }
        Set<String> registered = connectionRegistry.listAll();
        Instant now = clock.instant();

        Map<String, Boolean> status = new LinkedHashMap<>();
        for (Charger charger : chargers) {
            String chargePointId = charger.getChargePointId();
            status.put(chargePointId, registered.contains(chargePointId) && isHeartbeatFresh(charger, now));
        }
        log.debug("Resolved connection status for {} chargers ({} in registry)", chargers.size(), registered.size());
        return status;
    }

    public Map<String, Boolean> bulkConnectionStatusByIds(Collection<Long> chargerIds) {
        return bulkConnectionStatus(chargerRepository.findAllById(chargerIds));
    }

    public boolean isConnected(String chargePointId) {
        return sessionManager.isConnected(chargePointId);
    }

    public boolean isHeartbeatFresh(Charger charger) {
        return isHeartbeatFresh(charger, clock.instant());
    }

    private boolean isHeartbeatFresh(Charger charger, Instant now) {
        Instant lastHeartbeat = charger.getLastHeartbeatTime();
        return lastHeartbeat != null && Duration.between(lastHeartbeat, now).compareTo(stalenessThreshold) <= 0;
    }
}
