package com.example.ocppcentral.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Cross-instance record of which charge points hold a connection, kept in Redis
 * as {@code charger_connection:<id> -> connectedAt}. A hint, not proof of liveness:
 * every failure is logged and answered with the conservative default.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    static final String KEY_PREFIX = "charger_connection:";

    private final StringRedisTemplate redisTemplate;

    public boolean put(String chargePointId, Instant connectedAt) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + chargePointId, connectedAt.toString());
            log.debug("Registered connection for {} at {}", chargePointId, connectedAt);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to register connection for {} in Redis", chargePointId, e);
            return false;
        }
    }

    public boolean delete(String chargePointId) {
        try {
            redisTemplate.delete(KEY_PREFIX + chargePointId);
            log.debug("Removed connection record for {}", chargePointId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to remove connection record for {} from Redis", chargePointId, e);
            return false;
        }
    }

    public boolean exists(String chargePointId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + chargePointId));
        } catch (RuntimeException e) {
            log.error("Failed to check connection record for {} in Redis", chargePointId, e);
            return false;
        }
    }

    /**
     * Charge point ids currently recorded, in a single round trip.
     */
    public Set<String> listAll() {
        try {
            Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
            if (keys == null || keys.isEmpty()) {
                return Collections.emptySet();
            }
            Set<String> ids = new HashSet<>();
            for (String key : keys) {
                ids.add(key.substring(KEY_PREFIX.length()));
            }
            return ids;
        } catch (RuntimeException e) {
            log.error("Failed to list connection records from Redis", e);
            return Collections.emptySet();
        }
    }

    public Optional<Instant> connectedAt(String chargePointId) {
        try {
            String value = redisTemplate.opsForValue().get(KEY_PREFIX + chargePointId);
            return value == null ? Optional.empty() : Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            log.warn("Unreadable connectedAt for {}: {}", chargePointId, e.getParsedString());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Failed to read connection record for {} from Redis", chargePointId, e);
            return Optional.empty();
        }
    }
}
