package com.example.ocppcentral.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionRegistryTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @InjectMocks
    private ConnectionRegistry connectionRegistry;

    @Test
    void testPut_StoresConnectedAtUnderPrefixedKey() {
        Instant connectedAt = Instant.parse("2024-05-01T10:00:00Z");
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        assertThat(connectionRegistry.put("CP-1", connectedAt)).isTrue();

        verify(valueOperations).set("charger_connection:CP-1", "2024-05-01T10:00:00Z");
    }

    @Test
    void testPut_RedisFailureReturnsFalse() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set("charger_connection:CP-1", "2024-05-01T10:00:00Z");

        assertThat(connectionRegistry.put("CP-1", Instant.parse("2024-05-01T10:00:00Z"))).isFalse();
    }

    @Test
    void testExists_RedisFailureIsConservative() {
        when(redisTemplate.hasKey("charger_connection:CP-1")).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(connectionRegistry.exists("CP-1")).isFalse();
    }

    @Test
    void testListAll_StripsPrefix() {
        when(redisTemplate.keys("charger_connection:*"))
                .thenReturn(Set.of("charger_connection:CP-1", "charger_connection:CP-2"));

        assertThat(connectionRegistry.listAll()).containsExactlyInAnyOrder("CP-1", "CP-2");
    }

    @Test
    void testListAll_RedisFailureReturnsEmpty() {
        when(redisTemplate.keys("charger_connection:*")).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(connectionRegistry.listAll()).isEmpty();
    }

    @Test
    void testConnectedAt() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("charger_connection:CP-1")).thenReturn("2024-05-01T10:00:00Z");
        when(valueOperations.get("charger_connection:CP-2")).thenReturn("garbage");
        when(valueOperations.get("charger_connection:CP-3")).thenReturn(null);

        assertThat(connectionRegistry.connectedAt("CP-1")).contains(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(connectionRegistry.connectedAt("CP-2")).isEmpty();
        assertThat(connectionRegistry.connectedAt("CP-3")).isEmpty();
    }
}
