package com.example.ocppcentral.service;

import com.example.ocppcentral.model.MessageDirection;
import com.example.ocppcentral.model.OcppLog;
import com.example.ocppcentral.ocpp.OcppCodec;
import com.example.ocppcentral.repository.OcppLogRepository;
import com.example.ocppcentral.websocket.MessageAuditSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Persists every frame exchanged with a charge point.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageLogService implements MessageAuditSink {

    private final OcppLogRepository ocppLogRepository;
    private final OcppCodec codec;
    private final Clock clock;

    @Override
    public void record(String chargePointId, MessageDirection direction, String rawFrame) {
        ocppLogRepository.save(OcppLog.builder()
                .chargePointId(chargePointId)
                .direction(direction)
                .messageType("OCPP")
                .payload(rawFrame)
                .status(direction == MessageDirection.IN ? "received" : "sent")
                .correlationId(codec.correlationIdOf(rawFrame))
                .timestamp(clock.instant())
                .build());
    }

    public List<OcppLog> recent(int limit) {
        return ocppLogRepository.findAllByOrderByTimestampDesc(PageRequest.of(0, limit));
    }

    public List<OcppLog> recentForChargePoint(String chargePointId, int limit) {
        return ocppLogRepository.findByChargePointIdOrderByTimestampDesc(chargePointId, PageRequest.of(0, limit));
    }

    @Transactional
    public int purgeOlderThan(Instant cutoff) {
        int deleted = ocppLogRepository.deleteOlderThan(cutoff);
        log.info("Purged {} OCPP log entries older than {}", deleted, cutoff);
        return deleted;
    }
}
