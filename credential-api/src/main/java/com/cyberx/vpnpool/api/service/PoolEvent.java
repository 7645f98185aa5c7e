package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.common.pool.RequesterKind;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Pool state change published to Kafka for the audit and notification services.
 * Never carries key material.
 */
public record PoolEvent(
    PoolEventType eventType,
    RequesterKind requesterKind,
    Long requesterId,
    List<Long> credentialIds,
    String requestBatchId,
    Map<String, Object> details,
    LocalDateTime occurredAt
) {

    public static PoolEvent of(PoolEventType type, RequesterKind kind, Long requesterId,
                               List<Long> credentialIds, String batchId, Map<String, Object> details) {
        return new PoolEvent(type, kind, requesterId, List.copyOf(credentialIds), batchId,
            details != null ? Map.copyOf(details) : Map.of(), LocalDateTime.now(ZoneOffset.UTC));
    }
}
