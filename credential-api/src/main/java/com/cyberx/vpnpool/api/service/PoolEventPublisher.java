package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Publishes pool events to Kafka once the change that produced them is committed.
 *
 * A rolled-back claim or import publishes nothing. Publish failures are logged and
 * never reach the caller: the allocation already happened and stays valid.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final PoolPolicyProperties poolPolicyProperties;

    public void publish(PoolEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(event);
                }
            });
        } else {
            send(event);
        }
    }

    private void send(PoolEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize pool event {}", event.eventType(), e);
            return;
        }

        String key = event.requestBatchId() != null
            ? event.requestBatchId()
            : event.eventType().name();
        try {
            kafkaTemplate.send(poolPolicyProperties.getEventsTopic(), key, payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish pool event {} for credentials {}",
                            event.eventType(), event.credentialIds(), ex);
                    } else {
                        log.debug("Published pool event {} for credentials {}",
                            event.eventType(), event.credentialIds());
                    }
                });
        } catch (RuntimeException e) {
            log.error("Kafka rejected pool event {} for credentials {}",
                event.eventType(), event.credentialIds(), e);
        }
    }
}
