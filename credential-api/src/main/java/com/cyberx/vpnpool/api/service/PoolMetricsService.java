package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.common.pool.AssignmentType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Prometheus metrics for the credential pool.
 *
 * Tracks:
 * - credentials assigned, per assignment type
 * - claims that found no capacity, claims that were only partly served
 * - import entries by outcome (imported / duplicate / failed)
 *
 * Exposed at /actuator/prometheus. Counters are created once in @PostConstruct.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolMetricsService {

    private final MeterRegistry meterRegistry;

    private final Map<AssignmentType, Counter> assignedCounters = new EnumMap<>(AssignmentType.class);
    private Counter noCapacityCounter;
    private Counter partialClaimCounter;
    private Counter importedCounter;
    private Counter duplicateCounter;
    private Counter failedEntryCounter;

    @PostConstruct
    void init() {
        for (AssignmentType type : AssignmentType.values()) {
            assignedCounters.put(type, Counter.builder("vpnpool.credentials.assigned")
                .description("Credentials handed out by the pool allocator")
                .tag("assignment_type", type.name())
                .register(meterRegistry));
        }
        noCapacityCounter = Counter.builder("vpnpool.claims.no_capacity")
            .description("Claims that found no available credential")
            .register(meterRegistry);
        partialClaimCounter = Counter.builder("vpnpool.claims.partial")
            .description("Claims served with fewer credentials than requested")
            .register(meterRegistry);
        importedCounter = importCounter("imported");
        duplicateCounter = importCounter("duplicate");
        failedEntryCounter = importCounter("failed");
        log.info("Initialized pool metrics for {} assignment types", AssignmentType.values().length);
    }

    public void recordClaim(AssignmentType type, int requested, int assigned) {
        if (assigned == 0) {
            noCapacityCounter.increment();
            return;
        }
        assignedCounters.get(type).increment(assigned);
        if (assigned < requested) {
            partialClaimCounter.increment();
        }
    }

    public void recordImport(int imported, int duplicates, int failed) {
        importedCounter.increment(imported);
        duplicateCounter.increment(duplicates);
        failedEntryCounter.increment(failed);
    }

    private Counter importCounter(String outcome) {
        return Counter.builder("vpnpool.import.entries")
            .description("Archive entries processed by the import pipeline")
            .tag("outcome", outcome)
            .register(meterRegistry);
    }
}
