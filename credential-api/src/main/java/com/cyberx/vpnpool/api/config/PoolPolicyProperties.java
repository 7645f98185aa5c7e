package com.cyberx.vpnpool.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Allocation and reporting limits for the credential pool.
 *
 * Maps to:
 * vpn:
 *   pool:
 *     max-per-request: 25
 *     max-reported-errors: 10
 *     max-entry-bytes: 65536
 *     default-naming-pattern: simnet_{ipv4_address}.conf
 *     events-topic: vpn-credential-events
 */
@ConfigurationProperties(prefix = "vpn.pool")
@Data
public class PoolPolicyProperties {

    /**
     * Self-service requests above this are truncated, not rejected.
     */
    private int maxPerRequest = 25;

    /**
     * Bulk operations return at most this many error strings.
     */
    private int maxReportedErrors = 10;

    /**
     * Archive entries larger than this are reported as failed instead of being read.
     */
    private int maxEntryBytes = 64 * 1024;

    private String defaultNamingPattern = "simnet_{ipv4_address}.conf";

    private String eventsTopic = "vpn-credential-events";
}
