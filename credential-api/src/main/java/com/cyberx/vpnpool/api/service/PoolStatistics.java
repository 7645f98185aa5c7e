package com.cyberx.vpnpool.api.service;

/**
 * Pool counts. {@code assigned} excludes revoked credentials.
 */
public record PoolStatistics(
    long total,
    long available,
    long assigned,
    long revoked
) {

    static PoolStatistics of(long total, long available, long revoked) {
        return new PoolStatistics(total, available, Math.max(0, total - available - revoked), revoked);
    }
}
