package com.cyberx.vpnpool.api.repository;

import java.time.LocalDateTime;

/**
 * Projection for {@link VpnCredentialRepository#findRequestBatchesByUserId(Long)}.
 */
public interface RequestBatchSummary {

    String getBatchId();

    LocalDateTime getRequestedAt();

    Long getCredentialCount();
}
