package com.cyberx.vpnpool.api.dto;

import com.cyberx.vpnpool.api.repository.RequestBatchSummary;

import java.time.LocalDateTime;

public record RequestBatchResponse(
    String batchId,
    LocalDateTime requestedAt,
    long credentialCount
) {

    public static RequestBatchResponse from(RequestBatchSummary summary) {
        return new RequestBatchResponse(
            summary.getBatchId(),
            summary.getRequestedAt(),
            summary.getCredentialCount() != null ? summary.getCredentialCount() : 0L
        );
    }
}
