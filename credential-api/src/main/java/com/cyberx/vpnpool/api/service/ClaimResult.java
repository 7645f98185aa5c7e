package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.entity.VpnCredential;

import java.util.List;

/**
 * Outcome of a claim. A claim never throws for lack of capacity: zero and partial
 * results are reported through {@code assignedCount} and {@code message}.
 */
public record ClaimResult(
    int assignedCount,
    String message,
    List<VpnCredential> credentials
) {

    public static ClaimResult none(String message) {
        return new ClaimResult(0, message, List.of());
    }

    public boolean isSuccess() {
        return assignedCount > 0;
    }

    public String requestBatchId() {
        return credentials.isEmpty() ? null : credentials.get(0).getRequestBatchId();
    }
}
