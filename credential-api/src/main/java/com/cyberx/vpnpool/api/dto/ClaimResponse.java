package com.cyberx.vpnpool.api.dto;

import com.cyberx.vpnpool.api.service.ClaimResult;

import java.util.List;

public record ClaimResponse(
    boolean success,
    int assignedCount,
    String message,
    String requestBatchId,
    List<VpnCredentialResponse> credentials
) {

    public static ClaimResponse from(ClaimResult result) {
        return new ClaimResponse(
            result.isSuccess(),
            result.assignedCount(),
            result.message(),
            result.requestBatchId(),
            result.credentials().stream().map(VpnCredentialResponse::from).toList()
        );
    }
}
