package com.cyberx.vpnpool.api.service;

import java.util.List;

public record BulkAssignResult(
    int successCount,
    List<Long> failedUserIds,
    List<String> errors
) {
}
