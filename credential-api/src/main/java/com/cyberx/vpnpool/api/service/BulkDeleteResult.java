package com.cyberx.vpnpool.api.service;

import java.util.List;

public record BulkDeleteResult(
    int deletedCount,
    List<Long> failedIds,
    List<String> errors
) {
}
