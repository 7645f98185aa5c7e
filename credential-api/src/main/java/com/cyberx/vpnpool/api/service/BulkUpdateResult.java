package com.cyberx.vpnpool.api.service;

import java.util.List;

/**
 * @param successCount credentials whose assignment type changed
 * @param skippedCount credentials that already had the requested type
 * @param errors first few {@code "VPN <id>: <reason>"} strings
 */
public record BulkUpdateResult(
    int successCount,
    int skippedCount,
    List<String> errors
) {
}
