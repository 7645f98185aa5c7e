package com.cyberx.vpnpool.api.service;

import java.util.List;

/**
 * Outcome of an archive import.
 *
 * @param importedCount new credentials stored
 * @param skippedCount entries whose content hash was already in the pool (or earlier in the same archive)
 * @param failedCount entries that could not be parsed
 * @param errors first few {@code "<entryName>: <reason>"} strings
 */
public record ImportResult(
    int importedCount,
    int skippedCount,
    int failedCount,
    List<String> errors
) {

    public static ImportResult invalidArchive() {
        return new ImportResult(0, 0, 0, List.of(CredentialImportService.INVALID_ARCHIVE_MESSAGE));
    }
}
