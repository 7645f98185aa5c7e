package com.cyberx.vpnpool.api.integration;

import com.cyberx.vpnpool.api.service.CredentialImportService;
import com.cyberx.vpnpool.api.service.ImportResult;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static com.cyberx.vpnpool.api.TestCredentials.zipOfConfigs;
import static org.junit.jupiter.api.Assertions.*;

class CredentialImportIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private CredentialImportService importService;

    @Test
    void testImportArchive_Twice_SecondPassSkipsEverything() {
        byte[] archive = zipOfConfigs(1, 5);

        ImportResult first = importService.importArchive(archive, null, AssignmentType.USER_REQUESTABLE);
        ImportResult second = importService.importArchive(archive, null, AssignmentType.USER_REQUESTABLE);

        assertEquals(5, first.importedCount());
        assertEquals(0, second.importedCount());
        assertEquals(first.importedCount(), second.skippedCount());
        assertEquals(5, credentialRepository.count());
    }

    @Test
    void testImportArchive_OverlappingArchives_StoresUnion() {
        importService.importArchive(zipOfConfigs(1, 4), null, AssignmentType.USER_REQUESTABLE);

        ImportResult result = importService.importArchive(zipOfConfigs(3, 4), null, AssignmentType.RESERVED);

        assertEquals(2, result.importedCount());
        assertEquals(2, result.skippedCount());
        assertEquals(6, credentialRepository.count());
        assertEquals(2, credentialRepository.countByAssignmentType(AssignmentType.RESERVED));
    }
}
