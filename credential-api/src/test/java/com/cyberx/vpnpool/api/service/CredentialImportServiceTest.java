package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.cyberx.vpnpool.api.config.VpnServerProperties;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.repository.VpnCredentialRepository;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import com.cyberx.vpnpool.common.wireguard.MalformedConfigException;
import com.cyberx.vpnpool.common.wireguard.WireGuardConfigCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.cyberx.vpnpool.api.TestCredentials.ENDPOINT;
import static com.cyberx.vpnpool.api.TestCredentials.configText;
import static com.cyberx.vpnpool.api.TestCredentials.configWithoutEndpoint;
import static com.cyberx.vpnpool.api.TestCredentials.zip;
import static com.cyberx.vpnpool.api.TestCredentials.zipOfConfigs;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialImportServiceTest {

    @Mock
    private VpnCredentialRepository credentialRepository;

    @Mock
    private PoolEventPublisher eventPublisher;

    @Mock
    private PoolMetricsService metricsService;

    private final Set<String> storedHashes = new HashSet<>();
    private VpnServerProperties serverProperties;
    private CredentialImportService importService;

    @BeforeEach
    void setUp() {
        serverProperties = new VpnServerProperties();
        importService = new CredentialImportService(credentialRepository, new WireGuardConfigCodec(),
            new CredentialConfigMapper(), serverProperties, new PoolPolicyProperties(), eventPublisher, metricsService);
    }

    private void repositoryKnowsStoredHashes() {
        when(credentialRepository.existsByFileHash(anyString()))
            .thenAnswer(invocation -> storedHashes.contains(invocation.<String>getArgument(0)));
    }

    @SuppressWarnings("unchecked")
    private List<VpnCredential> captureSaved() {
        ArgumentCaptor<List<VpnCredential>> saved = ArgumentCaptor.forClass(List.class);
        verify(credentialRepository).saveAll(saved.capture());
        return saved.getValue();
    }

    private void saveAllReturnsArgument() {
        when(credentialRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testImportArchive_NewConfigs_StoresAvailableActiveCredentials() {
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();

        ImportResult result = importService.importArchive(zipOfConfigs(1, 3), null, AssignmentType.RESERVED);

        assertEquals(3, result.importedCount());
        assertEquals(0, result.skippedCount());
        assertEquals(0, result.failedCount());
        assertTrue(result.errors().isEmpty());

        List<VpnCredential> saved = captureSaved();
        assertEquals(3, saved.size());
        VpnCredential first = saved.get(0);
        assertEquals(AssignmentType.RESERVED, first.getAssignmentType());
        assertTrue(first.getIsAvailable());
        assertTrue(first.getIsActive());
        assertEquals("10.20.200.1", first.getIpv4Address());
        assertEquals("fd00:a:14:c8:1::1", first.getIpv6Local());
        assertEquals(WireGuardConfigCodec.sha256Hex(configText(1)), first.getFileHash());
        assertEquals(ENDPOINT, first.getEndpoint());
        verify(metricsService).recordImport(3, 0, 0);
    }

    @Test
    void testImportArchive_ContentAlreadyStored_SkipsWithoutError() {
        storedHashes.add(WireGuardConfigCodec.sha256Hex(configText(1)));
        storedHashes.add(WireGuardConfigCodec.sha256Hex(configText(2)));
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();

        ImportResult result = importService.importArchive(zipOfConfigs(1, 3), null, AssignmentType.USER_REQUESTABLE);

        assertEquals(1, result.importedCount());
        assertEquals(2, result.skippedCount());
        assertEquals(0, result.failedCount());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void testImportArchive_SameContentTwiceInArchive_StoresOnce() {
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("a/peer.conf", utf8(configText(9)));
        entries.put("b/peer-copy.conf", utf8(configText(9)));

        ImportResult result = importService.importArchive(zip(entries), null, AssignmentType.USER_REQUESTABLE);

        assertEquals(1, result.importedCount());
        assertEquals(1, result.skippedCount());
        assertEquals(1, captureSaved().size());
    }

    @Test
    void testImportArchive_HiddenAndBinaryEntries_AreIgnored() {
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("configs/", new byte[0]);
        entries.put(".DS_Store", utf8(configText(20)));
        entries.put("__MACOSX/configs/._peer1.conf", utf8(configText(21)));
        entries.put("configs/.hidden.conf", utf8(configText(22)));
        entries.put("configs/logo.png", new byte[]{(byte) 0x89, 'P', 'N', 'G', (byte) 0xFF, (byte) 0xD8, 0, 1});
        entries.put("configs/peer1.conf", utf8(configText(1)));

        ImportResult result = importService.importArchive(zip(entries), null, AssignmentType.USER_REQUESTABLE);

        assertEquals(1, result.importedCount());
        assertEquals(0, result.skippedCount());
        assertEquals(0, result.failedCount());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void testImportArchive_MalformedEntry_ReportedAndWalkContinues() {
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("broken.conf", utf8("[Interface]\nAddress = 10.0.0.1/32\n"));
        entries.put("good.conf", utf8(configText(3)));

        ImportResult result = importService.importArchive(zip(entries), null, AssignmentType.USER_REQUESTABLE);

        assertEquals(1, result.importedCount());
        assertEquals(1, result.failedCount());
        assertEquals(List.of("broken.conf: Invalid WireGuard config - missing required fields: PrivateKey, Endpoint"),
            result.errors());
        verify(metricsService).recordImport(1, 0, 1);
    }

    @Test
    void testImportArchive_OversizedEntry_ReportedAsFailedAndWalkContinues() {
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("huge.conf", utf8(configText(4) + "# " + "x".repeat(70_000) + "\n"));
        entries.put("good.conf", utf8(configText(5)));

        ImportResult result = importService.importArchive(zip(entries), null, AssignmentType.USER_REQUESTABLE);

        assertEquals(1, result.importedCount());
        assertEquals(1, result.failedCount());
        assertEquals(List.of("huge.conf: Entry exceeds 64KB"), result.errors());
        assertEquals("10.20.200.5", captureSaved().get(0).getIpv4Address());
    }

    @Test
    void testImportArchive_ManyMalformedEntries_ErrorsCappedAtTen() {
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < 12; i++) {
            entries.put("bad" + i + ".conf", utf8("# empty " + i + "\n"));
        }

        ImportResult result = importService.importArchive(zip(entries), null, AssignmentType.USER_REQUESTABLE);

        assertEquals(0, result.importedCount());
        assertEquals(12, result.failedCount());
        assertEquals(10, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("bad0.conf: "));
    }

    @Test
    void testImportArchive_NotAZip_ReturnsSingleErrorAndStoresNothing() {
        ImportResult result = importService.importArchive(utf8("definitely not a zip"), null,
            AssignmentType.USER_REQUESTABLE);

        assertEquals(0, result.importedCount());
        assertEquals(0, result.skippedCount());
        assertEquals(List.of("Invalid ZIP file"), result.errors());
        verifyNoInteractions(credentialRepository, eventPublisher);
    }

    @Test
    void testImportArchive_TruncatedZip_ReturnsSingleErrorAndStoresNothing() {
        byte[] archive = zipOfConfigs(1, 5);
        byte[] truncated = java.util.Arrays.copyOf(archive, archive.length / 2);
        lenient().when(credentialRepository.existsByFileHash(anyString())).thenReturn(false);

        ImportResult result = importService.importArchive(truncated, null, AssignmentType.USER_REQUESTABLE);

        assertEquals(0, result.importedCount());
        assertEquals(List.of("Invalid ZIP file"), result.errors());
        verify(credentialRepository, never()).saveAll(anyList());
    }

    @Test
    void testImportArchive_EndpointOverride_ReplacesFileEndpoint() {
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();

        importService.importArchive(zipOfConfigs(1, 1), "vpn.example.net:51820", AssignmentType.USER_REQUESTABLE);

        assertEquals("vpn.example.net:51820", captureSaved().get(0).getEndpoint());
    }

    @Test
    void testImportArchive_FileWithoutEndpoint_UsesConfiguredServerEndpoint() {
        serverProperties.setEndpoint("10.1.1.1:51820");
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("peer.conf", utf8(configWithoutEndpoint(4)));

        ImportResult result = importService.importArchive(zip(entries), null, AssignmentType.USER_REQUESTABLE);

        assertEquals(1, result.importedCount());
        assertEquals("10.1.1.1:51820", captureSaved().get(0).getEndpoint());
    }

    @Test
    void testImportArchive_FileWithoutEndpointAndNoDefault_Fails() {
        repositoryKnowsStoredHashes();
        saveAllReturnsArgument();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("peer.conf", utf8(configWithoutEndpoint(4)));

        ImportResult result = importService.importArchive(zip(entries), null, AssignmentType.USER_REQUESTABLE);

        assertEquals(0, result.importedCount());
        assertEquals(1, result.failedCount());
        assertTrue(result.errors().get(0).endsWith("missing required fields: Endpoint"));
    }

    @Test
    void testImportArchive_SomethingImported_PublishesEvent() {
        repositoryKnowsStoredHashes();
        when(credentialRepository.saveAll(anyList())).thenAnswer(invocation -> {
            List<VpnCredential> credentials = invocation.getArgument(0);
            long id = 100;
            for (VpnCredential credential : credentials) {
                credential.setId(id++);
            }
            return credentials;
        });

        importService.importArchive(zipOfConfigs(1, 2), null, AssignmentType.USER_REQUESTABLE);

        ArgumentCaptor<PoolEvent> event = ArgumentCaptor.forClass(PoolEvent.class);
        verify(eventPublisher).publish(event.capture());
        assertEquals(PoolEventType.CREDENTIALS_IMPORTED, event.getValue().eventType());
        assertEquals(List.of(100L, 101L), event.getValue().credentialIds());
    }

    @Test
    void testImportConfig_KnownContent_ReturnsEmpty() {
        when(credentialRepository.existsByFileHash(WireGuardConfigCodec.sha256Hex(configText(1)))).thenReturn(true);

        Optional<VpnCredential> result = importService.importConfig(configText(1), null, null);

        assertTrue(result.isEmpty());
        verify(credentialRepository, never()).save(any());
    }

    @Test
    void testImportConfig_Malformed_Throws() {
        assertThrows(MalformedConfigException.class,
            () -> importService.importConfig("[Peer]\nEndpoint = 1.2.3.4:5\n", null, AssignmentType.USER_REQUESTABLE));
    }

    @Test
    void testIsHidden_MatchesDotAndDoubleUnderscoreSegments() {
        assertTrue(CredentialImportService.isHidden(".env"));
        assertTrue(CredentialImportService.isHidden("__MACOSX/a.conf"));
        assertTrue(CredentialImportService.isHidden("dir/.git/config"));
        assertFalse(CredentialImportService.isHidden("dir/peer_1.conf"));
        assertFalse(CredentialImportService.isHidden("dir_/peer.conf"));
    }
}
