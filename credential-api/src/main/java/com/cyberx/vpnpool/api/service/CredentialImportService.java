package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.cyberx.vpnpool.api.config.VpnServerProperties;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.repository.VpnCredentialRepository;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import com.cyberx.vpnpool.common.pool.RequesterKind;
import com.cyberx.vpnpool.common.wireguard.MalformedConfigException;
import com.cyberx.vpnpool.common.wireguard.WireGuardConfig;
import com.cyberx.vpnpool.common.wireguard.WireGuardConfigCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Bulk import of WireGuard configs from a ZIP archive.
 *
 * <p>Entries are processed independently: a malformed file is reported and the walk
 * continues. Content already in the pool (same SHA-256 of the raw text) is skipped
 * without error, so importing the same archive twice stores nothing the second time.
 * An archive that cannot be read at all stores nothing and reports one error.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialImportService {

    static final String INVALID_ARCHIVE_MESSAGE = "Invalid ZIP file";

    private static final String ENDPOINT_FIELD = "Endpoint";

    private final VpnCredentialRepository credentialRepository;
    private final WireGuardConfigCodec configCodec;
    private final CredentialConfigMapper configMapper;
    private final VpnServerProperties vpnServerProperties;
    private final PoolPolicyProperties poolPolicyProperties;
    private final PoolEventPublisher eventPublisher;
    private final PoolMetricsService metricsService;

    /**
     * Import every config in the archive.
     *
     * @param archive ZIP bytes
     * @param endpointOverride endpoint written into every imported credential, may be null
     * @param assignmentType pool class for the new credentials
     */
    @Transactional
    public ImportResult importArchive(byte[] archive, String endpointOverride, AssignmentType assignmentType) {
        if (assignmentType == null) {
            assignmentType = AssignmentType.USER_REQUESTABLE;
        }
        if (!looksLikeZip(archive)) {
            log.warn("Rejected import: payload is not a ZIP archive");
            return ImportResult.invalidArchive();
        }

        List<VpnCredential> toSave = new ArrayList<>();
        Set<String> seenHashes = new HashSet<>();
        List<String> errors = new ArrayList<>();
        int skipped = 0;
        int failed = 0;

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName();
                if (entry.isDirectory() || isHidden(name)) {
                    continue;
                }

                int maxEntryBytes = poolPolicyProperties.getMaxEntryBytes();
                byte[] bytes = zip.readNBytes(maxEntryBytes + 1);
                if (bytes.length > maxEntryBytes) {
                    failed++;
                    errors.add(name + ": Entry exceeds " + (maxEntryBytes / 1024) + "KB");
                    log.warn("Skipping oversized archive entry {}", name);
                    continue;
                }

                Optional<String> text = decode(bytes);
                if (text.isEmpty()) {
                    log.debug("Skipping non-text archive entry {}", name);
                    continue;
                }

                String content = text.get();
                String fileHash = WireGuardConfigCodec.sha256Hex(content);
                if (seenHashes.contains(fileHash) || credentialRepository.existsByFileHash(fileHash)) {
                    skipped++;
                    continue;
                }

                try {
                    WireGuardConfig config = parse(content, endpointOverride);
                    toSave.add(configMapper.toNewCredential(config, fileHash, assignmentType));
                    seenHashes.add(fileHash);
                } catch (MalformedConfigException e) {
                    failed++;
                    errors.add(name + ": " + e.getMessage());
                    log.warn("Skipping malformed config {}: {}", name, e.getMessage());
                }
            }
        } catch (ZipException e) {
            log.warn("Rejected import: corrupt ZIP archive ({})", e.getMessage());
            return ImportResult.invalidArchive();
        } catch (IOException e) {
            log.warn("Rejected import: failed to read ZIP archive", e);
            return ImportResult.invalidArchive();
        }

        List<VpnCredential> saved = credentialRepository.saveAll(toSave);
        metricsService.recordImport(saved.size(), skipped, failed);
        if (!saved.isEmpty()) {
            eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIALS_IMPORTED, null, null,
                saved.stream().map(VpnCredential::getId).toList(), null,
                Map.of("assignmentType", assignmentType.name(), "skippedCount", skipped, "failedCount", failed)));
        }

        log.info("Imported {} {} credentials ({} duplicates skipped, {} failed)",
            saved.size(), assignmentType, skipped, failed);
        return new ImportResult(saved.size(), skipped, failed, limit(errors));
    }

    /**
     * Import a single config text, for uploads of one {@code .conf} file.
     *
     * @return the stored credential, or empty when the content is already in the pool
     */
    @Transactional
    public Optional<VpnCredential> importConfig(String text, String endpointOverride, AssignmentType assignmentType) {
        String fileHash = WireGuardConfigCodec.sha256Hex(text);
        if (credentialRepository.existsByFileHash(fileHash)) {
            log.info("Config already in pool (hash {}), skipping", fileHash);
            return Optional.empty();
        }
        WireGuardConfig config = parse(text, endpointOverride);
        AssignmentType type = assignmentType != null ? assignmentType : AssignmentType.USER_REQUESTABLE;
        VpnCredential saved = credentialRepository.save(configMapper.toNewCredential(config, fileHash, type));
        metricsService.recordImport(1, 0, 0);
        eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIALS_IMPORTED, null, null,
            List.of(saved.getId()), null, Map.of("assignmentType", type.name())));
        log.info("Imported VPN {} ({})", saved.getId(), saved.getIpv4Address());
        return Optional.of(saved);
    }

    private WireGuardConfig parse(String text, String endpointOverride) {
        String override = StringUtils.hasText(endpointOverride) ? endpointOverride.strip() : null;
        try {
            return configCodec.parse(text, override);
        } catch (MalformedConfigException e) {
            String serverEndpoint = vpnServerProperties.getEndpoint();
            if (override == null && StringUtils.hasText(serverEndpoint)
                    && e.getMissingFields().equals(List.of(ENDPOINT_FIELD))) {
                return configCodec.parse(text, serverEndpoint);
            }
            throw e;
        }
    }

    private List<String> limit(List<String> errors) {
        int max = poolPolicyProperties.getMaxReportedErrors();
        return errors.size() > max ? List.copyOf(errors.subList(0, max)) : errors;
    }

    static boolean isHidden(String entryName) {
        for (String segment : entryName.split("/")) {
            if (segment.startsWith(".") || segment.startsWith("__")) {
                return true;
            }
        }
        return false;
    }

    private static Optional<String> decode(byte[] bytes) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    // Local file header or empty-archive end record
    private static boolean looksLikeZip(byte[] bytes) {
        if (bytes == null || bytes.length < 4 || bytes[0] != 'P' || bytes[1] != 'K') {
            return false;
        }
        return (bytes[2] == 3 && bytes[3] == 4) || (bytes[2] == 5 && bytes[3] == 6);
    }
}
