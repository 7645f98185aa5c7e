package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.common.naming.FilenamePatternFormatter;
import com.cyberx.vpnpool.common.naming.Requester;
import com.cyberx.vpnpool.common.wireguard.ServerDefaults;
import com.cyberx.vpnpool.common.wireguard.WireGuardConfigCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Renders credentials back to config files for download.
 *
 * <p>A bulk export is a ZIP with one {@code .conf} per credential, named by the global
 * naming pattern, plus a {@code SHA256SUMS} manifest when at least one credential has a
 * recorded file hash. Manifest lines are {@code "<hash>  <filename>"}.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialExportService {

    public static final String MANIFEST_NAME = "SHA256SUMS";

    private final WireGuardConfigCodec configCodec;
    private final FilenamePatternFormatter filenameFormatter;
    private final CredentialConfigMapper configMapper;
    private final AppSettingService appSettingService;

    public String renderConfig(VpnCredential credential) {
        return renderConfig(credential, appSettingService.resolveServerDefaults(null));
    }

    public String renderConfig(VpnCredential credential, ServerDefaults defaults) {
        return configCodec.generate(configMapper.toConfig(credential), defaults);
    }

    public String filenameFor(VpnCredential credential, Requester requester, Integer index) {
        return filenameFormatter.format(appSettingService.getNamingPattern(), credential, requester, index);
    }

    public byte[] exportZip(List<VpnCredential> credentials, Requester requester) {
        return exportZip(credentials, requester, null);
    }

    /**
     * @param namingPattern filename pattern for this export only; blank uses the global pattern
     */
    public byte[] exportZip(List<VpnCredential> credentials, Requester requester, String namingPattern) {
        ServerDefaults defaults = appSettingService.resolveServerDefaults(null);
        String pattern = resolvePattern(namingPattern);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        StringBuilder manifest = new StringBuilder();
        Set<String> usedNames = new HashSet<>();

        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            int index = 1;
            for (VpnCredential credential : credentials) {
                String filename = uniqueName(
                    filenameFormatter.format(pattern, credential, requester, index), index, usedNames);
                writeEntry(zip, filename, renderConfig(credential, defaults));
                if (credential.getFileHash() != null) {
                    manifest.append(credential.getFileHash()).append("  ").append(filename).append('\n');
                }
                index++;
            }
            if (manifest.length() > 0) {
                writeEntry(zip, MANIFEST_NAME, manifest.toString());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build config archive", e);
        }

        log.info("Exported {} VPN configs", credentials.size());
        return bytes.toByteArray();
    }

    public static String batchArchiveName(String batchId) {
        String prefix = batchId.length() > 8 ? batchId.substring(0, 8) : batchId;
        return "vpn_batch_" + prefix + ".zip";
    }

    private String resolvePattern(String namingPattern) {
        if (!StringUtils.hasText(namingPattern)) {
            return appSettingService.getNamingPattern();
        }
        String pattern = namingPattern.strip();
        if (pattern.length() > AppSettingService.MAX_PATTERN_LENGTH) {
            throw new BadRequestException("Naming pattern must not exceed "
                + AppSettingService.MAX_PATTERN_LENGTH + " characters");
        }
        return pattern;
    }

    private static String uniqueName(String filename, int index, Set<String> usedNames) {
        String candidate = filename;
        String base = filename.substring(0, filename.length() - FilenamePatternFormatter.EXTENSION.length());
        int suffix = index;
        while (usedNames.contains(candidate)) {
            candidate = base + "_" + suffix++ + FilenamePatternFormatter.EXTENSION;
        }
        usedNames.add(candidate);
        return candidate;
    }

    private static void writeEntry(ZipOutputStream zip, String name, String content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }
}
