package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.cyberx.vpnpool.api.config.VpnServerProperties;
import com.cyberx.vpnpool.api.entity.AppSetting;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.api.repository.AppSettingRepository;
import com.cyberx.vpnpool.common.wireguard.ServerDefaults;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runtime settings stored in {@code app_settings}.
 *
 * Values are read on every call; nothing is cached here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AppSettingService {

    public static final String NAMING_PATTERN_KEY = "vpn_naming_pattern";
    public static final String SERVER_PUBLIC_KEY = "vpn_server_public_key";
    public static final String DNS_SERVERS_KEY = "vpn_dns_servers";
    public static final String ALLOWED_IPS_KEY = "vpn_allowed_ips";
    public static final String MTU_KEY = "vpn_mtu";

    private static final List<String> SERVER_KEYS =
        List.of(SERVER_PUBLIC_KEY, DNS_SERVERS_KEY, ALLOWED_IPS_KEY, MTU_KEY);

    static final int MAX_PATTERN_LENGTH = 255;

    private final AppSettingRepository appSettingRepository;
    private final VpnServerProperties vpnServerProperties;
    private final PoolPolicyProperties poolPolicyProperties;

    @Transactional(readOnly = true)
    public String getNamingPattern() {
        return appSettingRepository.findById(NAMING_PATTERN_KEY)
            .map(AppSetting::getValue)
            .filter(StringUtils::hasText)
            .orElse(poolPolicyProperties.getDefaultNamingPattern());
    }

    @Transactional
    public String setNamingPattern(String pattern, String updatedBy) {
        if (!StringUtils.hasText(pattern)) {
            throw new BadRequestException("Naming pattern is required");
        }
        String trimmed = pattern.strip();
        if (trimmed.length() > MAX_PATTERN_LENGTH) {
            throw new BadRequestException("Naming pattern must not exceed " + MAX_PATTERN_LENGTH + " characters");
        }
        upsert(NAMING_PATTERN_KEY, trimmed, "Filename pattern for downloaded VPN configs", updatedBy);
        log.info("Naming pattern set to '{}' by {}", trimmed, updatedBy);
        return trimmed;
    }

    /**
     * Server defaults for config generation: stored settings first, then
     * {@code vpn.server.*} properties, then the given overrides on top.
     *
     * @param overrides per-call values, may be null
     */
    @Transactional(readOnly = true)
    public ServerDefaults resolveServerDefaults(ServerDefaults overrides) {
        Map<String, String> stored = storedServerSettings();
        ServerDefaults fromSettings = new ServerDefaults(
            stored.get(SERVER_PUBLIC_KEY),
            stored.get(DNS_SERVERS_KEY),
            stored.get(ALLOWED_IPS_KEY),
            stored.get(MTU_KEY)
        );
        return vpnServerProperties.toServerDefaults()
            .withOverrides(fromSettings)
            .withOverrides(overrides);
    }

    @Transactional
    public ServerDefaults updateServerDefaults(ServerDefaults values, String updatedBy) {
        if (values.publicKey() != null) {
            upsert(SERVER_PUBLIC_KEY, values.publicKey().strip(), "WireGuard server public key", updatedBy);
        }
        if (values.dnsServers() != null) {
            upsert(DNS_SERVERS_KEY, values.dnsServers().strip(), "DNS servers for generated configs", updatedBy);
        }
        if (values.allowedIps() != null) {
            upsert(ALLOWED_IPS_KEY, values.allowedIps().strip(), "AllowedIPs for generated configs", updatedBy);
        }
        if (values.mtu() != null) {
            String mtu = values.mtu().strip();
            if (!mtu.isEmpty() && !mtu.chars().allMatch(Character::isDigit)) {
                throw new BadRequestException("MTU must be a number");
            }
            upsert(MTU_KEY, mtu, "MTU for generated configs", updatedBy);
        }
        log.info("Server defaults updated by {}", updatedBy);
        return resolveServerDefaults(null);
    }

    private Map<String, String> storedServerSettings() {
        return appSettingRepository.findByKeyIn(SERVER_KEYS).stream()
            .filter(setting -> StringUtils.hasText(setting.getValue()))
            .collect(Collectors.toMap(AppSetting::getKey, AppSetting::getValue, (a, b) -> a));
    }

    private void upsert(String key, String value, String description, String updatedBy) {
        AppSetting setting = appSettingRepository.findById(key).orElseGet(() -> {
            AppSetting created = new AppSetting(key, value, description);
            created.setCreatedBy(updatedBy);
            return created;
        });
        setting.setValue(value);
        appSettingRepository.save(setting);
    }
}
