package com.cyberx.vpnpool.common.wireguard;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured form of a single WireGuard peer config.
 *
 * Optional fields stay null when the source text did not contain them. A field that
 * was present with no value is kept as the empty string. On regeneration a null field
 * falls back to the server default, while an empty one is left out entirely.
 */
@Data
@NoArgsConstructor
public class WireGuardConfig {

    // [Interface]
    private String privateKey;
    private List<String> addresses = new ArrayList<>();
    private String dns;
    private String mtu;
    private String table;
    private String saveConfig;
    private String fwMark;

    // [Peer]
    private String publicKey;
    private String presharedKey;
    private String endpoint;
    private String allowedIps;
    private String persistentKeepalive;

    // Derived from addresses
    private String ipv4Address;
    private String ipv6Local;
    private String ipv6Global;

    /**
     * Address list in its stored form: comma-joined, no spaces.
     */
    public String getInterfaceIp() {
        return String.join(",", addresses);
    }

    public void setInterfaceIp(String interfaceIp) {
        addresses = new ArrayList<>();
        if (interfaceIp == null || interfaceIp.isBlank()) {
            return;
        }
        for (String part : interfaceIp.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                addresses.add(trimmed);
            }
        }
    }
}
